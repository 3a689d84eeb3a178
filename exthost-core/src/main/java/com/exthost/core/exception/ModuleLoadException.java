package com.exthost.core.exception;

import com.exthost.api.exception.ExtHostException;
import lombok.Getter;

/**
 * 模块 (插件入口或初始化模块) 加载失败
 */
@Getter
public class ModuleLoadException extends ExtHostException {

    private final String path;

    public ModuleLoadException(String path, String message) {
        super("Failed to load module [" + path + "]: " + message);
        this.path = path;
    }

    public ModuleLoadException(String path, String message, Throwable cause) {
        super("Failed to load module [" + path + "]: " + message, cause);
        this.path = path;
    }
}
