package com.exthost.core.exception;

import com.exthost.api.exception.ExtHostException;
import lombok.Getter;

/**
 * 单个插件的初始化或加载失败，只影响该插件
 */
@Getter
public class PluginLoadException extends ExtHostException {

    private final String pluginId;

    public PluginLoadException(String pluginId, String message, Throwable cause) {
        super("Plugin [" + pluginId + "] " + message, cause);
        this.pluginId = pluginId;
    }
}
