package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

/**
 * 插件生命周期钩子声明
 *
 * @param backendInitPath  后端初始化模块路径 (可选)
 * @param frontendInitPath 前端初始化模块路径 (可选)
 */
public record PluginLifecycle(@Nullable String backendInitPath, @Nullable String frontendInitPath) {

    public static PluginLifecycle none() {
        return new PluginLifecycle(null, null);
    }

    public static PluginLifecycle backendInit(String path) {
        return new PluginLifecycle(path, null);
    }
}
