package com.exthost.api.plugin;

import org.jspecify.annotations.Nullable;

/**
 * 单个插件的加载结果
 *
 * @param pluginId   插件标识
 * @param pluginPath 入口路径
 * @param status     加载状态
 * @param error      失败原因，成功时为 null
 */
public record PluginLoadResult(String pluginId,
                               String pluginPath,
                               Status status,
                               @Nullable String error) {

    public enum Status {
        LOADED,
        LOAD_FAILED
    }

    public static PluginLoadResult loaded(Plugin plugin) {
        return new PluginLoadResult(plugin.pluginId(), plugin.pluginPath(), Status.LOADED, null);
    }

    public static PluginLoadResult failed(String pluginId, String pluginPath, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new PluginLoadResult(pluginId, pluginPath, Status.LOAD_FAILED, reason);
    }

    public boolean succeeded() {
        return status == Status.LOADED;
    }
}
