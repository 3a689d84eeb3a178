package com.exthost.core.plugin;

import com.exthost.api.plugin.Plugin;

/**
 * 插件管理器内部事件
 * 注意：只在宿主进程内发布，不经过 RPC
 */
public sealed interface PluginEvent {

    String pluginId();

    /**
     * 已分桶
     */
    record Partitioned(String pluginId, boolean backend) implements PluginEvent {
    }

    /**
     * 初始化钩子已执行
     */
    record Initialized(String pluginId, String initPath) implements PluginEvent {
    }

    /**
     * 入口模块已加载
     */
    record Loaded(String pluginId, Plugin plugin) implements PluginEvent {
    }

    /**
     * 初始化或加载失败
     */
    record LoadFailed(String pluginId, String pluginPath, Throwable cause) implements PluginEvent {
    }

    /**
     * 已停止
     */
    record Stopped(String pluginId) implements PluginEvent {
    }
}
