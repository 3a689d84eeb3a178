package com.exthost.api.plugin;

import com.exthost.api.context.PluginContext;

/**
 * 插件入口模块可导出的生命周期接口
 * 入口模块加载后调用 onStart，宿主停止时调用 onStop
 *
 * @author exthost
 */
public interface HostedPlugin {

    default void onStart(PluginContext context) {
        // Default empty implementation
    }

    default void onStop(PluginContext context) {
        // Default empty implementation
    }
}
