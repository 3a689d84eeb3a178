package com.exthost.api.rpc;

import com.exthost.api.plugin.PluginManagerExt;

/**
 * 宿主进程暴露给主进程的对象标识
 */
public final class MainRpcContext {

    public static final ProxyIdentifier<PluginManagerExt> HOSTED_PLUGIN_MANAGER_EXT =
            ProxyIdentifier.of("HOSTED_PLUGIN_MANAGER_EXT", PluginManagerExt.class);

    private MainRpcContext() {
    }
}
