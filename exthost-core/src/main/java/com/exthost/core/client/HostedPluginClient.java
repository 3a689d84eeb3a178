package com.exthost.core.client;

import com.exthost.api.plugin.InitResult;
import com.exthost.api.plugin.Plugin;
import com.exthost.api.plugin.PluginDescriptor;
import com.exthost.api.plugin.PluginLoadResult;
import com.exthost.api.plugin.PluginManagerExt;
import com.exthost.api.rpc.MainRpcContext;
import com.exthost.api.rpc.RpcProtocol;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 主进程侧驱动
 * <p>
 * 通过 HOSTED_PLUGIN_MANAGER_EXT 代理完成两阶段启动：
 * 先 init 分桶，再按顺序逐个 loadPlugin 后端插件，最后把前端分桶交给调用方。
 */
@Slf4j
public class HostedPluginClient {

    private final String contextId;
    private final PluginManagerExt manager;

    public HostedPluginClient(String contextId, RpcProtocol rpc) {
        this.contextId = contextId;
        this.manager = rpc.getProxy(MainRpcContext.HOSTED_PLUGIN_MANAGER_EXT);
    }

    /**
     * 启动分配给宿主进程的插件
     *
     * @return 前端分桶 (宿主不执行，由主进程转交)
     */
    public CompletableFuture<List<Plugin>> start(List<PluginDescriptor> descriptors) {
        return manager.init(descriptors).thenCompose(this::loadBackendPlugins);
    }

    private CompletableFuture<List<Plugin>> loadBackendPlugins(InitResult result) {
        log.info("[{}] Host accepted {} backend plugin(s), {} frontend plugin(s) returned",
                contextId, result.backendPlugins().size(), result.frontendPlugins().size());
        // 逐个串行加载，上一个完成后才发下一个
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Plugin plugin : result.backendPlugins()) {
            chain = chain.thenCompose(ignored -> manager.loadPlugin(plugin.initPath(), plugin));
        }
        return chain.thenApply(ignored -> result.frontendPlugins());
    }

    public CompletableFuture<List<PluginLoadResult>> loadReport() {
        return manager.getLoadReport();
    }

    public CompletableFuture<Void> stop() {
        return manager.stop();
    }
}
