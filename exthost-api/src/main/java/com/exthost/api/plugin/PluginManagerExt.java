package com.exthost.api.plugin;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 宿主进程侧插件管理器的远程接口
 * 主进程通过 {@link com.exthost.api.rpc.MainRpcContext#HOSTED_PLUGIN_MANAGER_EXT} 调用
 *
 * @author exthost
 */
public interface PluginManagerExt {

    /**
     * 划分插件：后端插件留在本进程 (必要时先执行初始化钩子)，前端插件原样返回
     *
     * @param descriptors 分配给本进程的全部插件描述符
     * @return 后端/前端两个分桶
     */
    CompletableFuture<InitResult> init(List<PluginDescriptor> descriptors);

    /**
     * 加载单个后端插件
     * 失败只记录日志与加载报告，不会让调用失败
     *
     * @param contextPath 初始化模块路径，可为空串
     * @param plugin      init 返回的后端插件
     */
    CompletableFuture<Void> loadPlugin(String contextPath, Plugin plugin);

    /**
     * 获取至今为止的加载报告 (按发生顺序)
     */
    CompletableFuture<List<PluginLoadResult>> getLoadReport();

    /**
     * 停止所有已启动的插件
     */
    CompletableFuture<Void> stop();
}
