package com.exthost.api.plugin;

import com.exthost.api.rpc.RpcProtocol;

/**
 * 后端初始化模块需要导出的钩子
 * 初始化模块通过 META-INF/services 声明实现类
 *
 * @author exthost
 */
public interface BackendInitializer {

    /**
     * init 阶段调用，先于插件进入后端分桶
     * 可在此注册协议处理对象
     */
    void doInitialization(RpcProtocol rpc, PluginManagerExt pluginManager, PluginDescriptor descriptor);

    /**
     * loadPlugin 阶段调用，先于插件入口模块加载
     */
    default void doLoad(RpcProtocol rpc, Plugin plugin) {
        // Default empty implementation
    }
}
