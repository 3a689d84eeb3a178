package com.exthost.api.context;

import com.exthost.api.plugin.Plugin;
import com.exthost.api.rpc.RpcProtocol;

import java.util.Optional;

/**
 * 插件上下文
 * 插件与宿主交互的唯一入口
 *
 * @author exthost
 */
public interface PluginContext {

    /**
     * 当前插件标识
     */
    String getPluginId();

    /**
     * 当前插件的解析视图
     */
    Plugin getPlugin();

    /**
     * 与主进程通信的 RPC 协议
     */
    RpcProtocol getRpc();

    /**
     * 获取配置项
     */
    Optional<String> getProperty(String key);
}
