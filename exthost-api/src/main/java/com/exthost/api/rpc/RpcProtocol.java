package com.exthost.api.rpc;

/**
 * RPC 协议入口
 * 插件通过它获取对端对象的代理，或把本地对象暴露给对端
 *
 * @author exthost
 */
public interface RpcProtocol {

    /**
     * 获取对端对象的代理
     * <p>
     * 代理方法返回 CompletableFuture，调用立即返回，结果在响应帧到达时完成。
     * </p>
     *
     * @param identifier 对端注册的标识
     * @return 远程代理
     */
    <T> T getProxy(ProxyIdentifier<T> identifier);

    /**
     * 注册本地对象，使对端可以调用
     * 同一标识在一侧只能注册一次
     *
     * @param identifier 标识
     * @param instance   本地实现
     * @return 注册的实例
     */
    <T, R extends T> R set(ProxyIdentifier<T> identifier, R instance);
}
