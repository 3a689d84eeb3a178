package com.exthost.core.transport;

import java.util.function.Consumer;

/**
 * 两个进程之间唯一的双工帧通道
 * <p>
 * 约定：
 * 1. send 只负责入队，不会无限期阻塞；通道关闭后静默丢弃
 * 2. 入站帧按到达顺序逐一回调，每帧恰好一次，不重排、不合并
 * 3. 关闭回调只触发一次
 */
public interface TransportChannel extends AutoCloseable {

    /**
     * 发送一帧
     */
    void send(String frame);

    /**
     * 注册入站帧回调
     */
    void onFrame(Consumer<String> listener);

    /**
     * 注册关闭回调；通道已关闭时立即执行
     */
    void onClose(Runnable listener);

    /**
     * 通道是否仍可用
     */
    boolean isOpen();

    /**
     * 主动关闭通道
     */
    @Override
    void close();
}
