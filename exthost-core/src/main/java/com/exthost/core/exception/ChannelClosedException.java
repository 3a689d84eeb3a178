package com.exthost.core.exception;

/**
 * 传输通道已关闭，所有未完成的调用以此失败
 */
public class ChannelClosedException extends RpcException {

    public ChannelClosedException(String message) {
        super(message);
    }
}
