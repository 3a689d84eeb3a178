package com.exthost.core.exception;

/**
 * 帧无法解码或不符合任何已知类型
 */
public class MalformedFrameException extends RpcException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
