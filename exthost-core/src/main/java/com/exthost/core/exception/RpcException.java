package com.exthost.core.exception;

import com.exthost.api.exception.ExtHostException;

/**
 * RPC 层异常基类
 */
public class RpcException extends ExtHostException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
