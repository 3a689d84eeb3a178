package com.exthost.core.exception;

import lombok.Getter;

/**
 * 调用的代理标识在对端未注册
 */
@Getter
public class UnknownIdentifierException extends RpcException {

    public static final String ERROR_NAME = "UnknownIdentifier";

    private final String proxyId;

    public UnknownIdentifierException(String proxyId) {
        super("Unknown proxy identifier: " + proxyId);
        this.proxyId = proxyId;
    }
}
