package com.exthost.core.exception;

import com.exthost.core.rpc.frame.SerializedError;
import lombok.Getter;

/**
 * 对端处理方法抛出异常，携带可序列化的错误描述
 */
@Getter
public class RemoteMethodException extends RpcException {

    private final SerializedError error;

    public RemoteMethodException(SerializedError error) {
        super(error.name() + ": " + error.message());
        this.error = error;
    }
}
