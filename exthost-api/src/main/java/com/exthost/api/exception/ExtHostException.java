package com.exthost.api.exception;

/**
 * exthost 基础异常
 *
 * @author exthost
 */
public class ExtHostException extends RuntimeException {

    public ExtHostException(String message) {
        super(message);
    }

    public ExtHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
