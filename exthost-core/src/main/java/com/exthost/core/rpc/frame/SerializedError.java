package com.exthost.core.rpc.frame;

import org.jspecify.annotations.Nullable;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.lang.reflect.InvocationTargetException;

/**
 * 可跨进程传递的错误描述，不携带异常对象本身
 *
 * @param name    错误名 (异常类名或协议错误名)
 * @param message 错误信息
 * @param stack   堆栈文本
 */
public record SerializedError(String name, @Nullable String message, @Nullable String stack) {

    public SerializedError {
        name = name != null ? name : "Error";
    }

    public static SerializedError of(String name, String message) {
        return new SerializedError(name, message, null);
    }

    /**
     * 把异常转换为可序列化的描述，剥掉反射与异步包装层
     */
    public static SerializedError from(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        StringWriter stack = new StringWriter();
        cause.printStackTrace(new PrintWriter(stack));
        return new SerializedError(cause.getClass().getName(), cause.getMessage(), stack.toString());
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
