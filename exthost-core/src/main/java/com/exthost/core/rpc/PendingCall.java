package com.exthost.core.rpc;

import java.lang.reflect.Type;
import java.util.concurrent.CompletableFuture;

/**
 * 已发出、等待响应的调用
 *
 * @param id         关联 ID
 * @param proxyId    目标代理标识
 * @param method     方法名
 * @param resultType 结果的目标类型
 * @param future     结果句柄
 * @param sentAt     发出时间戳 (ms)
 */
record PendingCall(long id,
                   String proxyId,
                   String method,
                   Type resultType,
                   CompletableFuture<Object> future,
                   long sentAt) {

    String describe() {
        return proxyId + "." + method + "#" + id;
    }

    long ageMillis() {
        return System.currentTimeMillis() - sentAt;
    }
}
