package com.exthost.core.rpc.frame;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * 调用帧
 *
 * @param id      关联 ID
 * @param proxyId 目标代理标识
 * @param method  方法名
 * @param args    已序列化的参数
 */
public record CallFrame(long id, String proxyId, String method, List<JsonNode> args) implements Frame {

    public CallFrame {
        Objects.requireNonNull(proxyId, "proxyId");
        Objects.requireNonNull(method, "method");
        if (id <= 0) {
            throw new IllegalArgumentException("Call id must be positive: " + id);
        }
        args = args != null ? List.copyOf(args) : List.of();
    }
}
