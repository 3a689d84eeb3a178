package com.exthost.api.rpc;

import java.util.Objects;

/**
 * 远程可调用接口的标识
 * <p>
 * 主进程与插件宿主进程两侧必须使用同名标识，引擎按名称路由调用。
 *
 * @param name 进程内唯一的名称
 * @param type 远程接口类型 (方法返回 CompletableFuture 或 void)
 * @param <T>  接口类型
 */
public record ProxyIdentifier<T>(String name, Class<T> type) {

    public ProxyIdentifier {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Proxy identifier name cannot be blank");
        }
    }

    public static <T> ProxyIdentifier<T> of(String name, Class<T> type) {
        return new ProxyIdentifier<>(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
