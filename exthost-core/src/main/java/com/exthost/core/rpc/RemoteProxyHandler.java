package com.exthost.core.rpc;

import com.exthost.api.rpc.ProxyIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 远程代理
 * <p>
 * 作用：
 * 1. 把接口方法调用转换为调用帧，立即返回 CompletableFuture
 * 2. void 方法只发送不等待，失败记日志
 * 3. 其他同步返回类型不支持 (会阻塞事件循环)
 */
@Slf4j
class RemoteProxyHandler implements InvocationHandler {

    private static final Object[] NO_ARGS = new Object[0];

    private final ProxyIdentifier<?> identifier;
    private final RpcProtocolImpl rpc;

    RemoteProxyHandler(ProxyIdentifier<?> identifier, RpcProtocolImpl rpc) {
        this.identifier = identifier;
        this.rpc = rpc;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) {
        // Object 方法直接处理
        if (method.getDeclaringClass() == Object.class) {
            return switch (method.getName()) {
                case "equals" -> proxy == args[0];
                case "hashCode" -> System.identityHashCode(proxy);
                default -> "RemoteProxy[" + identifier.name() + "]";
            };
        }

        Object[] actualArgs = args != null ? args : NO_ARGS;
        Class<?> returnType = method.getReturnType();

        if (returnType == void.class) {
            rpc.remoteCall(identifier.name(), method.getName(), actualArgs, Void.class)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("[{}] Fire-and-forget call {}.{} failed: {}",
                                    rpc.getContextId(), identifier.name(), method.getName(), error.getMessage());
                        }
                    });
            return null;
        }

        if (returnType == CompletableFuture.class || returnType == CompletionStage.class) {
            Type resultType = resolveResultType(method.getGenericReturnType());
            return rpc.remoteCall(identifier.name(), method.getName(), actualArgs, resultType);
        }

        throw new UnsupportedOperationException(String.format(
                "Remote method %s.%s must return CompletableFuture or void, found %s",
                identifier.name(), method.getName(), returnType.getSimpleName()));
    }

    private static Type resolveResultType(Type genericReturnType) {
        if (genericReturnType instanceof ParameterizedType parameterized) {
            Type argument = parameterized.getActualTypeArguments()[0];
            if (argument instanceof WildcardType wildcard) {
                return wildcard.getUpperBounds()[0];
            }
            return argument;
        }
        return Object.class;
    }
}
