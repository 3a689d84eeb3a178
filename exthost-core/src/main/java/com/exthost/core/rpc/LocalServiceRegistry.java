package com.exthost.core.rpc;

import com.exthost.api.rpc.ProxyIdentifier;
import com.exthost.core.exception.RpcException;
import com.exthost.core.exception.UnknownIdentifierException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本地可调用对象注册表
 * 职责：代理标识 -> 本地实现的登记、方法查找、方法句柄优化
 */
@Slf4j
public class LocalServiceRegistry {

    private final String contextId;

    // 代理标识名 -> 本地对象
    private final Map<String, LocalService> services = new ConcurrentHashMap<>();

    // MethodHandles.Lookup 实例（复用）
    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

    public LocalServiceRegistry(String contextId) {
        this.contextId = contextId;
    }

    // ==================== 注册 ====================

    /**
     * 注册本地对象；只暴露标识接口上声明的方法
     *
     * @throws IllegalStateException 标识已被注册
     */
    public <T> void register(ProxyIdentifier<T> identifier, T bean) {
        if (bean == null) {
            throw new IllegalArgumentException("Bean cannot be null for " + identifier);
        }
        if (!identifier.type().isInstance(bean)) {
            throw new IllegalArgumentException(bean.getClass().getName() + " does not implement " + identifier.type().getName());
        }

        LocalService service = new LocalService(identifier.name(), bean, buildMethodTable(identifier.type(), bean));
        LocalService existing = services.putIfAbsent(identifier.name(), service);
        if (existing != null) {
            throw new IllegalStateException("Proxy identifier already registered: " + identifier.name());
        }
        log.debug("[{}] Registered local service {} ({} methods)", contextId, identifier.name(), service.methods().size());
    }

    private Map<String, List<InvokableMethod>> buildMethodTable(Class<?> type, Object bean) {
        Map<String, List<InvokableMethod>> table = new HashMap<>();
        for (Method method : type.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.getDeclaringClass() == Object.class) {
                continue;
            }
            try {
                // 解除权限检查，接口可以是非 public 的
                method.setAccessible(true);
                // 转换为 MethodHandle（比反射快）
                MethodHandle handle = LOOKUP.unreflect(method).bindTo(bean);
                table.computeIfAbsent(method.getName(), k -> new ArrayList<>())
                        .add(new InvokableMethod(method, handle));
            } catch (IllegalAccessException e) {
                throw new RpcException("Failed to create MethodHandle for " + type.getSimpleName() + "." + method.getName(), e);
            }
        }
        table.replaceAll((name, list) -> Collections.unmodifiableList(list));
        return table;
    }

    /**
     * 注销
     */
    public boolean unregister(String proxyId) {
        LocalService removed = services.remove(proxyId);
        if (removed != null) {
            log.debug("[{}] Unregistered local service {}", contextId, proxyId);
            return true;
        }
        return false;
    }

    // ==================== 查询 ====================

    /**
     * 按标识、方法名与参数个数解析目标方法
     *
     * @throws UnknownIdentifierException 标识未注册
     * @throws NoSuchMethodException      方法不存在或参数个数不匹配
     */
    public InvokableMethod resolve(String proxyId, String methodName, int argCount) throws NoSuchMethodException {
        LocalService service = services.get(proxyId);
        if (service == null) {
            throw new UnknownIdentifierException(proxyId);
        }
        List<InvokableMethod> candidates = service.methods().get(methodName);
        if (candidates == null || candidates.isEmpty()) {
            throw new NoSuchMethodException("Unknown method " + proxyId + "." + methodName);
        }
        for (InvokableMethod candidate : candidates) {
            if (candidate.method().getParameterCount() == argCount) {
                return candidate;
            }
        }
        throw new NoSuchMethodException(String.format(
                "Method %s.%s does not accept %d argument(s)", proxyId, methodName, argCount));
    }

    public boolean hasService(String proxyId) {
        return services.containsKey(proxyId);
    }

    public int getServiceCount() {
        return services.size();
    }

    public void clear() {
        int count = services.size();
        services.clear();
        log.debug("[{}] Cleared registry: {} services", contextId, count);
    }

    public RegistryStats getStats() {
        int methodCount = services.values().stream().mapToInt(s -> s.methods().size()).sum();
        return new RegistryStats(services.size(), methodCount);
    }

    // ==================== 内部类 ====================

    private record LocalService(String proxyId, Object bean, Map<String, List<InvokableMethod>> methods) {
    }

    /**
     * 可调用的方法（包含优化后的 MethodHandle）
     */
    public record InvokableMethod(Method method, MethodHandle methodHandle) {

        public Type[] parameterTypes() {
            return method.getGenericParameterTypes();
        }

        public Object invoke(Object[] args) throws Throwable {
            return methodHandle.invokeWithArguments(args);
        }

        public String getSignature() {
            return method.getDeclaringClass().getSimpleName() + "." + method.getName();
        }
    }

    /**
     * 注册表统计信息
     */
    public record RegistryStats(int serviceCount, int methodNameCount) {
        @Override
        @NonNull
        public String toString() {
            return String.format("RegistryStats{services=%d, methods=%d}", serviceCount, methodNameCount);
        }
    }
}
