package com.exthost.core.rpc;

import com.exthost.api.rpc.ProxyIdentifier;
import com.exthost.api.rpc.RpcProtocol;
import com.exthost.core.event.Emitter;
import com.exthost.core.exception.ChannelClosedException;
import com.exthost.core.exception.RemoteMethodException;
import com.exthost.core.exception.RpcException;
import com.exthost.core.exception.UnknownIdentifierException;
import com.exthost.core.rpc.frame.CallFrame;
import com.exthost.core.rpc.frame.ErrorFrame;
import com.exthost.core.rpc.frame.Frame;
import com.exthost.core.rpc.frame.ResponseFrame;
import com.exthost.core.rpc.frame.SerializedError;
import com.exthost.core.transport.TransportChannel;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RPC 协议引擎
 * <p>
 * 职责：
 * 1. 出站调用：分配关联 ID，登记待决调用，编码并交给通道
 * 2. 入站调用：按代理标识查找本地对象并执行，结果或错误以响应帧返回
 * 3. 入站响应：按关联 ID 完成待决调用；未知或重复的 ID 只记日志
 * 4. 通道关闭：所有待决调用以 ChannelClosedException 失败
 * <p>
 * 入站帧由 MessageEmitter 顺序派发，多个出站调用可以同时处于待决状态。
 */
@Slf4j
public class RpcProtocolImpl implements RpcProtocol, AutoCloseable {

    @Getter
    private final String contextId;
    private final TransportChannel channel;
    private final FrameCodec codec;
    private final boolean traceFrames;

    private final LocalServiceRegistry locals;

    // 关联 ID -> 待决调用
    private final Map<Long, PendingCall> pendingCalls = new ConcurrentHashMap<>();

    // 代理标识名 -> 远程代理
    private final Map<String, Object> proxies = new ConcurrentHashMap<>();

    private final AtomicLong lastCallId = new AtomicLong(0);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final Emitter.Subscription subscription;

    public RpcProtocolImpl(String contextId, MessageEmitter inbound, TransportChannel channel, FrameCodec codec) {
        this(contextId, inbound, channel, codec, false);
    }

    public RpcProtocolImpl(String contextId,
                           MessageEmitter inbound,
                           TransportChannel channel,
                           FrameCodec codec,
                           boolean traceFrames) {
        this.contextId = contextId;
        this.channel = channel;
        this.codec = codec;
        this.traceFrames = traceFrames;
        this.locals = new LocalServiceRegistry(contextId);
        this.subscription = inbound.onMessage(this::receive);
        channel.onClose(() -> dispose("channel closed"));
    }

    // ==================== RpcProtocol ====================

    @Override
    public <T> T getProxy(ProxyIdentifier<T> identifier) {
        Object proxy = proxies.computeIfAbsent(identifier.name(), name -> Proxy.newProxyInstance(
                identifier.type().getClassLoader(),
                new Class<?>[]{identifier.type()},
                new RemoteProxyHandler(identifier, this)));
        return identifier.type().cast(proxy);
    }

    @Override
    public <T, R extends T> R set(ProxyIdentifier<T> identifier, R instance) {
        locals.register(identifier, instance);
        log.info("[{}] Registered {} -> {}", contextId, identifier.name(), instance.getClass().getSimpleName());
        return instance;
    }

    // ==================== 出站调用 ====================

    /**
     * 发出一次远程调用
     *
     * @param proxyId    对端代理标识
     * @param method     方法名
     * @param args       参数
     * @param resultType 结果转换的目标类型
     * @return 响应到达时完成；通道先关闭则以 ChannelClosedException 失败
     */
    public CompletableFuture<Object> remoteCall(String proxyId, String method, Object[] args, Type resultType) {
        if (disposed.get() || !channel.isOpen()) {
            return CompletableFuture.failedFuture(
                    new ChannelClosedException("Channel closed, cannot call " + proxyId + "." + method));
        }

        List<JsonNode> serializedArgs = new ArrayList<>(args.length);
        try {
            for (Object arg : args) {
                serializedArgs.add(codec.toTree(arg));
            }
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new RpcException("Cannot serialize arguments of " + proxyId + "." + method, e));
        }

        long id = lastCallId.incrementAndGet();
        CompletableFuture<Object> future = new CompletableFuture<>();
        PendingCall pending = new PendingCall(id, proxyId, method, resultType, future, System.currentTimeMillis());
        pendingCalls.put(id, pending);

        // 登记与关闭之间存在竞态，登记后再检查一次
        if (disposed.get()) {
            rejectPending(id, "channel closed");
            return future;
        }

        send(new CallFrame(id, proxyId, method, serializedArgs));
        return future;
    }

    // ==================== 入站处理 ====================

    /**
     * 处理一帧入站消息 (由 MessageEmitter 顺序回调)
     */
    public void receive(Frame frame) {
        if (frame instanceof CallFrame call) {
            handleCall(call);
        } else if (frame instanceof ResponseFrame reply) {
            handleReply(reply);
        } else if (frame instanceof ErrorFrame error) {
            handleError(error);
        }
    }

    private void handleCall(CallFrame call) {
        LocalServiceRegistry.InvokableMethod target;
        try {
            target = locals.resolve(call.proxyId(), call.method(), call.args().size());
        } catch (UnknownIdentifierException e) {
            log.warn("[{}] Call #{} targets unknown identifier {}", contextId, call.id(), call.proxyId());
            replyError(call.id(), SerializedError.of(UnknownIdentifierException.ERROR_NAME, e.getMessage()));
            return;
        } catch (NoSuchMethodException e) {
            log.warn("[{}] Call #{}: {}", contextId, call.id(), e.getMessage());
            replyError(call.id(), SerializedError.of("NoSuchMethod", e.getMessage()));
            return;
        }

        Object result;
        try {
            result = target.invoke(convertArguments(target, call.args()));
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError vmError) {
                throw vmError;
            }
            Throwable cause = SerializedError.unwrap(t);
            log.warn("[{}] {}.{} failed: {}", contextId, call.proxyId(), call.method(), cause.toString());
            replyError(call.id(), SerializedError.from(cause));
            return;
        }

        if (result instanceof CompletionStage<?> stage) {
            stage.whenComplete((value, error) -> {
                if (error != null) {
                    Throwable cause = SerializedError.unwrap(error);
                    log.warn("[{}] {}.{} rejected: {}", contextId, call.proxyId(), call.method(), cause.toString());
                    replyError(call.id(), SerializedError.from(cause));
                } else {
                    replyResult(call, value);
                }
            });
        } else {
            replyResult(call, result);
        }
    }

    private Object[] convertArguments(LocalServiceRegistry.InvokableMethod target, List<JsonNode> args) {
        Type[] parameterTypes = target.parameterTypes();
        Object[] converted = new Object[args.size()];
        for (int i = 0; i < converted.length; i++) {
            converted[i] = codec.fromTree(args.get(i), parameterTypes[i]);
        }
        return converted;
    }

    private void replyResult(CallFrame call, Object value) {
        JsonNode node;
        try {
            node = codec.toTree(value);
        } catch (IllegalArgumentException e) {
            // 结果无法序列化，改回错误帧
            log.warn("[{}] Result of {}.{} is not serializable: {}", contextId, call.proxyId(), call.method(), e.getMessage());
            replyError(call.id(), SerializedError.of("SerializationFailure",
                    "Cannot serialize result of " + call.proxyId() + "." + call.method() + ": " + e.getMessage()));
            return;
        }
        send(new ResponseFrame(call.id(), node));
    }

    private void replyError(long id, SerializedError error) {
        send(new ErrorFrame(id, error));
    }

    private void handleReply(ResponseFrame reply) {
        PendingCall pending = pendingCalls.remove(reply.id());
        if (pending == null) {
            log.warn("[{}] Ignoring reply for unknown or completed call #{}", contextId, reply.id());
            return;
        }
        log.debug("[{}] Reply for {} after {} ms", contextId, pending.describe(), pending.ageMillis());
        Type resultType = pending.resultType();
        if (resultType == Void.class || resultType == void.class) {
            pending.future().complete(null);
            return;
        }
        try {
            pending.future().complete(codec.fromTree(reply.result(), resultType));
        } catch (IllegalArgumentException e) {
            pending.future().completeExceptionally(
                    new RpcException("Cannot convert result of " + pending.describe() + " to " + resultType.getTypeName(), e));
        }
    }

    private void handleError(ErrorFrame frame) {
        PendingCall pending = pendingCalls.remove(frame.id());
        if (pending == null) {
            log.warn("[{}] Ignoring error for unknown or completed call #{}", contextId, frame.id());
            return;
        }
        SerializedError error = frame.error();
        RpcException exception = UnknownIdentifierException.ERROR_NAME.equals(error.name())
                ? new UnknownIdentifierException(pending.proxyId())
                : new RemoteMethodException(error);
        pending.future().completeExceptionally(exception);
    }

    private void send(Frame frame) {
        String raw = codec.encode(frame);
        if (traceFrames) {
            log.debug("[{}] >>> {}", contextId, raw);
        }
        channel.send(raw);
    }

    // ==================== 生命周期 ====================

    /**
     * 释放引擎：停止接收，所有待决调用以 ChannelClosedException 失败
     */
    public void dispose(String reason) {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        subscription.unsubscribe();
        locals.clear();
        int count = 0;
        for (Long id : List.copyOf(pendingCalls.keySet())) {
            if (rejectPending(id, reason)) {
                count++;
            }
        }
        log.info("[{}] RPC protocol disposed ({}), rejected {} pending call(s)", contextId, reason, count);
    }

    private boolean rejectPending(long id, String reason) {
        PendingCall pending = pendingCalls.remove(id);
        if (pending == null) {
            return false;
        }
        pending.future().completeExceptionally(
                new ChannelClosedException("Call " + pending.describe() + " aborted after "
                        + pending.ageMillis() + " ms pending: " + reason));
        return true;
    }

    @Override
    public void close() {
        dispose("closed");
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public int getPendingCallCount() {
        return pendingCalls.size();
    }
}
