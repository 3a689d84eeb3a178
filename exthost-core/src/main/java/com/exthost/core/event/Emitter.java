package com.exthost.core.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 进程内事件源
 * <p>
 * 特点：
 * - 同步派发 (在 fire 的调用线程上依次通知，保证顺序)
 * - 单个订阅者异常不影响其他订阅者
 * - 轻量级
 *
 * @param <E> 事件类型
 */
@Slf4j
public class Emitter<E> {

    private final String name;
    private final List<Consumer<? super E>> listeners = new CopyOnWriteArrayList<>();

    public Emitter(String name) {
        this.name = name;
    }

    /**
     * 订阅事件
     */
    public Subscription subscribe(Consumer<? super E> listener) {
        // 包一层保证同一个 listener 多次订阅时各自可取消
        Consumer<? super E> entry = listener::accept;
        listeners.add(entry);
        log.debug("[{}] Subscribed, total {}", name, listeners.size());
        return () -> listeners.remove(entry);
    }

    /**
     * 向所有当前订阅者发布事件
     */
    public void fire(E event) {
        for (Consumer<? super E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("[{}] Error handling event {}: {}", name, event, e.getMessage(), e);
            }
        }
    }

    /**
     * 清除所有订阅
     */
    public void clear() {
        listeners.clear();
        log.debug("[{}] All subscriptions cleared", name);
    }

    /**
     * 获取订阅数量
     */
    public int getSubscriptionCount() {
        return listeners.size();
    }

    /**
     * 订阅句柄（用于取消订阅）
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
