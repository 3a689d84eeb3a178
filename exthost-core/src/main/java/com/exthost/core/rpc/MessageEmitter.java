package com.exthost.core.rpc;

import com.exthost.core.event.Emitter;
import com.exthost.core.exception.MalformedFrameException;
import com.exthost.core.rpc.frame.Frame;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * 入站消息源
 * 把传输层推送来的原始帧解码后同步发布给订阅者；解码失败只记日志，该帧被丢弃
 */
@Slf4j
public class MessageEmitter {

    private final String contextId;
    private final FrameCodec codec;
    private final Emitter<Frame> emitter;
    private final boolean traceFrames;

    public MessageEmitter(String contextId, FrameCodec codec) {
        this(contextId, codec, false);
    }

    public MessageEmitter(String contextId, FrameCodec codec, boolean traceFrames) {
        this.contextId = contextId;
        this.codec = codec;
        this.emitter = new Emitter<>(contextId + "/messages");
        this.traceFrames = traceFrames;
    }

    /**
     * 订阅解码后的帧
     */
    public Emitter.Subscription onMessage(Consumer<? super Frame> listener) {
        return emitter.subscribe(listener);
    }

    /**
     * 接收一条原始帧
     */
    public void fire(String raw) {
        Frame frame;
        try {
            frame = codec.decode(raw);
        } catch (MalformedFrameException e) {
            log.error("[{}] Dropping malformed frame: {}", contextId, e.getMessage());
            return;
        }
        if (traceFrames) {
            log.debug("[{}] <<< {}", contextId, raw);
        }
        emitter.fire(frame);
    }

    public int getSubscriptionCount() {
        return emitter.getSubscriptionCount();
    }
}
