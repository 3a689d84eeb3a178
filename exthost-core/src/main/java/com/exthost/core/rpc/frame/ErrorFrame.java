package com.exthost.core.rpc.frame;

import java.util.Objects;

/**
 * 失败响应帧
 */
public record ErrorFrame(long id, SerializedError error) implements Frame {

    public ErrorFrame {
        Objects.requireNonNull(error, "error");
        if (id <= 0) {
            throw new IllegalArgumentException("Error id must be positive: " + id);
        }
    }
}
