package com.exthost.core.rpc.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * 成功响应帧
 */
public record ResponseFrame(long id, JsonNode result) implements Frame {

    public ResponseFrame {
        if (id <= 0) {
            throw new IllegalArgumentException("Reply id must be positive: " + id);
        }
        result = result != null ? result : NullNode.getInstance();
    }
}
