package com.exthost.core.rpc.frame;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 线路协议的一帧
 * 通过 "type" 字段区分：call / reply / error，未知类型在通道边界即被拒绝
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CallFrame.class, name = "call"),
        @JsonSubTypes.Type(value = ResponseFrame.class, name = "reply"),
        @JsonSubTypes.Type(value = ErrorFrame.class, name = "error")
})
public sealed interface Frame permits CallFrame, ResponseFrame, ErrorFrame {

    /**
     * 关联 ID
     */
    long id();
}
