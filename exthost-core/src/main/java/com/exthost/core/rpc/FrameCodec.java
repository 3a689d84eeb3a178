package com.exthost.core.rpc;

import com.exthost.core.exception.MalformedFrameException;
import com.exthost.core.rpc.frame.Frame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.Getter;

import java.lang.reflect.Type;

/**
 * 帧编解码
 * 一帧就是一个完整的 JSON 对象，编码结果不含换行，可直接按行分帧
 */
public class FrameCodec {

    @Getter
    private final ObjectMapper mapper;
    private final ObjectWriter frameWriter;
    private final ObjectReader frameReader;

    public FrameCodec() {
        this(defaultMapper());
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.frameWriter = mapper.writerFor(Frame.class);
        this.frameReader = mapper.readerFor(Frame.class);
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                // 对端新增字段不应导致帧被丢弃
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Frame frame) {
        try {
            return frameWriter.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Cannot encode frame " + frame.id() + ": " + e.getOriginalMessage(), e);
        }
    }

    public Frame decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedFrameException("Empty frame");
        }
        try {
            Frame frame = frameReader.readValue(raw);
            if (frame == null) {
                throw new MalformedFrameException("Frame decoded to null: " + abbreviate(raw));
            }
            return frame;
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Malformed frame: " + e.getOriginalMessage() + " in " + abbreviate(raw), e);
        }
    }

    /**
     * 参数/结果序列化为树，序列化失败时抛出 IllegalArgumentException
     */
    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    /**
     * 树转换为目标类型 (支持泛型)
     */
    public Object fromTree(JsonNode node, Type type) {
        JavaType javaType = mapper.getTypeFactory().constructType(type);
        return fromTree(node, javaType);
    }

    public Object fromTree(JsonNode node, JavaType type) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, type);
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 120 ? raw : raw.substring(0, 117) + "...";
    }
}
