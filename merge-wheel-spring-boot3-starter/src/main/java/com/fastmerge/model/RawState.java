package com.fastmerge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fastmerge.core.serializer.JacksonRawStateReader;

import java.util.Map;

/**
 * PollingClient 返回的原始资源字段, 结构不受信任, 字段可能缺失或类型不符
 */
public final class RawState {

    private static final RawState ABSENT = new RawState(MissingNode.getInstance());

    private final JsonNode fields;

    private RawState(JsonNode fields) {
        this.fields = fields;
    }

    public static RawState absent() {
        return ABSENT;
    }

    public static RawState of(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? ABSENT : new RawState(node);
    }

    public static RawState fromMap(Map<String, ?> fields) {
        return JacksonRawStateReader.shared().read(fields);
    }

    /** 解析 JSON 文本, 非法 JSON 抛 IllegalStateException */
    public static RawState parse(String json) {
        return JacksonRawStateReader.shared().read(json);
    }

    /** 字段不存在时返回 MissingNode, 不会为 null */
    public JsonNode field(String name) {
        return fields.path(name);
    }

    public boolean isAbsent() {
        return fields.isMissingNode();
    }

    public JsonNode asNode() {
        return fields;
    }

    @Override
    public String toString() {
        return isAbsent() ? "RawState{absent}" : "RawState" + fields;
    }
}
