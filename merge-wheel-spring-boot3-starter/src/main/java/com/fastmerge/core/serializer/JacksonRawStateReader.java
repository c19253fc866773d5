package com.fastmerge.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fastmerge.model.RawState;

/**
 * 把客户端拿到的 JSON / Map 转成 RawState
 */
public class JacksonRawStateReader {

    private static final JacksonRawStateReader SHARED = new JacksonRawStateReader();

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonRawStateReader() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonRawStateReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static JacksonRawStateReader shared() {
        return SHARED;
    }

    public RawState read(String json) {
        if (json == null || json.isBlank()) {
            return RawState.absent();
        }
        try {
            return RawState.of(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read raw state from JSON", e);
        }
    }

    public RawState read(Object fields) {
        if (fields == null) {
            return RawState.absent();
        }
        JsonNode node = mapper.valueToTree(fields);
        return RawState.of(node);
    }

    public String write(RawState state) {
        if (state == null || state.isAbsent()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(state.asNode());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write raw state to JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 重复字段视为非法输入
        m.enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
        m.findAndRegisterModules();
        return m;
    }
}
