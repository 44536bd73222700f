package com.pareview.app.core.engine.misc;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared mapper for every persisted review document.
 *
 * <p>Documents use snake_case property names and ISO-8601 timestamps.</p>
 */
public class ReviewObjectMapper {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private ReviewObjectMapper() {}

    public byte[] writeValueAsBytes(Object value) {
        return objectMapper.writeValueAsBytes(value);
    }

    public String writeValueAsString(Object value) {
        return objectMapper.writeValueAsString(value);
    }

    public <T> T readValue(byte[] content, Class<T> valueType) {
        return objectMapper.readValue(content, valueType);
    }

    public JsonNode valueToTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    public <T> T treeToValue(JsonNode node, Class<T> valueType) {
        return objectMapper.treeToValue(node, valueType);
    }

    public <T> T convertValue(Object fromValue, Class<T> toValueType) {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    private static final class SingletonHolder {
        private static final ReviewObjectMapper INSTANCE = new ReviewObjectMapper();
    }

    public static ReviewObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
