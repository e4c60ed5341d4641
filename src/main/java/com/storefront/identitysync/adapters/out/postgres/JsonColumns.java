package com.storefront.identitysync.adapters.out.postgres;

import java.util.Collections;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSONB column codec shared by the JDBC stores.
 */
@Component
public class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            log.error("action=json_serialize_error error={}", e.getMessage());
            throw new IllegalArgumentException("Failed to serialize JSON column", e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("action=json_parse_error error={}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
