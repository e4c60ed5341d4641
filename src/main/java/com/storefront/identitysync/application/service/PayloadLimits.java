package com.storefront.identitysync.application.service;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;

/**
 * Bounds client-supplied JSON bags by serialized size and nesting depth.
 */
public class PayloadLimits {

    public static final int DEFAULT_MAX_BYTES = 10 * 1024;
    public static final int DEFAULT_MAX_DEPTH = 10;

    private final ObjectMapper objectMapper;
    private final int maxBytes;
    private final int maxDepth;

    public PayloadLimits(ObjectMapper objectMapper, int maxBytes, int maxDepth) {
        if (objectMapper == null)
            throw new IllegalArgumentException("objectMapper cannot be null");
        if (maxBytes < 1 || maxDepth < 1)
            throw new IllegalArgumentException("limits must be positive");

        this.objectMapper = objectMapper;
        this.maxBytes = maxBytes;
        this.maxDepth = maxDepth;
    }

    /**
     * @param field name reported in the error message
     * @param bag   bag to check; null and empty bags always pass
     * @throws PayloadTooLargeException if a limit is exceeded
     */
    public void check(String field, Map<String, Object> bag) {
        if (bag == null || bag.isEmpty()) {
            return;
        }
        int depth = depthOf(bag, 0);
        if (depth > maxDepth) {
            throw new PayloadTooLargeException(field + " nesting depth exceeds " + maxDepth);
        }
        int size = serializedSize(field, bag);
        if (size > maxBytes) {
            throw new PayloadTooLargeException(field + " exceeds " + maxBytes + " bytes (" + size + ")");
        }
    }

    private int serializedSize(String field, Map<String, Object> bag) {
        try {
            return objectMapper.writeValueAsString(bag).getBytes(StandardCharsets.UTF_8).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(field + " is not valid JSON", e);
        }
    }

    /**
     * Containers count one level each; scalars add nothing. Stops descending
     * once the limit is already exceeded.
     */
    private int depthOf(Object node, int current) {
        if (current > maxDepth) {
            return current;
        }
        Collection<?> children;
        if (node instanceof Map) {
            children = ((Map<?, ?>) node).values();
        } else if (node instanceof Collection) {
            children = (Collection<?>) node;
        } else {
            return current;
        }
        int deepest = current + 1;
        for (Object child : children) {
            deepest = Math.max(deepest, depthOf(child, current + 1));
        }
        return deepest;
    }
}
