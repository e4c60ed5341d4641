package com.storefront.identitysync.application.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;

class PayloadLimitsTest {

    private final PayloadLimits limits = new PayloadLimits(new ObjectMapper(), 64, 3);

    @Test
    void testCheck_AcceptsWithinLimits() {
        assertDoesNotThrow(() -> limits.check("properties", Map.of("a", Map.of("b", List.of(1, 2)))));
        assertDoesNotThrow(() -> limits.check("properties", null));
    }

    @Test
    void testCheck_RejectsTooDeep() {
        Map<String, Object> tooDeep = Map.of("a", Map.of("b", Map.of("c", Map.of("d", 1))));

        PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class,
                () -> limits.check("properties", tooDeep));
        assertTrue(e.getMessage().contains("depth"));
    }

    @Test
    void testCheck_RejectsTooLarge() {
        Map<String, Object> big = Map.of("text", "x".repeat(80));

        PayloadTooLargeException e = assertThrows(PayloadTooLargeException.class,
                () -> limits.check("traits", big));
        assertTrue(e.getMessage().startsWith("traits exceeds 64 bytes"));
    }

    @Test
    void testConstructor_RejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new PayloadLimits(new ObjectMapper(), 0, 3));
    }
}
