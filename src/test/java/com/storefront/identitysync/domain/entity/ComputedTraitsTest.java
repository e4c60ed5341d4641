package com.storefront.identitysync.domain.entity;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.storefront.identitysync.domain.valueobject.DropOffStage;

class ComputedTraitsTest {

    @Test
    void testFromMap_ToleratesMalformedValues() {
        // Given
        Map<String, Object> raw = new HashMap<>();
        raw.put("intent_score", 250);
        raw.put("orders_count", -4);
        raw.put("drop_off_stage", "checkout_abandoned");
        raw.put("last_cart_at", "not-a-timestamp");
        raw.put("flags", Map.of("first_sync_completed", true));
        raw.put("custom_score", 7);

        // When
        ComputedTraits traits = ComputedTraits.fromMap(raw);

        // Then
        assertEquals(100, traits.getIntentScore());
        assertEquals(0, traits.getOrdersCount());
        assertEquals(DropOffStage.CHECKOUT_ABANDONED, traits.getDropOffStage());
        assertNull(traits.getLastCartAt());
        assertEquals(Instant.EPOCH, traits.getFlags().setAt("first_sync_completed"));
        assertEquals(7, traits.getExtras().get("custom_score"));
    }

    @Test
    void testToMap_WritesTimestampsAsIsoAndKeepsExtras() {
        // Given
        Instant cartAt = Instant.parse("2024-03-01T10:00:00Z");
        ComputedTraits traits = ComputedTraits.fromMap(Map.of("custom_score", 7, "intent_score", 12))
                .toBuilder()
                .lastCartAt(cartAt)
                .build();

        // When
        Map<String, Object> map = traits.toMap();

        // Then
        assertEquals("2024-03-01T10:00:00Z", map.get("last_cart_at"));
        assertEquals(12, map.get("intent_score"));
        assertEquals(7, map.get("custom_score"));
        assertFalse(map.containsKey("checkout_started_at"));
    }

    @Test
    void testHasPurchasedSinceLastFunnelActivity() {
        Instant t = Instant.parse("2024-03-01T10:00:00Z");
        ComputedTraits purchased = ComputedTraits.builder().lastCartAt(t).orderCompletedAt(t.plusSeconds(60)).build();
        ComputedTraits cartAfterOrder = purchased.toBuilder().lastCartAt(t.plusSeconds(120)).build();

        assertTrue(purchased.hasPurchasedSinceLastFunnelActivity());
        assertFalse(cartAfterOrder.hasPurchasedSinceLastFunnelActivity());
        assertFalse(ComputedTraits.empty().hasPurchasedSinceLastFunnelActivity());
    }
}
