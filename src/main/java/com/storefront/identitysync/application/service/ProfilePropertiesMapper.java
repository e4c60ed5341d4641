package com.storefront.identitysync.application.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;

/**
 * Builds the profile property bag sent to the destination.
 * <p>
 * The fixed {@code sf_} keys are always present, with null for unknown values,
 * so stale destination values get overwritten. Explicit traits follow,
 * prefixed with {@code sf_}; they never replace a fixed key.
 * </p>
 */
public final class ProfilePropertiesMapper {

    public static final String PREFIX = "sf_";

    static final List<String> FIXED_KEYS = List.of(
            "sf_unified_user_id", "sf_first_seen_at", "sf_last_seen_at", "sf_intent_score",
            "sf_frequency_score", "sf_depth_score", "sf_recency_days", "sf_top_category_30d",
            "sf_drop_off_stage", "sf_products_viewed_count", "sf_categories_viewed_count",
            "sf_session_count_30d", "sf_cart_abandoned_at", "sf_checkout_abandoned_at",
            "sf_lifetime_value", "sf_orders_count", "sf_computed_at", "sf_customer_ids",
            "sf_anonymous_ids_count");

    private ProfilePropertiesMapper() {
    }

    public static Map<String, Object> toProperties(UnifiedIdentity identity) {
        ComputedTraits c = identity.getComputed();
        Map<String, Object> props = new LinkedHashMap<>();

        props.put("sf_unified_user_id", identity.getId());
        props.put("sf_first_seen_at", iso(identity.getFirstSeenAt()));
        props.put("sf_last_seen_at", iso(identity.getLastSeenAt()));
        props.put("sf_intent_score", c.getIntentScore());
        props.put("sf_frequency_score", c.getFrequencyScore());
        props.put("sf_depth_score", c.getDepthScore());
        props.put("sf_recency_days", c.getRecencyDays());
        props.put("sf_top_category_30d", c.getTopCategory30d());
        props.put("sf_drop_off_stage", c.getDropOffStage() != null ? c.getDropOffStage().getValue() : null);
        props.put("sf_products_viewed_count", c.getProductsViewedCount());
        props.put("sf_categories_viewed_count", c.getCategoriesViewedCount());
        props.put("sf_session_count_30d", c.getSessionCount30d());
        props.put("sf_cart_abandoned_at", iso(c.getCartAbandonedAt()));
        props.put("sf_checkout_abandoned_at", iso(c.getCheckoutAbandonedAt()));
        props.put("sf_lifetime_value", c.getLifetimeValue());
        props.put("sf_orders_count", c.getOrdersCount());
        props.put("sf_computed_at", iso(c.getComputedAt()));
        props.put("sf_customer_ids", new ArrayList<>(identity.getCustomerIds()));
        props.put("sf_anonymous_ids_count", identity.getAnonymousIds().size());

        for (Map.Entry<String, Object> trait : identity.getTraits().entrySet()) {
            String key = trait.getKey().startsWith(PREFIX) ? trait.getKey() : PREFIX + trait.getKey();
            if (!props.containsKey(key)) {
                props.put(key, trait.getValue());
            }
        }
        return props;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
