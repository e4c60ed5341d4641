package com.storefront.identitysync.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.storefront.identitysync.domain.valueobject.DropOffStage;
import com.storefront.identitysync.domain.valueobject.EventCategory;
import com.storefront.identitysync.domain.valueobject.SyncFlags;

/**
 * Typed view of the {@code computed} JSON bag of a unified identity.
 * <p>
 * <b>IMMUTABLE:</b> changes go through {@link #toBuilder()}. Recognized keys
 * map to fields; anything else read from storage is kept in {@code extras}
 * and written back untouched, so newer writers can add keys without older
 * readers dropping them.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>intentScore is within [0, 100]</li>
 * <li>counters are never negative</li>
 * <li>flags is never null</li>
 * </ul>
 */
public final class ComputedTraits {

    static final Set<String> KNOWN_KEYS = Set.of(
            "intent_score", "frequency_score", "depth_score", "recency_days", "drop_off_stage",
            "top_category_30d", "products_viewed_count", "unique_products_viewed",
            "categories_viewed_count", "session_count_30d", "last_session_at", "atc_count_7d",
            "orders_count", "lifetime_value", "email_opens_30d", "email_clicks_30d",
            "email_engagement_score", "is_subscribed", "last_action", "last_action_at",
            "last_product_viewed_at", "last_cart_at", "checkout_started_at", "cart_abandoned_at",
            "checkout_abandoned_at", "order_completed_at", "last_decayed_at", "computed_at", "flags");

    private static final ComputedTraits EMPTY = builder().build();

    private final int intentScore;
    private final Integer frequencyScore;
    private final Integer depthScore;
    private final Integer recencyDays;
    private final DropOffStage dropOffStage;
    private final String topCategory30d;
    private final int productsViewedCount;
    private final int uniqueProductsViewed;
    private final int categoriesViewedCount;
    private final int sessionCount30d;
    private final Instant lastSessionAt;
    private final int atcCount7d;
    private final int ordersCount;
    private final double lifetimeValue;
    private final int emailOpens30d;
    private final int emailClicks30d;
    private final int emailEngagementScore;
    private final Boolean subscribed;
    private final String lastAction;
    private final Instant lastActionAt;
    private final Instant lastProductViewedAt;
    private final Instant lastCartAt;
    private final Instant checkoutStartedAt;
    private final Instant cartAbandonedAt;
    private final Instant checkoutAbandonedAt;
    private final Instant orderCompletedAt;
    private final Instant lastDecayedAt;
    private final Instant computedAt;
    private final SyncFlags flags;
    private final Map<String, Object> extras;

    private ComputedTraits(Builder b) {
        if (b.intentScore < EventCategory.MIN_INTENT || b.intentScore > EventCategory.MAX_INTENT) {
            throw new IllegalArgumentException("intentScore must be within [0, 100], got: " + b.intentScore);
        }
        if (b.productsViewedCount < 0 || b.uniqueProductsViewed < 0 || b.categoriesViewedCount < 0
                || b.sessionCount30d < 0 || b.atcCount7d < 0 || b.ordersCount < 0
                || b.emailOpens30d < 0 || b.emailClicks30d < 0 || b.emailEngagementScore < 0) {
            throw new IllegalArgumentException("computed counters cannot be negative");
        }
        this.intentScore = b.intentScore;
        this.frequencyScore = b.frequencyScore;
        this.depthScore = b.depthScore;
        this.recencyDays = b.recencyDays;
        this.dropOffStage = b.dropOffStage;
        this.topCategory30d = b.topCategory30d;
        this.productsViewedCount = b.productsViewedCount;
        this.uniqueProductsViewed = b.uniqueProductsViewed;
        this.categoriesViewedCount = b.categoriesViewedCount;
        this.sessionCount30d = b.sessionCount30d;
        this.lastSessionAt = b.lastSessionAt;
        this.atcCount7d = b.atcCount7d;
        this.ordersCount = b.ordersCount;
        this.lifetimeValue = b.lifetimeValue;
        this.emailOpens30d = b.emailOpens30d;
        this.emailClicks30d = b.emailClicks30d;
        this.emailEngagementScore = b.emailEngagementScore;
        this.subscribed = b.subscribed;
        this.lastAction = b.lastAction;
        this.lastActionAt = b.lastActionAt;
        this.lastProductViewedAt = b.lastProductViewedAt;
        this.lastCartAt = b.lastCartAt;
        this.checkoutStartedAt = b.checkoutStartedAt;
        this.cartAbandonedAt = b.cartAbandonedAt;
        this.checkoutAbandonedAt = b.checkoutAbandonedAt;
        this.orderCompletedAt = b.orderCompletedAt;
        this.lastDecayedAt = b.lastDecayedAt;
        this.computedAt = b.computedAt;
        this.flags = b.flags != null ? b.flags : SyncFlags.empty();
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    // ─────────────────── Factory Methods ───────────────────

    public static ComputedTraits empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.intentScore = intentScore;
        b.frequencyScore = frequencyScore;
        b.depthScore = depthScore;
        b.recencyDays = recencyDays;
        b.dropOffStage = dropOffStage;
        b.topCategory30d = topCategory30d;
        b.productsViewedCount = productsViewedCount;
        b.uniqueProductsViewed = uniqueProductsViewed;
        b.categoriesViewedCount = categoriesViewedCount;
        b.sessionCount30d = sessionCount30d;
        b.lastSessionAt = lastSessionAt;
        b.atcCount7d = atcCount7d;
        b.ordersCount = ordersCount;
        b.lifetimeValue = lifetimeValue;
        b.emailOpens30d = emailOpens30d;
        b.emailClicks30d = emailClicks30d;
        b.emailEngagementScore = emailEngagementScore;
        b.subscribed = subscribed;
        b.lastAction = lastAction;
        b.lastActionAt = lastActionAt;
        b.lastProductViewedAt = lastProductViewedAt;
        b.lastCartAt = lastCartAt;
        b.checkoutStartedAt = checkoutStartedAt;
        b.cartAbandonedAt = cartAbandonedAt;
        b.checkoutAbandonedAt = checkoutAbandonedAt;
        b.orderCompletedAt = orderCompletedAt;
        b.lastDecayedAt = lastDecayedAt;
        b.computedAt = computedAt;
        b.flags = flags;
        b.extras.putAll(extras);
        return b;
    }

    /**
     * Reads the stored JSON bag. Malformed values fall back to defaults rather
     * than failing the whole identity.
     */
    public static ComputedTraits fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Builder b = new Builder();
        b.intentScore = EventCategory.clampIntent(longValue(raw.get("intent_score")));
        b.frequencyScore = integerValue(raw.get("frequency_score"));
        b.depthScore = integerValue(raw.get("depth_score"));
        b.recencyDays = integerValue(raw.get("recency_days"));
        b.dropOffStage = DropOffStage.fromValue(stringValue(raw.get("drop_off_stage")));
        b.topCategory30d = stringValue(raw.get("top_category_30d"));
        b.productsViewedCount = counter(raw.get("products_viewed_count"));
        b.uniqueProductsViewed = counter(raw.get("unique_products_viewed"));
        b.categoriesViewedCount = counter(raw.get("categories_viewed_count"));
        b.sessionCount30d = counter(raw.get("session_count_30d"));
        b.lastSessionAt = instantValue(raw.get("last_session_at"));
        b.atcCount7d = counter(raw.get("atc_count_7d"));
        b.ordersCount = counter(raw.get("orders_count"));
        b.lifetimeValue = doubleValue(raw.get("lifetime_value"));
        b.emailOpens30d = counter(raw.get("email_opens_30d"));
        b.emailClicks30d = counter(raw.get("email_clicks_30d"));
        b.emailEngagementScore = counter(raw.get("email_engagement_score"));
        Object subscribed = raw.get("is_subscribed");
        b.subscribed = subscribed instanceof Boolean ? (Boolean) subscribed : null;
        b.lastAction = stringValue(raw.get("last_action"));
        b.lastActionAt = instantValue(raw.get("last_action_at"));
        b.lastProductViewedAt = instantValue(raw.get("last_product_viewed_at"));
        b.lastCartAt = instantValue(raw.get("last_cart_at"));
        b.checkoutStartedAt = instantValue(raw.get("checkout_started_at"));
        b.cartAbandonedAt = instantValue(raw.get("cart_abandoned_at"));
        b.checkoutAbandonedAt = instantValue(raw.get("checkout_abandoned_at"));
        b.orderCompletedAt = instantValue(raw.get("order_completed_at"));
        b.lastDecayedAt = instantValue(raw.get("last_decayed_at"));
        b.computedAt = instantValue(raw.get("computed_at"));
        b.flags = SyncFlags.fromJson(raw.get("flags"));
        raw.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                b.extras.put(key, value);
            }
        });
        return b.build();
    }

    /**
     * Writes the JSON bag. Null timestamps are omitted; unknown keys are
     * written first so recognized keys always win.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(extras);
        map.put("intent_score", intentScore);
        putIfNotNull(map, "frequency_score", frequencyScore);
        putIfNotNull(map, "depth_score", depthScore);
        putIfNotNull(map, "recency_days", recencyDays);
        putIfNotNull(map, "drop_off_stage", dropOffStage != null ? dropOffStage.getValue() : null);
        putIfNotNull(map, "top_category_30d", topCategory30d);
        map.put("products_viewed_count", productsViewedCount);
        map.put("unique_products_viewed", uniqueProductsViewed);
        map.put("categories_viewed_count", categoriesViewedCount);
        map.put("session_count_30d", sessionCount30d);
        putIfNotNull(map, "last_session_at", lastSessionAt);
        map.put("atc_count_7d", atcCount7d);
        map.put("orders_count", ordersCount);
        map.put("lifetime_value", lifetimeValue);
        map.put("email_opens_30d", emailOpens30d);
        map.put("email_clicks_30d", emailClicks30d);
        map.put("email_engagement_score", emailEngagementScore);
        putIfNotNull(map, "is_subscribed", subscribed);
        putIfNotNull(map, "last_action", lastAction);
        putIfNotNull(map, "last_action_at", lastActionAt);
        putIfNotNull(map, "last_product_viewed_at", lastProductViewedAt);
        putIfNotNull(map, "last_cart_at", lastCartAt);
        putIfNotNull(map, "checkout_started_at", checkoutStartedAt);
        putIfNotNull(map, "cart_abandoned_at", cartAbandonedAt);
        putIfNotNull(map, "checkout_abandoned_at", checkoutAbandonedAt);
        putIfNotNull(map, "order_completed_at", orderCompletedAt);
        putIfNotNull(map, "last_decayed_at", lastDecayedAt);
        putIfNotNull(map, "computed_at", computedAt);
        map.put("flags", flags.toJson());
        return map;
    }

    // ─────────────────── Behavior Methods ───────────────────

    /** @return true if an order was completed after every cart/checkout activity */
    public boolean hasPurchasedSinceLastFunnelActivity() {
        if (orderCompletedAt == null) {
            return false;
        }
        return !isAfter(lastCartAt, orderCompletedAt) && !isAfter(checkoutStartedAt, orderCompletedAt);
    }

    public ComputedTraits withFlags(SyncFlags newFlags) {
        Builder b = toBuilder();
        b.flags = newFlags;
        return b.build();
    }

    private static boolean isAfter(Instant candidate, Instant reference) {
        return candidate != null && candidate.isAfter(reference);
    }

    // ─────────────────── Getters ───────────────────

    public int getIntentScore() {
        return intentScore;
    }

    public Integer getFrequencyScore() {
        return frequencyScore;
    }

    public Integer getDepthScore() {
        return depthScore;
    }

    public Integer getRecencyDays() {
        return recencyDays;
    }

    public DropOffStage getDropOffStage() {
        return dropOffStage;
    }

    public String getTopCategory30d() {
        return topCategory30d;
    }

    public int getProductsViewedCount() {
        return productsViewedCount;
    }

    public int getUniqueProductsViewed() {
        return uniqueProductsViewed;
    }

    public int getCategoriesViewedCount() {
        return categoriesViewedCount;
    }

    public int getSessionCount30d() {
        return sessionCount30d;
    }

    public Instant getLastSessionAt() {
        return lastSessionAt;
    }

    public int getAtcCount7d() {
        return atcCount7d;
    }

    public int getOrdersCount() {
        return ordersCount;
    }

    public double getLifetimeValue() {
        return lifetimeValue;
    }

    public int getEmailOpens30d() {
        return emailOpens30d;
    }

    public int getEmailClicks30d() {
        return emailClicks30d;
    }

    public int getEmailEngagementScore() {
        return emailEngagementScore;
    }

    public Boolean getSubscribed() {
        return subscribed;
    }

    public String getLastAction() {
        return lastAction;
    }

    public Instant getLastActionAt() {
        return lastActionAt;
    }

    public Instant getLastProductViewedAt() {
        return lastProductViewedAt;
    }

    public Instant getLastCartAt() {
        return lastCartAt;
    }

    public Instant getCheckoutStartedAt() {
        return checkoutStartedAt;
    }

    public Instant getCartAbandonedAt() {
        return cartAbandonedAt;
    }

    public Instant getCheckoutAbandonedAt() {
        return checkoutAbandonedAt;
    }

    public Instant getOrderCompletedAt() {
        return orderCompletedAt;
    }

    public Instant getLastDecayedAt() {
        return lastDecayedAt;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public SyncFlags getFlags() {
        return flags;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    // ─────────────────── Parsing Helpers ───────────────────

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value == null) {
            return;
        }
        map.put(key, value instanceof Instant ? value.toString() : value);
    }

    private static long longValue(Object raw) {
        if (raw instanceof Number) {
            return Math.round(((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            try {
                return Math.round(Double.parseDouble((String) raw));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static int counter(Object raw) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, longValue(raw)));
    }

    private static Integer integerValue(Object raw) {
        return raw == null ? null : (int) longValue(raw);
    }

    private static double doubleValue(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble((String) raw);
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static String stringValue(Object raw) {
        return raw == null ? null : String.valueOf(raw);
    }

    private static Instant instantValue(Object raw) {
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof String) {
            try {
                return Instant.parse((String) raw);
            } catch (RuntimeException e) {
                return null;
            }
        }
        return null;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return toMap().equals(((ComputedTraits) o).toMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(toMap());
    }

    @Override
    public String toString() {
        return "ComputedTraits{intentScore=" + intentScore
                + ", dropOffStage=" + dropOffStage
                + ", sessionCount30d=" + sessionCount30d
                + ", ordersCount=" + ordersCount
                + ", flags=" + flags + "}";
    }

    // ─────────────────── Builder ───────────────────

    public static final class Builder {
        private int intentScore;
        private Integer frequencyScore;
        private Integer depthScore;
        private Integer recencyDays;
        private DropOffStage dropOffStage;
        private String topCategory30d;
        private int productsViewedCount;
        private int uniqueProductsViewed;
        private int categoriesViewedCount;
        private int sessionCount30d;
        private Instant lastSessionAt;
        private int atcCount7d;
        private int ordersCount;
        private double lifetimeValue;
        private int emailOpens30d;
        private int emailClicks30d;
        private int emailEngagementScore;
        private Boolean subscribed;
        private String lastAction;
        private Instant lastActionAt;
        private Instant lastProductViewedAt;
        private Instant lastCartAt;
        private Instant checkoutStartedAt;
        private Instant cartAbandonedAt;
        private Instant checkoutAbandonedAt;
        private Instant orderCompletedAt;
        private Instant lastDecayedAt;
        private Instant computedAt;
        private SyncFlags flags = SyncFlags.empty();
        private final Map<String, Object> extras = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder intentScore(int intentScore) {
            this.intentScore = intentScore;
            return this;
        }

        public Builder frequencyScore(Integer frequencyScore) {
            this.frequencyScore = frequencyScore;
            return this;
        }

        public Builder depthScore(Integer depthScore) {
            this.depthScore = depthScore;
            return this;
        }

        public Builder recencyDays(Integer recencyDays) {
            this.recencyDays = recencyDays;
            return this;
        }

        public Builder dropOffStage(DropOffStage dropOffStage) {
            this.dropOffStage = dropOffStage;
            return this;
        }

        public Builder topCategory30d(String topCategory30d) {
            this.topCategory30d = topCategory30d;
            return this;
        }

        public Builder productsViewedCount(int productsViewedCount) {
            this.productsViewedCount = productsViewedCount;
            return this;
        }

        public Builder uniqueProductsViewed(int uniqueProductsViewed) {
            this.uniqueProductsViewed = uniqueProductsViewed;
            return this;
        }

        public Builder categoriesViewedCount(int categoriesViewedCount) {
            this.categoriesViewedCount = categoriesViewedCount;
            return this;
        }

        public Builder sessionCount30d(int sessionCount30d) {
            this.sessionCount30d = sessionCount30d;
            return this;
        }

        public Builder lastSessionAt(Instant lastSessionAt) {
            this.lastSessionAt = lastSessionAt;
            return this;
        }

        public Builder atcCount7d(int atcCount7d) {
            this.atcCount7d = atcCount7d;
            return this;
        }

        public Builder ordersCount(int ordersCount) {
            this.ordersCount = ordersCount;
            return this;
        }

        public Builder lifetimeValue(double lifetimeValue) {
            this.lifetimeValue = lifetimeValue;
            return this;
        }

        public Builder emailOpens30d(int emailOpens30d) {
            this.emailOpens30d = emailOpens30d;
            return this;
        }

        public Builder emailClicks30d(int emailClicks30d) {
            this.emailClicks30d = emailClicks30d;
            return this;
        }

        public Builder emailEngagementScore(int emailEngagementScore) {
            this.emailEngagementScore = emailEngagementScore;
            return this;
        }

        public Builder subscribed(Boolean subscribed) {
            this.subscribed = subscribed;
            return this;
        }

        public Builder lastAction(String lastAction) {
            this.lastAction = lastAction;
            return this;
        }

        public Builder lastActionAt(Instant lastActionAt) {
            this.lastActionAt = lastActionAt;
            return this;
        }

        public Builder lastProductViewedAt(Instant lastProductViewedAt) {
            this.lastProductViewedAt = lastProductViewedAt;
            return this;
        }

        public Builder lastCartAt(Instant lastCartAt) {
            this.lastCartAt = lastCartAt;
            return this;
        }

        public Builder checkoutStartedAt(Instant checkoutStartedAt) {
            this.checkoutStartedAt = checkoutStartedAt;
            return this;
        }

        public Builder cartAbandonedAt(Instant cartAbandonedAt) {
            this.cartAbandonedAt = cartAbandonedAt;
            return this;
        }

        public Builder checkoutAbandonedAt(Instant checkoutAbandonedAt) {
            this.checkoutAbandonedAt = checkoutAbandonedAt;
            return this;
        }

        public Builder orderCompletedAt(Instant orderCompletedAt) {
            this.orderCompletedAt = orderCompletedAt;
            return this;
        }

        public Builder lastDecayedAt(Instant lastDecayedAt) {
            this.lastDecayedAt = lastDecayedAt;
            return this;
        }

        public Builder computedAt(Instant computedAt) {
            this.computedAt = computedAt;
            return this;
        }

        public Builder flags(SyncFlags flags) {
            this.flags = flags;
            return this;
        }

        public ComputedTraits build() {
            return new ComputedTraits(this);
        }
    }
}
