package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SignalStore;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.IdentitySignal;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.DropOffStage;
import com.storefront.identitysync.domain.valueobject.EventCategory;

/**
 * Derives behavioral traits from a unified identity's event history.
 * <p>
 * Every write to the computed bag is a compare-and-set against the identity
 * version, retried on conflict, so it is safe to run concurrently with
 * ingestion and with itself. Flags are carried through unchanged.
 * </p>
 *
 * <ul>
 * <li>{@link #onEvent}: incremental update for one new event</li>
 * <li>{@link #recompute}: rebuilds windowed counters from recent history</li>
 * <li>{@link #decayRecency}: lowers intent for identities gone quiet</li>
 * <li>{@link #detectAbandonments}: confirms cart/checkout abandonment after a quiet period</li>
 * </ul>
 */
public class SignalComputer {

    private static final Logger log = Logger.getLogger(SignalComputer.class.getName());

    private static final String[] ORDER_TOTAL_PROPERTIES = { "total_price", "total", "revenue", "value", "amount" };
    private static final String[] PRODUCT_ID_PROPERTIES = { "product_id", "productId", "variant_id", "sku", "handle" };
    private static final String[] CATEGORY_PROPERTIES = { "category", "product_type", "collection" };

    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final SignalStore signalStore;
    private final Clock clock;
    private final Settings settings;

    public SignalComputer(IdentityStore identityStore,
            EventStore eventStore,
            SignalStore signalStore,
            Clock clock,
            Settings settings) {
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (settings == null)
            throw new IllegalArgumentException("settings cannot be null");

        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.signalStore = signalStore;
        this.clock = clock;
        this.settings = settings;
    }

    // ─────────────────── Operations ───────────────────

    /**
     * Folds one event into the identity's computed traits.
     *
     * @return the traits as written
     * @throws IllegalStateException if the identity is missing or the update
     *                               keeps losing the version race
     */
    public ComputedTraits onEvent(String unifiedUserId, TrackedEvent event) {
        ComputedTraits result = updateWithRetry(unifiedUserId,
                (identity, now) -> applyEvent(identity.getComputed(), event, now, settings));
        log.fine(String.format("action=signals_updated unifiedUserId=%s event=%s intent=%d stage=%s",
                unifiedUserId, event.getEventName(), result.getIntentScore(), result.getDropOffStage()));
        return result;
    }

    /**
     * Rebuilds the windowed counters from the last 30 days of events. Lifetime
     * counters, funnel timestamps and flags are kept.
     */
    public ComputedTraits recompute(String unifiedUserId) {
        Instant now = clock.instant();
        List<TrackedEvent> history = eventStore.findByUnifiedUserSince(unifiedUserId,
                now.minus(settings.historyWindow()));

        ComputedTraits result = updateWithRetry(unifiedUserId,
                (identity, at) -> rebuildWindowed(identity.getComputed(), history, at, settings.sessionGap()));

        UnifiedIdentity identity = identityStore.findById(unifiedUserId).orElse(null);
        if (identity != null) {
            signalStore.upsert(new IdentitySignal(identity.getWorkspaceId(), unifiedUserId,
                    IdentitySignal.INTENT, result.getIntentScore(),
                    Map.of("drop_off_stage", stageValue(result.getDropOffStage())), now));
        }
        return result;
    }

    /**
     * Recomputes identities active in the last 7 days whose computed state is
     * more than an hour old.
     *
     * @return identities recomputed
     */
    public int recomputeStale(int limit) {
        Instant now = clock.instant();
        List<String> ids = identityStore.findStaleActive(
                now.minus(settings.activeWindow()), now.minus(settings.staleAfter()), limit);

        int recomputed = 0;
        for (String id : ids) {
            try {
                recompute(id);
                recomputed++;
            } catch (IllegalStateException e) {
                log.log(Level.WARNING, String.format(
                        "action=recompute_skipped unifiedUserId=%s error=%s", id, e.getMessage()), e);
            }
        }
        log.info(String.format("action=recompute_batch candidates=%d recomputed=%d", ids.size(), recomputed));
        return recomputed;
    }

    /**
     * Applies the daily intent decay and refreshes {@code recency_days} for
     * identities not seen for more than a day.
     *
     * @return identities decayed
     */
    public int decayRecency(int limit) {
        Instant now = clock.instant();
        List<String> ids = identityStore.findInactiveSince(now.minus(Duration.ofDays(1)),
                now.minus(Duration.ofDays(1)), limit);

        int decayed = 0;
        for (String id : ids) {
            try {
                updateWithRetry(id, (identity, at) -> {
                    ComputedTraits next = decay(identity.getComputed(), identity.getLastSeenAt(), at,
                            settings.dailyDecayFactor());
                    return next != null ? next : identity.getComputed();
                });
                decayed++;
            } catch (IllegalStateException e) {
                log.log(Level.WARNING, String.format(
                        "action=decay_skipped unifiedUserId=%s error=%s", id, e.getMessage()), e);
            }
        }
        log.info(String.format("action=decay_batch candidates=%d decayed=%d", ids.size(), decayed));
        return decayed;
    }

    /**
     * Confirms abandonment for identities whose last cart activity is older
     * than 60 minutes, or whose checkout is older than 180 minutes, without a
     * later order. Each confirmation records a signal row so it is reported
     * once per funnel.
     *
     * @return confirmed abandonments, checkout first
     */
    public List<AbandonmentDetection> detectAbandonments(int limit) {
        Instant now = clock.instant();
        Instant lookbackStart = now.minus(settings.abandonmentLookback());
        List<AbandonmentDetection> detections = new ArrayList<>();

        for (String id : identityStore.findCheckoutAbandonmentCandidates(
                now.minus(settings.checkoutAbandonAfter()), lookbackStart, limit)) {
            confirm(id, AbandonmentKind.CHECKOUT).ifPresent(detections::add);
        }
        for (String id : identityStore.findCartAbandonmentCandidates(
                now.minus(settings.cartAbandonAfter()), lookbackStart, limit)) {
            confirm(id, AbandonmentKind.CART).ifPresent(detections::add);
        }

        log.info(String.format("action=abandonment_sweep detected=%d", detections.size()));
        return detections;
    }

    // ─────────────────── Pure Rules ───────────────────

    /**
     * Applies one event to the current traits.
     */
    public static ComputedTraits applyEvent(ComputedTraits current, TrackedEvent event, Instant now,
            Settings settings) {
        EventCategory category = event.category();
        ComputedTraits.Builder b = current.toBuilder();
        b.intentScore(category.applyIntent(current.getIntentScore()));

        if (!category.isEmailEngagement()) {
            Instant lastSession = current.getLastSessionAt();
            if (lastSession == null || Duration.between(lastSession, now).compareTo(settings.sessionGap()) > 0) {
                b.sessionCount30d(current.getSessionCount30d() + 1);
            }
            b.lastSessionAt(now);
            b.recencyDays(0);
        }

        switch (category) {
            case ORDER -> b.ordersCount(current.getOrdersCount() + 1)
                    .lifetimeValue(current.getLifetimeValue() + orderTotal(event))
                    .orderCompletedAt(now)
                    .cartAbandonedAt(null)
                    .checkoutAbandonedAt(null)
                    .lastCartAt(null)
                    .checkoutStartedAt(null);
            case CHECKOUT, PAYMENT -> {
                if (current.getCheckoutStartedAt() == null) {
                    b.checkoutStartedAt(now);
                }
            }
            case CART_ADD -> {
                if (current.getLastCartAt() == null) {
                    b.lastCartAt(now);
                }
                b.atcCount7d(current.getAtcCount7d() + 1);
            }
            case PRODUCT_VIEW -> {
                if (current.getLastProductViewedAt() == null) {
                    b.lastProductViewedAt(now);
                }
                b.productsViewedCount(current.getProductsViewedCount() + 1);
                String viewedCategory = event.firstProperty(CATEGORY_PROPERTIES);
                if (viewedCategory != null) {
                    b.topCategory30d(viewedCategory);
                }
            }
            case EMAIL_OPEN -> b.emailOpens30d(current.getEmailOpens30d() + 1)
                    .emailEngagementScore(current.getEmailEngagementScore() + 1);
            case EMAIL_CLICK -> b.emailClicks30d(current.getEmailClicks30d() + 1)
                    .emailEngagementScore(current.getEmailEngagementScore() + 3);
            case LIST_SUBSCRIBE -> b.subscribed(Boolean.TRUE)
                    .emailEngagementScore(current.getEmailEngagementScore() + 1);
            case SMS_CLICK -> b.emailEngagementScore(current.getEmailEngagementScore() + 2);
            case EMAIL_NEUTRAL -> {
                if (event.getEventName().toLowerCase(Locale.ROOT).contains("unsubscribed")) {
                    b.subscribed(Boolean.FALSE);
                }
            }
            default -> {
            }
        }

        ComputedTraits intermediate = b.build();
        DropOffStage stage = deriveStage(intermediate, category, settings.engagedThreshold());
        b.dropOffStage(stage);
        if (stage == DropOffStage.CHECKOUT_ABANDONED && intermediate.getCheckoutAbandonedAt() == null) {
            b.checkoutAbandonedAt(now);
        }
        if (stage == DropOffStage.CART_ABANDONED && intermediate.getCartAbandonedAt() == null) {
            b.cartAbandonedAt(now);
        }

        return b.lastAction(event.getEventName())
                .lastActionAt(now)
                .computedAt(now)
                .build();
    }

    /**
     * Funnel stage from (state after the event, event category). Priority:
     * purchased, then the stage implied by the event itself, then recorded
     * abandonment, then engaged by intent, then browsing.
     */
    public static DropOffStage deriveStage(ComputedTraits state, EventCategory category, int engagedThreshold) {
        if (category.isOrder()) {
            return DropOffStage.PURCHASED;
        }
        if (!category.isCart() && !category.isCheckout() && state.hasPurchasedSinceLastFunnelActivity()) {
            return DropOffStage.PURCHASED;
        }
        if (category.isCheckout()) {
            return DropOffStage.CHECKOUT_ABANDONED;
        }
        if (category.isCart()) {
            return DropOffStage.CART_ABANDONED;
        }
        if (state.getCheckoutAbandonedAt() != null) {
            return DropOffStage.CHECKOUT_ABANDONED;
        }
        if (state.getCartAbandonedAt() != null) {
            return DropOffStage.CART_ABANDONED;
        }
        if (state.getIntentScore() >= engagedThreshold) {
            return DropOffStage.ENGAGED;
        }
        return DropOffStage.BROWSING;
    }

    /**
     * Rebuilds 30 day counters from history (oldest first).
     */
    static ComputedTraits rebuildWindowed(ComputedTraits current, List<TrackedEvent> history, Instant now,
            Duration sessionGap) {
        Instant atcWindowStart = now.minus(Duration.ofDays(7));
        int sessions = 0;
        Instant previous = null;
        int productViews = 0;
        int atc = 0;
        int opens = 0;
        int clicks = 0;
        int engagement = 0;
        Set<String> products = new HashSet<>();
        Map<String, Integer> categories = new HashMap<>();

        List<TrackedEvent> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(TrackedEvent::getEventTime));

        for (TrackedEvent event : ordered) {
            EventCategory category = event.category();
            if (event.isDerived()) {
                continue;
            }
            if (!category.isEmailEngagement()) {
                if (previous == null || Duration.between(previous, event.getEventTime()).compareTo(sessionGap) > 0) {
                    sessions++;
                }
                previous = event.getEventTime();
            }
            switch (category) {
                case PRODUCT_VIEW -> {
                    productViews++;
                    String productId = event.firstProperty(PRODUCT_ID_PROPERTIES);
                    if (productId != null) {
                        products.add(productId);
                    }
                    String viewedCategory = event.firstProperty(CATEGORY_PROPERTIES);
                    if (viewedCategory != null) {
                        categories.merge(viewedCategory, 1, Integer::sum);
                    }
                }
                case CART_ADD -> {
                    if (!event.getEventTime().isBefore(atcWindowStart)) {
                        atc++;
                    }
                }
                case EMAIL_OPEN -> {
                    opens++;
                    engagement += 1;
                }
                case EMAIL_CLICK -> {
                    clicks++;
                    engagement += 3;
                }
                case LIST_SUBSCRIBE -> engagement += 1;
                case SMS_CLICK -> engagement += 2;
                default -> {
                }
            }
        }

        String topCategory = categories.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(current.getTopCategory30d());

        return current.toBuilder()
                .sessionCount30d(sessions)
                .productsViewedCount(productViews)
                .uniqueProductsViewed(products.size())
                .categoriesViewedCount(categories.size())
                .topCategory30d(topCategory)
                .atcCount7d(atc)
                .emailOpens30d(opens)
                .emailClicks30d(clicks)
                .emailEngagementScore(engagement)
                .frequencyScore(EventCategory.clampIntent(sessions * 10L))
                .depthScore(EventCategory.clampIntent(products.size() * 5L + categories.size() * 5L))
                .lastSessionAt(latest(current.getLastSessionAt(), previous))
                .computedAt(now)
                .build();
    }

    /**
     * Daily decay: intent multiplied by {@code factor^days} for every whole day
     * since the later of last activity and last decay.
     *
     * @return decayed traits, or null if nothing changes yet
     */
    static ComputedTraits decay(ComputedTraits current, Instant lastSeenAt, Instant now, double factor) {
        int recencyDays = (int) Duration.between(lastSeenAt, now).toDays();
        if (recencyDays < 1) {
            return null;
        }
        Instant anchor = latest(lastSeenAt, current.getLastDecayedAt());
        long decayDays = Duration.between(anchor, now).toDays();

        ComputedTraits.Builder b = current.toBuilder().recencyDays(recencyDays);
        if (decayDays >= 1) {
            int intent = (int) Math.floor(current.getIntentScore() * Math.pow(factor, decayDays));
            b.intentScore(EventCategory.clampIntent(intent))
                    .lastDecayedAt(anchor.plus(Duration.ofDays(decayDays)));
        } else if (current.getRecencyDays() != null && current.getRecencyDays() == recencyDays) {
            return null;
        }
        return b.computedAt(now).build();
    }

    /**
     * @return the cart timestamp being abandoned, or null when the cart is
     *         still fresh or was followed by checkout or order
     */
    static Instant cartAbandonmentAnchor(ComputedTraits traits, Instant now, Duration after) {
        Instant cartAt = traits.getLastCartAt();
        if (cartAt == null || cartAt.isAfter(now.minus(after))) {
            return null;
        }
        if (isAtOrAfter(traits.getCheckoutStartedAt(), cartAt) || isAtOrAfter(traits.getOrderCompletedAt(), cartAt)) {
            return null;
        }
        return cartAt;
    }

    /**
     * @return the checkout timestamp being abandoned, or null when the checkout
     *         is still fresh or was followed by an order
     */
    static Instant checkoutAbandonmentAnchor(ComputedTraits traits, Instant now, Duration after) {
        Instant checkoutAt = traits.getCheckoutStartedAt();
        if (checkoutAt == null || checkoutAt.isAfter(now.minus(after))) {
            return null;
        }
        if (isAtOrAfter(traits.getOrderCompletedAt(), checkoutAt)) {
            return null;
        }
        return checkoutAt;
    }

    // ─────────────────── Private Helpers ───────────────────

    private Optional<AbandonmentDetection> confirm(String unifiedUserId, AbandonmentKind kind) {
        UnifiedIdentity identity = identityStore.findById(unifiedUserId).orElse(null);
        if (identity == null) {
            return Optional.empty();
        }
        Duration after = kind == AbandonmentKind.CHECKOUT
                ? settings.checkoutAbandonAfter()
                : settings.cartAbandonAfter();
        Instant anchor = kind == AbandonmentKind.CHECKOUT
                ? checkoutAbandonmentAnchor(identity.getComputed(), clock.instant(), after)
                : cartAbandonmentAnchor(identity.getComputed(), clock.instant(), after);
        if (anchor == null) {
            return Optional.empty();
        }

        ComputedTraits written = updateWithRetry(unifiedUserId, (current, now) -> {
            ComputedTraits traits = current.getComputed();
            ComputedTraits.Builder b = traits.toBuilder();
            if (kind == AbandonmentKind.CHECKOUT) {
                if (traits.getCheckoutAbandonedAt() == null) {
                    b.checkoutAbandonedAt(now);
                }
                b.dropOffStage(DropOffStage.CHECKOUT_ABANDONED);
            } else {
                if (traits.getCartAbandonedAt() == null) {
                    b.cartAbandonedAt(now);
                }
                if (traits.getDropOffStage() != DropOffStage.CHECKOUT_ABANDONED) {
                    b.dropOffStage(DropOffStage.CART_ABANDONED);
                }
            }
            return b.computedAt(now).build();
        });

        Instant now = clock.instant();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("anchor", anchor.toString());
        payload.put("drop_off_stage", stageValue(written.getDropOffStage()));
        signalStore.upsert(new IdentitySignal(identity.getWorkspaceId(), unifiedUserId,
                kind.getSignalType(), written.getIntentScore(), payload, now));

        log.info(String.format("action=abandonment_detected unifiedUserId=%s kind=%s anchor=%s",
                unifiedUserId, kind, anchor));
        return Optional.of(new AbandonmentDetection(identity.getWorkspaceId(), unifiedUserId,
                kind, anchor, written.getIntentScore()));
    }

    private ComputedTraits updateWithRetry(String unifiedUserId,
            BiFunction<UnifiedIdentity, Instant, ComputedTraits> change) {
        for (int attempt = 1; attempt <= settings.casAttempts(); attempt++) {
            UnifiedIdentity identity = identityStore.findById(unifiedUserId)
                    .orElseThrow(() -> new IllegalStateException("identity not found: " + unifiedUserId));
            Instant now = clock.instant();
            ComputedTraits next = change.apply(identity, now);
            if (identityStore.updateComputed(unifiedUserId, identity.getVersion(), next, now)) {
                return next;
            }
            log.fine(String.format("action=computed_version_conflict unifiedUserId=%s attempt=%d",
                    unifiedUserId, attempt));
        }
        throw new IllegalStateException("computed update for " + unifiedUserId
                + " lost the version race " + settings.casAttempts() + " times");
    }

    private static double orderTotal(TrackedEvent event) {
        String raw = event.firstProperty(ORDER_TOTAL_PROPERTIES);
        if (raw == null) {
            return 0.0;
        }
        try {
            return Math.max(0.0, Double.parseDouble(raw));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static boolean isAtOrAfter(Instant candidate, Instant reference) {
        return candidate != null && !candidate.isBefore(reference);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static String stageValue(DropOffStage stage) {
        return stage != null ? stage.getValue() : DropOffStage.BROWSING.getValue();
    }

    // ─────────────────── Types ───────────────────

    /**
     * Tunables for signal computation.
     *
     * @param engagedThreshold     intent at which an identity counts as engaged
     * @param dailyDecayFactor     intent multiplier per inactive day
     * @param sessionGap           inactivity gap that starts a new session
     * @param cartAbandonAfter     quiet period after a cart add
     * @param checkoutAbandonAfter quiet period after a checkout start
     * @param activeWindow         recently-seen window for batch recompute
     * @param staleAfter           computed state age that triggers recompute
     * @param historyWindow        event window for windowed counters
     * @param abandonmentLookback  oldest funnel activity still considered
     * @param casAttempts          optimistic write attempts
     */
    public record Settings(
            int engagedThreshold,
            double dailyDecayFactor,
            Duration sessionGap,
            Duration cartAbandonAfter,
            Duration checkoutAbandonAfter,
            Duration activeWindow,
            Duration staleAfter,
            Duration historyWindow,
            Duration abandonmentLookback,
            int casAttempts) {

        public static Settings defaults() {
            return new Settings(20, 0.95, Duration.ofMinutes(30), Duration.ofMinutes(60),
                    Duration.ofMinutes(180), Duration.ofDays(7), Duration.ofHours(1),
                    Duration.ofDays(30), Duration.ofDays(7), 3);
        }
    }

    public enum AbandonmentKind {
        CART("Cart Abandoned", IdentitySignal.CART_ABANDONMENT),
        CHECKOUT("Checkout Abandoned", IdentitySignal.CHECKOUT_ABANDONMENT);

        private final String eventName;
        private final String signalType;

        AbandonmentKind(String eventName, String signalType) {
            this.eventName = eventName;
            this.signalType = signalType;
        }

        public String getEventName() {
            return eventName;
        }

        public String getSignalType() {
            return signalType;
        }
    }

    public record AbandonmentDetection(
            String workspaceId,
            String unifiedUserId,
            AbandonmentKind kind,
            Instant anchor,
            int intentScore) {
    }
}
