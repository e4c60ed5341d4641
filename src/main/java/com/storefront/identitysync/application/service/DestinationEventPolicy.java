package com.storefront.identitysync.application.service;

import java.util.Map;
import java.util.Optional;

import com.storefront.identitysync.domain.entity.TrackedEvent;

/**
 * Allow-list of events forwarded to the destination, with the metric name each
 * one is reported under. Everything else is blocked.
 */
public final class DestinationEventPolicy {

    public static final String ADDED_TO_CART = "SF Added to Cart";
    public static final String STARTED_CHECKOUT = "SF Started Checkout";
    public static final String PLACED_ORDER = "SF Placed Order";
    public static final String CART_ABANDONED = "SF Cart Abandoned";
    public static final String CHECKOUT_ABANDONED = "SF Checkout Abandoned";

    private static final Map<String, String> DERIVED_METRICS = Map.of(
            SignalComputer.AbandonmentKind.CART.getEventName(), CART_ABANDONED,
            SignalComputer.AbandonmentKind.CHECKOUT.getEventName(), CHECKOUT_ABANDONED);

    private DestinationEventPolicy() {
    }

    /**
     * @return the metric name, or empty if the event must not leave the system
     */
    public static Optional<String> metricNameFor(TrackedEvent event) {
        if (event.isDerived()) {
            return Optional.ofNullable(DERIVED_METRICS.get(event.getEventName()));
        }
        return switch (event.category()) {
            case CART_ADD -> Optional.of(ADDED_TO_CART);
            case CHECKOUT -> Optional.of(STARTED_CHECKOUT);
            case ORDER -> Optional.of(PLACED_ORDER);
            default -> Optional.empty();
        };
    }
}
