package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;

/**
 * Behavioral classification of a tracked event and its intent weight.
 * <p>
 * Storefront integrations name the same action differently
 * ({@code product_added_to_cart}, {@code Add to Cart}, {@code add-to-cart}),
 * so classification works on a normalized, lower-cased form of the event name
 * and falls back to the event type.
 * </p>
 *
 * <pre>
 * ORDER sets intent to 100; every other category adds its weight.
 * The result is always clamped to [0, 100].
 * </pre>
 */
public enum EventCategory {

    PAGE_VIEW(1),
    COLLECTION_VIEW(2),
    PRODUCT_VIEW(3),
    SEARCH(4),
    POLICY_VIEW(5),
    CART_ADD(10),
    CART_REMOVE(-5),
    CHECKOUT(20),
    PAYMENT(10),
    ORDER(0),
    EMAIL_OPEN(3),
    EMAIL_CLICK(5),
    LIST_SUBSCRIBE(2),
    SMS_CLICK(4),
    EMAIL_NEUTRAL(0),
    OTHER(1);

    public static final int MIN_INTENT = 0;
    public static final int MAX_INTENT = 100;

    private final int intentWeight;

    EventCategory(int intentWeight) {
        this.intentWeight = intentWeight;
    }

    public int getIntentWeight() {
        return intentWeight;
    }

    /**
     * Applies this category's contribution to an intent score.
     *
     * @param currentScore score before the event
     * @return new score, clamped to [0, 100]
     */
    public int applyIntent(int currentScore) {
        if (this == ORDER) {
            return MAX_INTENT;
        }
        return clampIntent(currentScore + intentWeight);
    }

    public static int clampIntent(long score) {
        return (int) Math.max(MIN_INTENT, Math.min(MAX_INTENT, score));
    }

    public boolean isCart() {
        return this == CART_ADD || this == CART_REMOVE;
    }

    public boolean isCheckout() {
        return this == CHECKOUT || this == PAYMENT;
    }

    public boolean isOrder() {
        return this == ORDER;
    }

    public boolean isProductView() {
        return this == PRODUCT_VIEW;
    }

    public boolean isEmailEngagement() {
        return this == EMAIL_OPEN || this == EMAIL_CLICK || this == LIST_SUBSCRIBE
                || this == SMS_CLICK || this == EMAIL_NEUTRAL;
    }

    /**
     * Classifies an event by name first, then by type.
     */
    public static EventCategory classify(String eventType, String eventName) {
        EventCategory byName = classifyText(eventName);
        if (byName != OTHER) {
            return byName;
        }
        return classifyText(eventType);
    }

    private static EventCategory classifyText(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String text = raw.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');

        EventCategory exact = switch (text) {
            case "opened email" -> EMAIL_OPEN;
            case "clicked email" -> EMAIL_CLICK;
            case "subscribed to list" -> LIST_SUBSCRIBE;
            case "clicked sms" -> SMS_CLICK;
            case "received email", "unsubscribed", "unsubscribed from list" -> EMAIL_NEUTRAL;
            default -> null;
        };
        if (exact != null) {
            return exact;
        }

        if (text.contains("checkout") && text.contains("complete")) {
            return ORDER;
        }
        if (text.contains("order") || text.contains("purchase")) {
            return ORDER;
        }
        if (text.contains("cart")) {
            return text.contains("remove") ? CART_REMOVE : CART_ADD;
        }
        if (text.contains("checkout")) {
            return CHECKOUT;
        }
        if (text.contains("payment")) {
            return PAYMENT;
        }
        if (text.contains("product") || text.contains("view item")) {
            return PRODUCT_VIEW;
        }
        if (text.contains("collection")) {
            return COLLECTION_VIEW;
        }
        if (text.contains("search")) {
            return SEARCH;
        }
        if (text.contains("shipping") || text.contains("return")) {
            return POLICY_VIEW;
        }
        if (text.contains("page")) {
            return PAGE_VIEW;
        }
        return OTHER;
    }
}
