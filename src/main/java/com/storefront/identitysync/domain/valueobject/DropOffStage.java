package com.storefront.identitysync.domain.valueobject;

/**
 * Coarse funnel position of a unified identity.
 *
 * <pre>
 *   BROWSING → ENGAGED → CART_ABANDONED → CHECKOUT_ABANDONED → PURCHASED
 * </pre>
 */
public enum DropOffStage {

    BROWSING("browsing"),
    ENGAGED("engaged"),
    CART_ABANDONED("cart_abandoned"),
    CHECKOUT_ABANDONED("checkout_abandoned"),
    PURCHASED("purchased");

    private final String value;

    DropOffStage(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return matching stage, or null for null/unknown input
     */
    public static DropOffStage fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DropOffStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        return null;
    }
}
