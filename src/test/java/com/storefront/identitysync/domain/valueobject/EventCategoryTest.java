package com.storefront.identitysync.domain.valueobject;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class EventCategoryTest {

    @Test
    void testClassify_NormalizesNamingVariants() {
        assertEquals(EventCategory.CART_ADD, EventCategory.classify("track", "product_added_to_cart"));
        assertEquals(EventCategory.CART_ADD, EventCategory.classify("track", "Add to Cart"));
        assertEquals(EventCategory.CART_REMOVE, EventCategory.classify("track", "remove-from-cart"));
        assertEquals(EventCategory.ORDER, EventCategory.classify("track", "checkout_completed"));
        assertEquals(EventCategory.CHECKOUT, EventCategory.classify("track", "Checkout Started"));
        assertEquals(EventCategory.PRODUCT_VIEW, EventCategory.classify("track", "Product Viewed"));
        assertEquals(EventCategory.EMAIL_OPEN, EventCategory.classify("email", "Opened Email"));
        assertEquals(EventCategory.EMAIL_NEUTRAL, EventCategory.classify("email", "Unsubscribed"));
    }

    @Test
    void testClassify_FallsBackToEventType() {
        assertEquals(EventCategory.PAGE_VIEW, EventCategory.classify("page", "Home"));
        assertEquals(EventCategory.OTHER, EventCategory.classify("track", "Wishlist Shared"));
        assertEquals(EventCategory.OTHER, EventCategory.classify(null, null));
    }

    @Test
    void testApplyIntent_ClampsAndOrderMaxes() {
        assertEquals(100, EventCategory.CHECKOUT.applyIntent(95));
        assertEquals(0, EventCategory.CART_REMOVE.applyIntent(3));
        assertEquals(100, EventCategory.ORDER.applyIntent(0));
        assertEquals(13, EventCategory.CART_ADD.applyIntent(3));
    }
}
