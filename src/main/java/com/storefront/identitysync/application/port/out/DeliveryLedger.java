package com.storefront.identitysync.application.port.out;

import java.time.Duration;

/**
 * Secondary (outbound) port: short-lived delivery markers shared by every
 * worker instance.
 */
public interface DeliveryLedger {

    /**
     * Marks a delivery as in progress.
     *
     * @return false if the delivery already completed
     * @throws IllegalStateException if another worker holds it in progress
     */
    boolean beginDelivery(String deliveryKey);

    void completeDelivery(String deliveryKey);

    /** Releases an in-progress marker after a failed call. */
    void abandonDelivery(String deliveryKey);

    /**
     * Starts a cooldown window unless one is already running.
     *
     * @return true if the caller may proceed
     */
    boolean tryStartCooldown(String cooldownKey, Duration cooldown);
}
