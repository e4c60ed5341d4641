package com.storefront.identitysync.adapters.out.redis;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.DeliveryLedger;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Redis-backed delivery markers.
 * <p>
 * A delivery key moves PROCESSING → DONE. PROCESSING expires on its own so a
 * crashed worker never blocks redelivery for longer than the processing TTL.
 * </p>
 */
@Component
public class RedisDeliveryLedger implements DeliveryLedger {

    private static final Logger log = LoggerFactory.getLogger(RedisDeliveryLedger.class);

    static final String PROCESSING = "PROCESSING";
    static final String DONE = "DONE";

    private final StringRedisTemplate redisTemplate;
    private final String deliveryPrefix;
    private final String cooldownPrefix;
    private final long deliveredTtlHours;
    private final long processingTtlMinutes;

    private final Counter duplicateDeliveries;

    public RedisDeliveryLedger(StringRedisTemplate redisTemplate,
            IdentitySyncProperties properties,
            MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.deliveryPrefix = properties.getRedis().getDeliveryPrefix();
        this.cooldownPrefix = properties.getRedis().getCooldownPrefix();
        this.deliveredTtlHours = properties.getRedis().getDeliveredTtlHours();
        this.processingTtlMinutes = properties.getRedis().getProcessingTtlMinutes();
        this.duplicateDeliveries = meterRegistry.counter("identity_sync.delivery.duplicate");
    }

    @Override
    public boolean beginDelivery(String deliveryKey) {
        String key = deliveryPrefix + deliveryKey;
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key, PROCESSING, processingTtlMinutes, TimeUnit.MINUTES);

        if (Boolean.FALSE.equals(acquired)) {
            String existingStatus = redisTemplate.opsForValue().get(key);
            if (DONE.equals(existingStatus)) {
                duplicateDeliveries.increment();
                log.warn("action=duplicate_delivery_skipped key={}", deliveryKey);
                return false;
            }
            log.warn("action=delivery_inflight key={} status={}", deliveryKey, existingStatus);
            throw new IllegalStateException("Delivery already in progress for key=" + deliveryKey);
        }
        return true;
    }

    @Override
    public void completeDelivery(String deliveryKey) {
        redisTemplate.opsForValue().set(deliveryPrefix + deliveryKey, DONE, deliveredTtlHours, TimeUnit.HOURS);
    }

    @Override
    public void abandonDelivery(String deliveryKey) {
        redisTemplate.delete(deliveryPrefix + deliveryKey);
        log.debug("action=delivery_released key={}", deliveryKey);
    }

    @Override
    public boolean tryStartCooldown(String cooldownKey, Duration cooldown) {
        Boolean started = redisTemplate.opsForValue()
                .setIfAbsent(cooldownPrefix + cooldownKey, "1", cooldown.toSeconds(), TimeUnit.SECONDS);
        if (!Boolean.TRUE.equals(started)) {
            log.info("action=cooldown_active key={}", cooldownKey);
            return false;
        }
        return true;
    }
}
