package com.storefront.identitysync.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Identity Resolution & Signal Sync Engine - application entry point.
 * <p>
 * Resolves storefront events onto unified customer identities, derives intent
 * signals and keeps the marketing destination in sync.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports & Adapters)
 * Inbound:      REST ingestion, Kafka feed, scheduled maintenance
 * Tech:         Spring Boot 3.2 + PostgreSQL + Redis + Kafka + Klaviyo API
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.storefront.identitysync")
@ConfigurationPropertiesScan("com.storefront.identitysync.bootstrap.config")
@EnableScheduling
public class IdentitySyncApp {

    public static void main(String[] args) {
        SpringApplication.run(IdentitySyncApp.class, args);
    }
}
