package com.storefront.identitysync.bootstrap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "identity-sync")
public class IdentitySyncProperties {

    private final Kafka kafka = new Kafka();
    private final Redis redis = new Redis();
    private final Sync sync = new Sync();
    private final Signals signals = new Signals();
    private final Klaviyo klaviyo = new Klaviyo();
    private final Ingest ingest = new Ingest();
    private final Scheduling scheduling = new Scheduling();
    private final Dashboard dashboard = new Dashboard();

    public Kafka getKafka() {
        return kafka;
    }

    public Redis getRedis() {
        return redis;
    }

    public Sync getSync() {
        return sync;
    }

    public Signals getSignals() {
        return signals;
    }

    public Klaviyo getKlaviyo() {
        return klaviyo;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public Scheduling getScheduling() {
        return scheduling;
    }

    public Dashboard getDashboard() {
        return dashboard;
    }

    public static class Kafka {
        private final Topics topics = new Topics();

        public Topics getTopics() {
            return topics;
        }
    }

    public static class Topics {
        private String storefrontEvents = "storefront-events";
        private String dlq = "storefront-events-dlq";

        public String getStorefrontEvents() {
            return storefrontEvents;
        }

        public void setStorefrontEvents(String storefrontEvents) {
            this.storefrontEvents = storefrontEvents;
        }

        public String getDlq() {
            return dlq;
        }

        public void setDlq(String dlq) {
            this.dlq = dlq;
        }
    }

    public static class Redis {
        private String deliveryPrefix = "identity-sync:delivery:";
        private String cooldownPrefix = "identity-sync:cooldown:";
        private long deliveredTtlHours = 24;
        private long processingTtlMinutes = 5;

        public String getDeliveryPrefix() {
            return deliveryPrefix;
        }

        public void setDeliveryPrefix(String deliveryPrefix) {
            this.deliveryPrefix = deliveryPrefix;
        }

        public String getCooldownPrefix() {
            return cooldownPrefix;
        }

        public void setCooldownPrefix(String cooldownPrefix) {
            this.cooldownPrefix = cooldownPrefix;
        }

        public long getDeliveredTtlHours() {
            return deliveredTtlHours;
        }

        public void setDeliveredTtlHours(long deliveredTtlHours) {
            this.deliveredTtlHours = deliveredTtlHours;
        }

        public long getProcessingTtlMinutes() {
            return processingTtlMinutes;
        }

        public void setProcessingTtlMinutes(long processingTtlMinutes) {
            this.processingTtlMinutes = processingTtlMinutes;
        }
    }

    public static class Sync {
        private int batchSize = 50;
        private int maxAttempts = 3;
        private long opportunisticWindowMinutes = 60;
        private int cartIntentThreshold = 50;
        private int productIntentThreshold = 30;
        private long abandonmentCooldownHours = 24;
        private long staleJobMinutes = 15;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getOpportunisticWindowMinutes() {
            return opportunisticWindowMinutes;
        }

        public void setOpportunisticWindowMinutes(long opportunisticWindowMinutes) {
            this.opportunisticWindowMinutes = opportunisticWindowMinutes;
        }

        public int getCartIntentThreshold() {
            return cartIntentThreshold;
        }

        public void setCartIntentThreshold(int cartIntentThreshold) {
            this.cartIntentThreshold = cartIntentThreshold;
        }

        public int getProductIntentThreshold() {
            return productIntentThreshold;
        }

        public void setProductIntentThreshold(int productIntentThreshold) {
            this.productIntentThreshold = productIntentThreshold;
        }

        public long getAbandonmentCooldownHours() {
            return abandonmentCooldownHours;
        }

        public void setAbandonmentCooldownHours(long abandonmentCooldownHours) {
            this.abandonmentCooldownHours = abandonmentCooldownHours;
        }

        public long getStaleJobMinutes() {
            return staleJobMinutes;
        }

        public void setStaleJobMinutes(long staleJobMinutes) {
            this.staleJobMinutes = staleJobMinutes;
        }
    }

    public static class Signals {
        private int engagedThreshold = 20;
        private double dailyDecayFactor = 0.95;
        private long sessionGapMinutes = 30;
        private long cartAbandonMinutes = 60;
        private long checkoutAbandonMinutes = 180;
        private long abandonmentLookbackDays = 7;
        private int batchSize = 100;

        public int getEngagedThreshold() {
            return engagedThreshold;
        }

        public void setEngagedThreshold(int engagedThreshold) {
            this.engagedThreshold = engagedThreshold;
        }

        public double getDailyDecayFactor() {
            return dailyDecayFactor;
        }

        public void setDailyDecayFactor(double dailyDecayFactor) {
            this.dailyDecayFactor = dailyDecayFactor;
        }

        public long getSessionGapMinutes() {
            return sessionGapMinutes;
        }

        public void setSessionGapMinutes(long sessionGapMinutes) {
            this.sessionGapMinutes = sessionGapMinutes;
        }

        public long getCartAbandonMinutes() {
            return cartAbandonMinutes;
        }

        public void setCartAbandonMinutes(long cartAbandonMinutes) {
            this.cartAbandonMinutes = cartAbandonMinutes;
        }

        public long getCheckoutAbandonMinutes() {
            return checkoutAbandonMinutes;
        }

        public void setCheckoutAbandonMinutes(long checkoutAbandonMinutes) {
            this.checkoutAbandonMinutes = checkoutAbandonMinutes;
        }

        public long getAbandonmentLookbackDays() {
            return abandonmentLookbackDays;
        }

        public void setAbandonmentLookbackDays(long abandonmentLookbackDays) {
            this.abandonmentLookbackDays = abandonmentLookbackDays;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Klaviyo {
        private String baseUrl = "https://a.klaviyo.com";
        private String revision = "2024-02-15";
        private long timeoutMs = 10000;
        private long engagementLookbackMinutes = 15;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getRevision() {
            return revision;
        }

        public void setRevision(String revision) {
            this.revision = revision;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getEngagementLookbackMinutes() {
            return engagementLookbackMinutes;
        }

        public void setEngagementLookbackMinutes(long engagementLookbackMinutes) {
            this.engagementLookbackMinutes = engagementLookbackMinutes;
        }
    }

    public static class Ingest {
        private int maxPropertiesBytes = 10240;
        private int maxDepth = 10;

        public int getMaxPropertiesBytes() {
            return maxPropertiesBytes;
        }

        public void setMaxPropertiesBytes(int maxPropertiesBytes) {
            this.maxPropertiesBytes = maxPropertiesBytes;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    public static class Scheduling {
        private boolean enabled = true;
        private long drainIntervalMs = 60000;
        private long maintenanceIntervalMs = 300000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getDrainIntervalMs() {
            return drainIntervalMs;
        }

        public void setDrainIntervalMs(long drainIntervalMs) {
            this.drainIntervalMs = drainIntervalMs;
        }

        public long getMaintenanceIntervalMs() {
            return maintenanceIntervalMs;
        }

        public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
            this.maintenanceIntervalMs = maintenanceIntervalMs;
        }
    }

    public static class Dashboard {
        private int recentFailuresLimit = 10;

        public int getRecentFailuresLimit() {
            return recentFailuresLimit;
        }

        public void setRecentFailuresLimit(int recentFailuresLimit) {
            this.recentFailuresLimit = recentFailuresLimit;
        }
    }
}
