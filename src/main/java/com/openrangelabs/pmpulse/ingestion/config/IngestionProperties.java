package com.openrangelabs.pmpulse.ingestion.config;

import com.openrangelabs.pmpulse.ingestion.model.ResourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Immutable ingestion settings bound once at startup from the {@code pmpulse.*} keys
 * and injected into every component of the sync pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "pmpulse")
public record IngestionProperties(
        @DefaultValue Api api,
        @DefaultValue RateLimit rateLimit,
        @DefaultValue Sync sync,
        @Valid @DefaultValue BusinessHours businessHours,
        @DefaultValue Alerts alerts,
        @DefaultValue Features features,
        @DefaultValue Scheduling scheduling,
        @DefaultValue Retention retention,
        @DefaultValue Encryption encryption) {

    public static IngestionProperties defaults() {
        return new IngestionProperties(Api.defaults(), RateLimit.defaults(), Sync.defaults(),
                BusinessHours.defaults(), Alerts.defaults(), Features.defaults(),
                Scheduling.defaults(), Retention.defaults(), Encryption.defaults());
    }

    public IngestionProperties withRateLimit(RateLimit rateLimit) {
        return new IngestionProperties(api, rateLimit, sync, businessHours, alerts, features, scheduling, retention, encryption);
    }

    public IngestionProperties withSync(Sync sync) {
        return new IngestionProperties(api, rateLimit, sync, businessHours, alerts, features, scheduling, retention, encryption);
    }

    public IngestionProperties withBusinessHours(BusinessHours businessHours) {
        return new IngestionProperties(api, rateLimit, sync, businessHours, alerts, features, scheduling, retention, encryption);
    }

    public IngestionProperties withAlerts(Alerts alerts) {
        return new IngestionProperties(api, rateLimit, sync, businessHours, alerts, features, scheduling, retention, encryption);
    }

    public IngestionProperties withFeatures(Features features) {
        return new IngestionProperties(api, rateLimit, sync, businessHours, alerts, features, scheduling, retention, encryption);
    }

    public record Api(
            @DefaultValue("https://api.appfolio.com") String baseUrl,
            @DefaultValue("30s") Duration timeout) {

        public static Api defaults() {
            return new Api("https://api.appfolio.com", Duration.ofSeconds(30));
        }
    }

    public record RateLimit(
            @DefaultValue("3") int maxRetries,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("60s") Duration maxBackoff) {

        public static RateLimit defaults() {
            return new RateLimit(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
        }

        /**
         * Backoff before the given retry (1-based), capped at the maximum
         */
        public Duration backoffFor(long retryNumber) {
            double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, retryNumber - 1));
            return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
        }
    }

    public record Sync(
            @DefaultValue("100") int batchSize,
            @DefaultValue("1000") int maxPages,
            @DefaultValue("7") int incrementalDays,
            @DefaultValue("365") int fullSyncLookbackDays,
            @DefaultValue({"properties", "units", "vendors", "leases", "work_orders", "expenses"})
            List<ResourceType> resources,
            @DefaultValue("2h") Duration staleRunTimeout,
            @DefaultValue("2h") Duration lockTtl) {

        public static Sync defaults() {
            return new Sync(100, 1000, 7, 365, List.of(ResourceType.values()),
                    Duration.ofHours(2), Duration.ofHours(2));
        }
    }

    public record BusinessHours(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("America/Los_Angeles") String timezone,
            @Min(0) @Max(23) @DefaultValue("9") int startHour,
            @Min(1) @Max(24) @DefaultValue("17") int endHour,
            @DefaultValue("true") boolean weekdaysOnly,
            @Min(1) @Max(60) @DefaultValue("15") int businessHoursInterval,
            @Min(1) @Max(60) @DefaultValue("60") int offHoursInterval) {

        public static BusinessHours defaults() {
            return new BusinessHours(true, "America/Los_Angeles", 9, 17, true, 15, 60);
        }
    }

    public record Alerts(
            @DefaultValue("3") int failureThreshold,
            @DefaultValue("60") int cooldownMinutes,
            @DefaultValue List<String> recipients,
            String webhookUrl,
            @DefaultValue("10") int maxFailureDetails) {

        public static Alerts defaults() {
            return new Alerts(3, 60, List.of(), null, 10);
        }
    }

    public record Features(@DefaultValue("true") boolean notifications) {

        public static Features defaults() {
            return new Features(true);
        }
    }

    public record Scheduling(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0 0 2 * * *") String fullSyncCron) {

        public static Scheduling defaults() {
            return new Scheduling(true, "0 0 2 * * *");
        }
    }

    public record Retention(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("30") int retentionDays,
            @DefaultValue("500") int batchSize) {

        public static Retention defaults() {
            return new Retention(true, 30, 500);
        }
    }

    public record Encryption(
            @DefaultValue("pmpulse-local-development-key") String password,
            @DefaultValue("5c0744940b5c369b") String salt) {

        public static Encryption defaults() {
            return new Encryption("pmpulse-local-development-key", "5c0744940b5c369b");
        }
    }
}
