package com.openrangelabs.pmpulse.ingestion.scheduler;

import com.openrangelabs.pmpulse.ingestion.config.IngestionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Polls at the business-hours interval inside the configured local window and at the
 * off-hours interval outside it. When the window is disabled every hour counts as business hours.
 */
@Component
public class BusinessHoursSchedulingPolicy implements SchedulingPolicy {

    private final IngestionProperties.BusinessHours settings;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public BusinessHoursSchedulingPolicy(IngestionProperties properties, Clock clock) {
        this.settings = properties.businessHours();
        if (settings.businessHoursInterval() < 1 || settings.offHoursInterval() < 1) {
            throw new IllegalArgumentException("Sync intervals must be at least one minute, got "
                    + settings.businessHoursInterval() + " and " + settings.offHoursInterval());
        }
        this.zone = ZoneId.of(settings.timezone());
        this.clock = clock;
    }

    @Override
    public boolean isBusinessHours() {
        return isBusinessHours(now());
    }

    public boolean isBusinessHours(ZonedDateTime time) {
        if (!settings.enabled()) {
            return true;
        }
        ZonedDateTime local = time.withZoneSameInstant(zone);
        if (settings.weekdaysOnly() && isWeekend(local.getDayOfWeek())) {
            return false;
        }
        int hour = local.getHour();
        return hour >= settings.startHour() && hour < settings.endHour();
    }

    @Override
    public int getSyncInterval() {
        return getSyncInterval(now());
    }

    public int getSyncInterval(ZonedDateTime time) {
        return isBusinessHours(time) ? settings.businessHoursInterval() : settings.offHoursInterval();
    }

    @Override
    public boolean shouldSyncNow() {
        return shouldSyncAt(now());
    }

    public boolean shouldSyncAt(ZonedDateTime time) {
        int minute = time.withZoneSameInstant(zone).getMinute();
        return minute % getSyncInterval(time) == 0;
    }

    @Override
    public ZonedDateTime getNextSyncTime() {
        return getNextSyncTime(now());
    }

    public ZonedDateTime getNextSyncTime(ZonedDateTime time) {
        ZonedDateTime local = time.withZoneSameInstant(zone).truncatedTo(ChronoUnit.MINUTES);
        int interval = getSyncInterval(time);
        int minute = local.getMinute();
        int next = (minute / interval + 1) * interval;
        if (next >= 60) {
            return local.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        }
        return local.plusMinutes(next - minute);
    }

    @Override
    public String getSyncModeDescription() {
        ZonedDateTime now = now();
        if (!settings.enabled()) {
            return String.format("Fixed interval: every %d minutes", settings.businessHoursInterval());
        }
        if (isBusinessHours(now)) {
            return String.format("Business hours mode: every %d minutes (%s %d:00-%d:00)",
                    settings.businessHoursInterval(), settings.timezone(), settings.startHour(), settings.endHour());
        }
        return String.format("Off-hours mode: every %d minutes", settings.offHoursInterval());
    }

    @Override
    public Map<String, Object> getConfiguration() {
        ZonedDateTime now = now();
        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("enabled", settings.enabled());
        configuration.put("timezone", settings.timezone());
        configuration.put("businessHours", String.format("%d:00 - %d:00", settings.startHour(), settings.endHour()));
        configuration.put("weekdaysOnly", settings.weekdaysOnly());
        configuration.put("businessHoursInterval", settings.businessHoursInterval());
        configuration.put("offHoursInterval", settings.offHoursInterval());
        configuration.put("currentMode", isBusinessHours(now) ? "business_hours" : "off_hours");
        configuration.put("currentInterval", getSyncInterval(now));
        configuration.put("nextSync", getNextSyncTime(now).toOffsetDateTime().toString());
        configuration.put("description", getSyncModeDescription());
        return configuration;
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone);
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
