package io.pulse4j.core;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Immutable identity and schedule of a recurring job.
 *
 * @param name     unique job name
 * @param cron     schedule expression (5-field, 6-field or Quartz cron, or {@code AT HH:mm})
 * @param timezone IANA time zone id the schedule is evaluated in; null means the scheduler default
 * @param enabled  disabled jobs are registered but never started
 */
public record JobDescriptor(
        String name,
        String cron,
        String timezone,
        boolean enabled
) {
    public JobDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(cron, "cron must not be null");
        if (cron.isBlank()) {
            throw new IllegalArgumentException("cron must not be blank for job: " + name);
        }
        if (timezone != null && timezone.isBlank()) {
            timezone = null;
        }
        if (timezone != null) {
            try {
                ZoneId.of(timezone);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid timezone '" + timezone + "' for job: " + name, e);
            }
        }
    }

    public static JobDescriptor of(String name, String cron) {
        return new JobDescriptor(name, cron, null, true);
    }

    public static JobDescriptor of(String name, String cron, String timezone) {
        return new JobDescriptor(name, cron, timezone, true);
    }

    public JobDescriptor disabled() {
        return new JobDescriptor(name, cron, timezone, false);
    }
}
