package io.pulse4j.config;

import io.pulse4j.JobHandler;
import io.pulse4j.core.JobDescriptor;

import java.util.Objects;

/**
 * Declares a job as a bean. Every registration found in the context is registered with the
 * scheduler before it starts.
 *
 * <pre>{@code
 * @Bean
 * JobRegistration expirySweep(BonusService bonuses) {
 *     return JobRegistration.of("expiry-sweep", "0 * * * *", ctx -> bonuses.cleanupExpired());
 * }
 * }</pre>
 */
public record JobRegistration(
        JobDescriptor descriptor,
        JobHandler handler
) {
    public JobRegistration {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
    }

    public static JobRegistration of(String name, String cron, JobHandler handler) {
        return new JobRegistration(JobDescriptor.of(name, cron), handler);
    }

    /**
     * Apply configured overrides; fields left unset keep the declared values.
     */
    JobRegistration withOverride(PulseProperties.JobOverride override) {
        if (override == null) {
            return this;
        }
        JobDescriptor d = descriptor;
        JobDescriptor merged = new JobDescriptor(
                d.name(),
                override.getCron() != null ? override.getCron() : d.cron(),
                override.getTimezone() != null ? override.getTimezone() : d.timezone(),
                override.getEnabled() != null ? override.getEnabled() : d.enabled()
        );
        return new JobRegistration(merged, handler);
    }
}
