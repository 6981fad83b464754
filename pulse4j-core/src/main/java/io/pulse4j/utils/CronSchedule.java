package io.pulse4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A schedule expression parsed once into a "next fire time" function.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field Unix cron: "0 * * * *" (seconds are prepended as "0")</li>
 *   <li>6-field Spring cron: "0 0 6 * * *"</li>
 *   <li>Quartz cron with "?" or a year field: "0 0 6 ? * MON-FRI"</li>
 *   <li>Daily wall-clock time: "AT 06:00"</li>
 * </ul>
 * <p>
 * Numeric day-of-week follows the format: Unix numbering (0 or 7 = Sunday) in 5-field
 * expressions, Quartz numbering (1 = Sunday) otherwise. Names (SUN-SAT) work everywhere.
 * Every expression is evaluated in a fixed zone, never the process default.
 */
public final class CronSchedule {

    private static final String DAILY_PREFIX = "AT ";
    private static final Pattern UNIX_DAY_NUMBER = Pattern.compile("(?<![/#\\d])(\\d+)");

    private final String expression;
    private final ZoneId zone;
    private final CronExpression cron;
    private final LocalTime dailyAt;

    private CronSchedule(String expression, ZoneId zone, CronExpression cron, LocalTime dailyAt) {
        this.expression = expression;
        this.zone = zone;
        this.cron = cron;
        this.dailyAt = dailyAt;
    }

    /**
     * Parse a schedule expression.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronSchedule parse(String spec, ZoneId zone) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        Objects.requireNonNull(zone, "zone must not be null");

        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        if (s.regionMatches(true, 0, DAILY_PREFIX, 0, DAILY_PREFIX.length())) {
            String timeOfDay = s.substring(DAILY_PREFIX.length()).trim();
            try {
                return new CronSchedule(s, zone, null, LocalTime.parse(timeOfDay));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Invalid daily time: " + spec, e);
            }
        }

        String normalized = normalizeCron(s);
        if (!CronExpression.isValidExpression(normalized)) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec);
        }
        CronExpression exp;
        try {
            exp = new CronExpression(normalized);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec, e);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        return new CronSchedule(s, zone, exp, null);
    }

    /**
     * Parse with a zone id string.
     */
    public static CronSchedule parse(String spec, String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
        }
        return parse(spec, zone);
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 5-field cron by prepending seconds "0" and renumbering day-of-week values.
     * - Accepts 6-field Spring cron.
     * - Replaces one of day-of-month / day-of-week with "?" when the other is a wildcard.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], unixToQuartzDayOfWeek(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    // Unix 0-7 (Sunday twice) to Quartz 1-7. Step values after '/' are counts, not days.
    private static String unixToQuartzDayOfWeek(String field) {
        Matcher m = UNIX_DAY_NUMBER.matcher(field);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            int day = Integer.parseInt(m.group(1));
            if (day > 7) {
                throw new IllegalArgumentException("Invalid day-of-week: " + field);
            }
            m.appendReplacement(out, String.valueOf(day % 7 + 1));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Next fire time strictly after {@code from}.
     *
     * @throws IllegalStateException if the expression has no future occurrence
     */
    public Instant nextFireAfter(Instant from) {
        Objects.requireNonNull(from, "from must not be null");

        if (dailyAt != null) {
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(dailyAt).withNano(0);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return candidate.toInstant();
        }

        Date next;
        synchronized (cron) {
            next = cron.getNextValidTimeAfter(Date.from(from));
        }
        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + expression);
        }
        return next.toInstant();
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
