package io.jobs4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Cron helpers for {@code JobDefinition#schedule()}.
 * <p>
 * jobs4j does not fire cron jobs itself. Definitions are validated here at registration time,
 * and an external trigger can ask for {@link #nextRunAt(String, ZoneId, Instant)} to decide when
 * to enqueue the next instance.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>5-field cron: "0 *&#47;6 * * *" (seconds "0" is prepended)</li>
 *   <li>6-field cron with a leading seconds field</li>
 * </ul>
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    /**
     * Normalize to a Quartz expression:
     * - 5 fields get a leading "0" seconds field.
     * - a "*" day-of-month together with a "*" day-of-week becomes "?" for day-of-week,
     *   since Quartz forbids specifying both.
     */
    public static String normalize(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + spec);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else if ("*".equals(dow)) {
            dow = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    public static boolean isValid(String spec) {
        try {
            return CronExpression.isValidExpression(normalize(spec));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code from}.
     *
     * @param spec cron expression (5 or 6 fields)
     * @param zone time zone the expression is evaluated in; null means system default
     * @param from base instant
     */
    public static Instant nextRunAt(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        String cron = normalize(spec);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + spec);
        }
        return next.toInstant();
    }
}
