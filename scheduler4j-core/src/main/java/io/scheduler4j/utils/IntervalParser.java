package io.scheduler4j.utils;

import io.scheduler4j.core.Interval;
import io.scheduler4j.core.InvalidIntervalFormatException;
import io.scheduler4j.core.InvalidTimeFormatException;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses schedule specs and computes run times.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Intervals: "&lt;amount&gt;&lt;unit&gt;" with unit h, m or s ("1h", "30m", "45s")</li>
 *   <li>Start times: "HH:mm:ss", where "24:00:00" is read as midnight</li>
 * </ul>
 * <p>
 * Units are fixed-length, so all run times are plain instant arithmetic: a job's runs are always
 * {@code startTime + k * interval} for some whole k, regardless of downtime.
 */
public final class IntervalParser {

    private static final Pattern INTERVAL = Pattern.compile("^(\\d+)([hms])$");
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm:ss");
    private static final DateTimeFormatter NORMALIZED_TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm:ss");

    private IntervalParser() {
    }

    /**
     * Parse an interval like "1h", "15m" or "30s".
     *
     * @throws InvalidIntervalFormatException on any other shape, including zero or a missing unit
     */
    public static Interval parse(String spec) {
        if (spec == null) {
            throw new InvalidIntervalFormatException(null);
        }
        Matcher m = INTERVAL.matcher(spec.trim());
        if (!m.matches()) {
            throw new InvalidIntervalFormatException(spec);
        }

        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException ex) {
            throw new InvalidIntervalFormatException(spec);
        }
        if (amount <= 0) {
            throw new InvalidIntervalFormatException(spec);
        }

        ChronoUnit unit = switch (m.group(2).charAt(0)) {
            case 'h' -> ChronoUnit.HOURS;
            case 'm' -> ChronoUnit.MINUTES;
            default -> ChronoUnit.SECONDS;
        };

        try {
            // reject amounts whose duration overflows
            Duration.of(amount, unit);
        } catch (ArithmeticException ex) {
            throw new InvalidIntervalFormatException(spec);
        }
        return new Interval(amount, unit);
    }

    /**
     * Convenience: {@code parse(spec).toDuration()}.
     */
    public static Duration parseDuration(String spec) {
        return parse(spec).toDuration();
    }

    /**
     * Parse a start time-of-day. "24:00:00" is normalized to midnight.
     *
     * @throws InvalidTimeFormatException if the text is not a valid H:mm:ss time
     */
    public static LocalTime parseTimeOfDay(String timeOfDay) {
        if (timeOfDay == null) {
            throw new InvalidTimeFormatException(null);
        }
        String s = timeOfDay.trim();
        if ("24:00:00".equals(s)) {
            return LocalTime.MIDNIGHT;
        }
        try {
            return LocalTime.parse(s, TIME_OF_DAY);
        } catch (DateTimeParseException ex) {
            throw new InvalidTimeFormatException(timeOfDay);
        }
    }

    /**
     * Parse and re-format a start time, e.g. "24:00:00" -> "00:00:00", "7:30:00" -> "07:30:00".
     */
    public static String normalizeTimeOfDay(String timeOfDay) {
        return parseTimeOfDay(timeOfDay).format(NORMALIZED_TIME_OF_DAY);
    }

    /**
     * Computes the first run of a newly scheduled job.
     *
     * <p>Anchors at today's date (in {@code zone}) combined with {@code startTime} and returns the earliest
     * {@code anchor + k * interval}, k &gt;= 0, that is strictly after {@code now}.
     *
     * @param startTime start time-of-day
     * @param interval  repeat interval
     * @param now       scheduling time
     * @param zone      zone the start time is expressed in
     */
    public static Instant firstRunAfter(LocalTime startTime, Duration interval, Instant now, ZoneId zone) {
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        LocalDate today = LocalDate.ofInstant(now, zone);
        Instant anchor = ZonedDateTime.of(today, startTime, zone).toInstant();
        return advancePast(anchor, interval, now);
    }

    /**
     * Phase-preserving advance: moves {@code nextRun} forward by whole intervals to the first instant
     * strictly after {@code now}. Returns {@code nextRun} unchanged if it is already in the future.
     */
    public static Instant advancePast(Instant nextRun, Duration interval, Instant now) {
        Objects.requireNonNull(nextRun, "nextRun must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }

        if (nextRun.isAfter(now)) {
            return nextRun;
        }

        Duration behind = Duration.between(nextRun, now);
        long steps = behind.dividedBy(interval) + 1;
        return nextRun.plus(interval.multipliedBy(steps));
    }

    /**
     * Number of whole intervals {@link #advancePast} would skip.
     */
    public static long intervalsBehind(Instant nextRun, Duration interval, Instant now) {
        if (nextRun.isAfter(now)) {
            return 0;
        }
        return Duration.between(nextRun, now).dividedBy(interval) + 1;
    }
}
