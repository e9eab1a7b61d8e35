package io.scheduler4j.core;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A fixed-length repeat interval: a positive amount of hours, minutes or seconds.
 */
public record Interval(long amount, ChronoUnit unit) {

    public Interval {
        Objects.requireNonNull(unit, "unit must not be null");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        if (unit != ChronoUnit.HOURS && unit != ChronoUnit.MINUTES && unit != ChronoUnit.SECONDS) {
            throw new IllegalArgumentException("Unsupported interval unit: " + unit);
        }
    }

    public Duration toDuration() {
        return Duration.of(amount, unit);
    }

    /**
     * Compact form, e.g. "90m".
     */
    @Override
    public String toString() {
        return switch (unit) {
            case HOURS -> amount + "h";
            case MINUTES -> amount + "m";
            default -> amount + "s";
        };
    }
}
