package io.scheduler4j.core;

/**
 * Time-of-day text is not a valid "HH:mm:ss".
 */
public class InvalidTimeFormatException extends IllegalArgumentException {

    public InvalidTimeFormatException(String timeOfDay) {
        super("Invalid time of day. Expected HH:mm:ss: " + timeOfDay);
    }
}
