package io.scheduler4j.core;

/**
 * Interval text is not of the form {@code <positive integer><h|m|s>}.
 */
public class InvalidIntervalFormatException extends IllegalArgumentException {

    public InvalidIntervalFormatException(String interval) {
        super("Invalid interval. Expected <amount><unit> with unit h, m or s (e.g. 1h, 2m, 30s): " + interval);
    }
}
