package io.scheduler4j.core;

/**
 * Base class of scheduler failures that are not input validation errors.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
