package io.scheduler4j.core;

/**
 * A job's process could not be launched or did not run to completion.
 */
public class ExecutionFailureException extends SchedulerException {

    public ExecutionFailureException(String message) {
        super(message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
