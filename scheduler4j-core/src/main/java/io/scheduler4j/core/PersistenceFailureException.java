package io.scheduler4j.core;

/**
 * The job store could not complete a read or write.
 */
public class PersistenceFailureException extends SchedulerException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
