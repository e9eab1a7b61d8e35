package io.scheduler4j.core;

public class JobNotFoundException extends SchedulerException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No active job with id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
