package com.mdpilot.orchestrator.job;

public class JobNotCompleteException extends RuntimeException {

    private final JobState state;

    public JobNotCompleteException(String jobId, JobState state) {
        super("Job " + jobId + " has no result: state is " + state);
        this.state = state;
    }

    public JobState getState() { return state; }
}
