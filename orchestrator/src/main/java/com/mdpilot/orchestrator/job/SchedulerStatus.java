package com.mdpilot.orchestrator.job;

/**
 * One status answer from the batch scheduler.
 *
 * @param state  Scheduler vocabulary, e.g. "PENDING", "RUNNING", "COMPLETED".
 * @param detail Elapsed time, exit code or reason text, if the scheduler gave one.
 */
public record SchedulerStatus(String state, String detail) {

    public static SchedulerStatus of(String state) {
        return new SchedulerStatus(state, null);
    }
}
