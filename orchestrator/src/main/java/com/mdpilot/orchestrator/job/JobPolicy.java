package com.mdpilot.orchestrator.job;

import java.time.Duration;
import java.util.Set;

/**
 * Polling, retry and timeout settings for batch jobs.
 *
 * @param minPollInterval     First poll delay, and the delay after any state change.
 * @param maxPollInterval     Ceiling for the doubling backoff between unchanged polls.
 * @param maxDuration         Wall-clock budget from submission; exceeding it times the job out.
 * @param maxAttempts         Attempts for a submission or result fetch, and the number of
 *                            consecutive failed status checks tolerated.
 * @param retryBackoff        Pause before the second attempt of a submission or fetch;
 *                            doubles per attempt.
 * @param resubmittableTypes  Job types that are resubmitted after a FAILED job.
 * @param maxResubmissions    How often one invocation may resubmit.
 */
public record JobPolicy(
        Duration    minPollInterval,
        Duration    maxPollInterval,
        Duration    maxDuration,
        int         maxAttempts,
        Duration    retryBackoff,
        Set<String> resubmittableTypes,
        int         maxResubmissions) {

    public JobPolicy {
        if (minPollInterval.isNegative() || minPollInterval.isZero()) {
            throw new IllegalArgumentException("minPollInterval must be positive");
        }
        if (maxPollInterval.compareTo(minPollInterval) < 0) {
            throw new IllegalArgumentException("maxPollInterval must not be shorter than minPollInterval");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        resubmittableTypes = Set.copyOf(resubmittableTypes == null ? Set.of() : resubmittableTypes);
    }

    public static JobPolicy defaults() {
        return new JobPolicy(Duration.ofSeconds(15), Duration.ofMinutes(5), Duration.ofHours(48),
                5, Duration.ofSeconds(2), Set.of(), 0);
    }

    /** Doubling backoff, capped at {@link #maxPollInterval}. */
    public Duration nextInterval(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(maxPollInterval) > 0 ? maxPollInterval : doubled;
    }

    public boolean mayResubmit(String jobType, int resubmissionsSoFar) {
        return resubmittableTypes.contains(jobType) && resubmissionsSoFar < maxResubmissions;
    }
}
