package com.mdpilot.orchestrator.job;

import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionKind;
import com.mdpilot.orchestrator.audit.TransitionLog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JobLifecycleManager.
 *
 * The poll executor is a mock, so scheduled polls never fire by themselves;
 * each test drives polling by calling poll() and moves a manual clock.
 * Completion runs inline, except in the one test that uses real threads.
 */
class JobLifecycleManagerTest {

    static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    FakeBatchScheduler       scheduler;
    ScheduledExecutorService pollExecutor;
    MutableClock             clock;
    SimpleMeterRegistry      meterReg;
    List<Duration>           sleeps;
    List<Transition>         audit;
    JobPolicy                policy;
    JobLifecycleManager      manager;

    @BeforeEach
    void setUp() {
        scheduler    = new FakeBatchScheduler();
        pollExecutor = mock(ScheduledExecutorService.class);
        clock        = new MutableClock(T0);
        meterReg     = new SimpleMeterRegistry();
        sleeps       = new ArrayList<>();
        audit        = new ArrayList<>();
        policy       = new JobPolicy(Duration.ofSeconds(15), Duration.ofMinutes(5), Duration.ofHours(1),
                5, Duration.ofSeconds(2), Set.of(), 0);
        manager      = new JobLifecycleManager(scheduler, pollExecutor, Runnable::run, policy,
                audit::add, meterReg, clock, sleeps::add);
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_happyPath_recordsJobAndSchedulesFirstPoll() {
        String jobId = manager.submit(spec(), 7);

        Job job = manager.find(jobId).orElseThrow();
        assertThat(job.getState()).isEqualTo(JobState.SUBMITTED);
        assertThat(job.getHandle()).isEqualTo("slurm-1001");
        assertThat(job.getInvocationId()).isEqualTo(7);
        assertThat(manager.activeJobFor(7)).contains(job);
        verify(pollExecutor).schedule(any(Runnable.class), eq(15_000L), eq(TimeUnit.MILLISECONDS));

        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).kind()).isEqualTo(TransitionKind.JOB);
        assertThat(audit.get(0).fromState()).isNull();
        assertThat(audit.get(0).toState()).isEqualTo("SUBMITTED");
    }

    @Test
    void submit_transientFailures_retriesWithDoublingBackoff() {
        scheduler.failNextSubmit(new BatchSchedulerException("gateway down", true));
        scheduler.failNextSubmit(new BatchSchedulerException("gateway down", true));

        String jobId = manager.submit(spec(), 1);

        assertThat(manager.find(jobId)).isPresent();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void submit_permanentFailure_throwsAndLeavesNoRecord() {
        scheduler.failNextSubmit(new BatchSchedulerException("invalid partition", false));

        assertThatThrownBy(() -> manager.submit(spec(), 3))
                .isInstanceOf(SubmissionException.class)
                .hasMessageContaining("invalid partition");

        assertThat(manager.jobs()).isEmpty();
        assertThat(manager.activeJobFor(3)).isEmpty();
        assertThat(sleeps).isEmpty();
        assertThat(meterReg.counter("mdpilot.job.submissions", "outcome", "error").count()).isEqualTo(1.0);

        // the invocation may try again
        assertThat(manager.submit(spec(), 3)).isEqualTo("job-1");
    }

    @Test
    void submit_transientFailuresExhaustAttempts_throws() {
        for (int i = 0; i < 5; i++) {
            scheduler.failNextSubmit(new BatchSchedulerException("timeout", true));
        }

        assertThatThrownBy(() -> manager.submit(spec(), 1)).isInstanceOf(SubmissionException.class);
        assertThat(sleeps).hasSize(4);
    }

    @Test
    void submit_invocationAlreadyOwnsActiveJob_throws() {
        manager.submit(spec(), 4);

        assertThatThrownBy(() -> manager.submit(spec(), 4))
                .isInstanceOf(IllegalStateException.class);
        assertThat(scheduler.submitted()).hasSize(1);
    }

    // ------------------------------------------------------------------
    // poll()
    // ------------------------------------------------------------------

    @Test
    void poll_transientFailuresThenCompleted_jobCompletes() {
        String jobId = manager.submit(spec(), 1);
        Job job = manager.find(jobId).orElseThrow();
        BatchSchedulerException blip = new BatchSchedulerException("connection reset", true);
        scheduler.script(job.getHandle(), blip, blip, blip, "COMPLETED");

        assertThat(manager.poll(jobId)).isEqualTo(JobState.SUBMITTED);
        assertThat(manager.poll(jobId)).isEqualTo(JobState.SUBMITTED);
        assertThat(manager.poll(jobId)).isEqualTo(JobState.SUBMITTED);
        assertThat(job.getConsecutivePollFailures()).isEqualTo(3);

        assertThat(manager.poll(jobId)).isEqualTo(JobState.COMPLETED);
        assertThat(job.getConsecutivePollFailures()).isZero();
        assertThat(job.getPollCount()).isEqualTo(4);
        assertThat(manager.completion(jobId)).isCompletedWithValue(job);
        assertThat(manager.activeJobFor(1)).isEmpty();
        assertThat(meterReg.counter("mdpilot.job.polls", "outcome", "error").count()).isEqualTo(3.0);
    }

    @Test
    void poll_failuresReachMaxAttempts_marksJobFailed() {
        String jobId = manager.submit(spec(), 1);
        String handle = manager.find(jobId).orElseThrow().getHandle();
        for (int i = 0; i < 5; i++) {
            scheduler.script(handle, new BatchSchedulerException("502 Bad Gateway", true));
        }

        for (int i = 0; i < 4; i++) {
            assertThat(manager.poll(jobId)).isEqualTo(JobState.SUBMITTED);
        }
        assertThat(manager.poll(jobId)).isEqualTo(JobState.FAILED);
        assertThat(manager.find(jobId).orElseThrow().getFailureReason()).startsWith("Status check failed");
    }

    @Test
    void poll_permanentFailure_failsImmediately() {
        String jobId = manager.submit(spec(), 1);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(),
                new BatchSchedulerException("unknown handle", false));

        assertThat(manager.poll(jobId)).isEqualTo(JobState.FAILED);
        assertThat(meterReg.counter("mdpilot.job.terminal", "state", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void poll_unchangedState_doublesIntervalUpToMaxAndResetsOnChange() {
        String jobId = manager.submit(spec(), 1);
        Job job = manager.find(jobId).orElseThrow();

        manager.poll(jobId);                       // SUBMITTED -> QUEUED
        assertThat(job.getState()).isEqualTo(JobState.QUEUED);
        assertThat(job.getPollInterval()).isEqualTo(Duration.ofSeconds(15));

        manager.poll(jobId);
        assertThat(job.getPollInterval()).isEqualTo(Duration.ofSeconds(30));
        manager.poll(jobId);
        assertThat(job.getPollInterval()).isEqualTo(Duration.ofSeconds(60));

        for (int i = 0; i < 5; i++) {
            manager.poll(jobId);
        }
        assertThat(job.getPollInterval()).isEqualTo(Duration.ofMinutes(5));

        scheduler.script(job.getHandle(), "RUNNING");
        manager.poll(jobId);
        assertThat(job.getState()).isEqualTo(JobState.RUNNING);
        assertThat(job.getPollInterval()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void poll_unknownSchedulerState_keepsCurrentState() {
        String jobId = manager.submit(spec(), 1);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(), "RUNNING", "SOMETHING_NEW");

        manager.poll(jobId);
        assertThat(manager.poll(jobId)).isEqualTo(JobState.RUNNING);
    }

    @Test
    void poll_stateNeverGoesBackwards() {
        String jobId = manager.submit(spec(), 1);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(), "RUNNING", "PENDING");

        manager.poll(jobId);
        assertThat(manager.poll(jobId)).isEqualTo(JobState.RUNNING);
    }

    @Test
    void poll_pastMaxDuration_cancelsExternallyAndTimesOut() {
        String jobId = manager.submit(spec(), 1);
        Job job = manager.find(jobId).orElseThrow();
        scheduler.script(job.getHandle(), "RUNNING");
        manager.poll(jobId);

        clock.advance(Duration.ofHours(1));
        assertThat(manager.poll(jobId)).isEqualTo(JobState.TIMED_OUT);

        assertThat(scheduler.cancelled()).containsExactly(job.getHandle());
        assertThat(job.getFinishedAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(manager.completion(jobId).join().getState()).isEqualTo(JobState.TIMED_OUT);
        assertThat(meterReg.counter("mdpilot.job.terminal", "state", "timed_out").count()).isEqualTo(1.0);
    }

    @Test
    void poll_nearDeadline_nextPollScheduledAtDeadline() {
        String jobId = manager.submit(spec(), 1);
        clock.advance(Duration.ofMinutes(59).plusSeconds(50));

        manager.poll(jobId);

        ArgumentCaptor<Long> delays = ArgumentCaptor.forClass(Long.class);
        verify(pollExecutor, atLeastOnce()).schedule(any(Runnable.class), delays.capture(), eq(TimeUnit.MILLISECONDS));
        assertThat(delays.getAllValues()).last().isEqualTo(10_000L);
        assertThat(manager.find(jobId).orElseThrow().getNextPollAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
    }

    @Test
    void poll_calledDirectly_replacesQueuedPollInsteadOfAddingOne() {
        List<Runnable>           queued  = new ArrayList<>();
        List<ScheduledFuture<?>> futures = new ArrayList<>();
        when(pollExecutor.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS)))
                .thenAnswer(inv -> {
                    ScheduledFuture<?> future = mock(ScheduledFuture.class);
                    queued.add(inv.getArgument(0));
                    futures.add(future);
                    return future;
                });

        String jobId = manager.submit(spec(), 1);
        manager.poll(jobId);

        assertThat(futures).hasSize(2);
        verify(futures.get(0)).cancel(false);
        verify(futures.get(1), never()).cancel(anyBoolean());

        // the surviving poll fires and queues exactly one successor
        queued.get(1).run();

        assertThat(futures).hasSize(3);
        verify(futures.get(1)).cancel(false);
        verify(futures.get(2), never()).cancel(anyBoolean());
        assertThat(manager.find(jobId).orElseThrow().getPollCount()).isEqualTo(2);
    }

    @Test
    void poll_jobReachesTerminalState_dropsQueuedPoll() {
        ScheduledFuture<?> queued = mock(ScheduledFuture.class);
        when(pollExecutor.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS)))
                .thenAnswer(inv -> queued);
        String jobId = manager.submit(spec(), 1);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(), "COMPLETED");

        manager.poll(jobId);

        verify(queued, atLeastOnce()).cancel(false);
        verify(pollExecutor).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void completion_fetchRetriesInWaiter_runOffThePollThread() throws Exception {
        ScheduledExecutorService polls = Executors.newSingleThreadScheduledExecutor(
                r -> daemon(r, "job-poll-test"));
        ExecutorService completions = Executors.newSingleThreadExecutor(
                r -> daemon(r, "job-completion-test"));
        List<String>  sleepThreads      = new CopyOnWriteArrayList<>();
        AtomicInteger pollsDuringSleep = new AtomicInteger();
        JobPolicy fast = new JobPolicy(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofHours(1),
                3, Duration.ofMillis(1), Set.of(), 0);
        Sleeper watching = d -> {
            sleepThreads.add(Thread.currentThread().getName());
            int before = scheduler.statusCalls();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (scheduler.statusCalls() < before + 2 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            pollsDuringSleep.set(scheduler.statusCalls() - before);
        };
        JobLifecycleManager threaded = new JobLifecycleManager(scheduler, polls, completions, fast,
                TransitionLog.NONE, meterReg, clock, watching);
        try {
            String finishing = threaded.submit(spec(), 1);
            threaded.submit(spec(), 2);                 // stays PENDING and keeps being polled
            CompletableFuture<Map<String, Object>> fetched =
                    threaded.completion(finishing).thenApply(job -> threaded.fetchResult(job.getId()));
            scheduler.failNextFetch(new BatchSchedulerException("gateway busy", true));
            scheduler.script(threaded.find(finishing).orElseThrow().getHandle(), "COMPLETED");

            assertThat(fetched.get(5, TimeUnit.SECONDS)).containsEntry("exit_code", 0);
            assertThat(sleepThreads).containsExactly("job-completion-test");
            assertThat(pollsDuringSleep.get()).isGreaterThanOrEqualTo(2);
        } finally {
            polls.shutdownNow();
            completions.shutdownNow();
        }
    }

    @Test
    void poll_terminalJob_doesNotContactScheduler() {
        String jobId = manager.submit(spec(), 1);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(), "COMPLETED");
        manager.poll(jobId);
        int calls = scheduler.statusCalls();

        assertThat(manager.poll(jobId)).isEqualTo(JobState.COMPLETED);
        assertThat(scheduler.statusCalls()).isEqualTo(calls);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_activeJob_cancelsExternallyAndCompletesWaiters() {
        String jobId = manager.submit(spec(), 2);
        CompletableFuture<Job> done = manager.completion(jobId);

        assertThat(manager.cancel(jobId)).isEqualTo(JobState.CANCELLED);

        assertThat(scheduler.cancelled()).hasSize(1);
        assertThat(done).isCompleted();
        assertThat(manager.activeJobFor(2)).isEmpty();
    }

    @Test
    void cancel_completedJob_isNoOp() {
        String jobId = manager.submit(spec(), 2);
        scheduler.script(manager.find(jobId).orElseThrow().getHandle(), "COMPLETED");
        manager.poll(jobId);

        assertThat(manager.cancel(jobId)).isEqualTo(JobState.COMPLETED);
        assertThat(scheduler.cancelled()).isEmpty();
    }

    @Test
    void cancelAll_cancelsOnlyActiveJobs() {
        String done = manager.submit(spec(), 1);
        String live = manager.submit(spec(), 2);
        scheduler.script(manager.find(done).orElseThrow().getHandle(), "COMPLETED");
        manager.poll(done);

        manager.cancelAll();

        assertThat(manager.find(done).orElseThrow().getState()).isEqualTo(JobState.COMPLETED);
        assertThat(manager.find(live).orElseThrow().getState()).isEqualTo(JobState.CANCELLED);
    }

    // ------------------------------------------------------------------
    // fetchResult()
    // ------------------------------------------------------------------

    @Test
    void fetchResult_jobNotCompleted_throwsJobNotComplete() {
        String jobId = manager.submit(spec(), 1);

        assertThatThrownBy(() -> manager.fetchResult(jobId))
                .isInstanceOf(JobNotCompleteException.class)
                .satisfies(e -> assertThat(((JobNotCompleteException) e).getState()).isEqualTo(JobState.SUBMITTED));
    }

    @Test
    void fetchResult_completedJob_returnsOutput() {
        String jobId = manager.submit(spec(), 1);
        String handle = manager.find(jobId).orElseThrow().getHandle();
        scheduler.result(handle, Map.of("exit_code", 0, "elapsed", "01:10:00"));
        scheduler.script(handle, "COMPLETED");
        manager.poll(jobId);

        assertThat(manager.fetchResult(jobId)).containsEntry("elapsed", "01:10:00");
    }

    @Test
    void fetchResult_unknownJob_throwsIllegalArgument() {
        assertThatThrownBy(() -> manager.fetchResult("job-99"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    private static JobSpec spec() {
        return new JobSpec("run_simulation", "md-prod", Map.of("steps", 500_000), 1, 4, Duration.ofHours(2));
    }
}
