package com.mdpilot.orchestrator.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Database-backed audit trail.
 *
 * Each pipeline run gets its own {@link TransitionLog} that stamps records with
 * the run id and a per-run sequence number. A failed insert is logged and
 * dropped, the same way a missed history save is treated elsewhere: the run
 * carries on and keeps its in-memory history.
 */
@Component
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final TransitionRecordRepository repository;

    public AuditTrail(TransitionRecordRepository repository) {
        this.repository = repository;
    }

    public TransitionLog forRun(UUID runId) {
        AtomicLong sequence = new AtomicLong();
        return transition -> {
            try {
                repository.save(new TransitionRecord(runId, sequence.incrementAndGet(), transition));
            } catch (Exception e) {
                log.warn("Could not persist {} transition of '{}' for run {}: {}",
                        transition.kind(), transition.subject(), runId, e.getMessage());
            }
        };
    }

    /** Replay a run's transitions in the order they were written. */
    public List<Transition> history(UUID runId) {
        return repository.findByRunIdOrderBySequenceAsc(runId).stream()
                .map(TransitionRecord::toTransition)
                .toList();
    }
}
