package com.mdpilot.orchestrator.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Insert + replay queries for the transition_log table.
 */
public interface TransitionRecordRepository extends JpaRepository<TransitionRecord, Long> {

    /** Full history of one run, in emission order. */
    List<TransitionRecord> findByRunIdOrderBySequenceAsc(UUID runId);

    /** Everything that happened to one invocation of a run. */
    List<TransitionRecord> findByRunIdAndInvocationIdOrderBySequenceAsc(UUID runId, Long invocationId);
}
