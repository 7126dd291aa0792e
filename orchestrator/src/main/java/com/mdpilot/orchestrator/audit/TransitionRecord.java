package com.mdpilot.orchestrator.audit;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of a {@link Transition}.
 *
 * Rows are only ever inserted. Ordering within a run is by {@code sequence},
 * which follows the order in which the orchestrator emitted the records.
 *
 * DB table: transition_log  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "transition_log")
public class TransitionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(nullable = false, updatable = false)
    private long sequence;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "invocation_id", updatable = false)
    private Long invocationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransitionKind kind;

    @Column(nullable = false, updatable = false)
    private String subject;

    @Column(name = "from_state", updatable = false)
    private String fromState;

    @Column(name = "to_state", nullable = false, updatable = false)
    private String toState;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String detail;

    protected TransitionRecord() {}   // required by JPA

    public TransitionRecord(UUID runId, long sequence, Transition t) {
        this.runId        = runId;
        this.sequence     = sequence;
        this.occurredAt   = t.at();
        this.invocationId = t.invocationId();
        this.kind         = t.kind();
        this.subject      = t.subject();
        this.fromState    = t.fromState();
        this.toState      = t.toState();
        this.detail       = t.detail();
    }

    public Long           getId()           { return id; }
    public UUID           getRunId()        { return runId; }
    public long           getSequence()     { return sequence; }
    public Instant        getOccurredAt()   { return occurredAt; }
    public Long           getInvocationId() { return invocationId; }
    public TransitionKind getKind()         { return kind; }
    public String         getSubject()      { return subject; }
    public String         getFromState()    { return fromState; }
    public String         getToState()      { return toState; }
    public String         getDetail()       { return detail; }

    public Transition toTransition() {
        return new Transition(occurredAt, invocationId, kind, subject, fromState, toState, detail);
    }
}
