package com.mdpilot.orchestrator.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local corrective memory.
 *
 * Recall matches on the capability name, then ranks by how many gate states
 * the stored context shares with the query, newest first among equals.
 *
 * Holds at most {@code capacity} corrections; storing beyond that evicts the
 * oldest stored ones. Nothing survives a restart.
 */
@Component
public class InMemoryCorrectiveMemory implements CorrectiveMemory {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCorrectiveMemory.class);

    static final int DEFAULT_CAPACITY = 10_000;

    private final List<Correction> corrections = new CopyOnWriteArrayList<>();
    private final int              recallLimit;
    private final int              capacity;

    public InMemoryCorrectiveMemory(int recallLimit) {
        this(recallLimit, DEFAULT_CAPACITY);
    }

    @Autowired
    public InMemoryCorrectiveMemory(@Value("${mdpilot.memory.recall-limit:5}") int recallLimit,
                                    @Value("${mdpilot.memory.capacity:10000}") int capacity) {
        if (recallLimit < 1) {
            throw new IllegalArgumentException("recall-limit must be at least 1, got " + recallLimit);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.recallLimit = recallLimit;
        this.capacity    = capacity;
    }

    @Override
    public List<Correction> recall(CorrectionContext context) {
        return corrections.stream()
                .filter(c -> c.context().capability().equals(context.capability()))
                .sorted(Comparator
                        .comparingInt((Correction c) -> c.context().sharedGateStates(context)).reversed()
                        .thenComparing(Correction::recordedAt, Comparator.reverseOrder()))
                .limit(recallLimit)
                .toList();
    }

    @Override
    public void store(Correction correction) {
        synchronized (corrections) {
            corrections.add(correction);
            while (corrections.size() > capacity) {
                Correction evicted = corrections.remove(0);
                log.debug("Evicted correction for '{}' recorded at {}",
                        evicted.context().capability(), evicted.recordedAt());
            }
        }
        log.info("Stored correction for '{}': {}", correction.context().capability(), correction.content());
    }

    public int size() {
        return corrections.size();
    }
}
