package com.mdpilot.orchestrator.memory;

import java.util.List;

/**
 * Store of human corrections, consulted before correction-sensitive capabilities run.
 *
 * How corrections are matched is up to the implementation; callers only rely
 * on the most relevant correction coming first.
 */
public interface CorrectiveMemory {

    List<Correction> recall(CorrectionContext context);

    void store(Correction correction);
}
