package com.mdpilot.orchestrator.oracle;

import java.util.Queue;
import java.util.UUID;

/**
 * Creates the oracle for a new pipeline run.
 */
@FunctionalInterface
public interface DecisionOracleFactory {

    /**
     * @param operatorFeedback corrections typed by an operator while the run is live;
     *                         the oracle drains it
     */
    DecisionOracle create(UUID runId, String goal, Queue<String> operatorFeedback);
}
