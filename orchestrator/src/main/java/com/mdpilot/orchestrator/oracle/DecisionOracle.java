package com.mdpilot.orchestrator.oracle;

/**
 * Decides which capability to invoke next. Implementations may be slow
 * (an LLM call) and may throw {@link OracleException}.
 */
@FunctionalInterface
public interface DecisionOracle {

    Decision proposeNext(PipelineSnapshot snapshot);
}
