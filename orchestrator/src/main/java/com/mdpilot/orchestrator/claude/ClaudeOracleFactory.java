package com.mdpilot.orchestrator.claude;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mdpilot.orchestrator.oracle.DecisionOracle;
import com.mdpilot.orchestrator.oracle.DecisionOracleFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Queue;
import java.util.UUID;

@Component
public class ClaudeOracleFactory implements DecisionOracleFactory {

    private final ClaudeClient  claude;
    private final OraclePrompts prompts;
    private final ObjectMapper  objectMapper;
    private final String        model;

    public ClaudeOracleFactory(ClaudeClient claude,
                               OraclePrompts prompts,
                               ObjectMapper objectMapper,
                               @Value("${mdpilot.oracle.model:claude-sonnet-4-6}") String model) {
        this.claude       = claude;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.model        = model;
    }

    @Override
    public DecisionOracle create(UUID runId, String goal, Queue<String> operatorFeedback) {
        return new ClaudeOracle(claude, prompts, objectMapper, model, operatorFeedback);
    }
}
