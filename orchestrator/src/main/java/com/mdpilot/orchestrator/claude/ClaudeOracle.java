package com.mdpilot.orchestrator.claude;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mdpilot.orchestrator.claude.ClaudeClient.Message;
import com.mdpilot.orchestrator.oracle.Decision;
import com.mdpilot.orchestrator.oracle.DecisionOracle;
import com.mdpilot.orchestrator.oracle.OracleException;
import com.mdpilot.orchestrator.oracle.PipelineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * {@link DecisionOracle} backed by a multi-turn Claude conversation.
 *
 * One instance per pipeline run. Operator feedback queued on the run is shown
 * on the next turn, and the next proposal is marked as acting on it.
 */
public class ClaudeOracle implements DecisionOracle {

    private static final Logger log = LoggerFactory.getLogger(ClaudeOracle.class);

    // Replies without a usable decision tag before giving up.
    private static final int MAX_FORMAT_RETRIES = 2;

    private final ClaudeClient  claude;
    private final OraclePrompts prompts;
    private final ObjectMapper  json;
    private final String        model;
    private final Queue<String> operatorFeedback;

    private final List<Message> history = new ArrayList<>();
    private final List<String>  unappliedFeedback = new ArrayList<>();

    public ClaudeOracle(ClaudeClient claude, OraclePrompts prompts, ObjectMapper json,
                        String model, Queue<String> operatorFeedback) {
        this.claude           = claude;
        this.prompts          = prompts;
        this.json             = json;
        this.model            = model;
        this.operatorFeedback = operatorFeedback;
    }

    @Override
    public Decision proposeNext(PipelineSnapshot snapshot) {
        List<String> feedback = new ArrayList<>();
        for (String f; (f = operatorFeedback.poll()) != null; ) {
            feedback.add(f);
        }
        unappliedFeedback.addAll(feedback);

        history.add(new Message("user", history.isEmpty()
                ? prompts.initialMessage(snapshot, feedback)
                : prompts.turnMessage(snapshot, feedback)));

        for (int attempt = 0; ; attempt++) {
            String reply;
            try {
                reply = claude.complete(model, prompts.systemPrompt(), history);
            } catch (Exception e) {
                history.remove(history.size() - 1);
                throw new OracleException("Claude API error: " + e.getMessage(), e);
            }
            history.add(new Message("assistant", reply));
            try {
                Decision decision = DecisionParser.parse(reply, json);
                log.info("Oracle decided {} {}", decision.kind(),
                        decision.kind() == Decision.Kind.PROPOSE ? decision.capability() + " " + decision.args() : "");
                return attachFeedback(decision);
            } catch (OracleException e) {
                if (attempt >= MAX_FORMAT_RETRIES) {
                    throw e;
                }
                log.warn("Unusable oracle reply ({}), asking again", e.getMessage());
                history.add(new Message("user", prompts.formatReminder(e.getMessage())));
            }
        }
    }

    private Decision attachFeedback(Decision decision) {
        if (decision.kind() != Decision.Kind.PROPOSE || unappliedFeedback.isEmpty()) {
            return decision;
        }
        String correction = String.join("\n", unappliedFeedback);
        unappliedFeedback.clear();
        return decision.withHumanCorrection(correction);
    }
}
