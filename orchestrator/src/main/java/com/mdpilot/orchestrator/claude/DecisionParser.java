package com.mdpilot.orchestrator.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mdpilot.orchestrator.oracle.Decision;
import com.mdpilot.orchestrator.oracle.OracleException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the decision from Claude's reply:
 *
 * <pre>
 *   &lt;action&gt;{"capability": "clean_structure", "args": {"pdb_id": "1UBQ"}}&lt;/action&gt;
 *   &lt;await/&gt;
 *   &lt;done/&gt;
 * </pre>
 *
 * The first {@code <action>} wins over {@code <await/>}, which wins over {@code <done/>}.
 */
public class DecisionParser {

    private static final Pattern ACTION_TAG = Pattern.compile("<action>(.*?)</action>", Pattern.DOTALL);
    private static final Pattern AWAIT_TAG  = Pattern.compile("<await\\s*/>");
    private static final Pattern DONE_TAG   = Pattern.compile("<done\\s*/>");

    private DecisionParser() {}

    /** @throws OracleException if the reply holds no usable decision */
    public static Decision parse(String response, ObjectMapper json) {
        if (response == null) {
            throw new OracleException("Empty reply");
        }
        Matcher action = ACTION_TAG.matcher(response);
        if (action.find()) {
            return parseAction(action.group(1).strip(), json);
        }
        if (AWAIT_TAG.matcher(response).find()) {
            return Decision.awaitJobs();
        }
        if (DONE_TAG.matcher(response).find()) {
            return Decision.done();
        }
        throw new OracleException("Reply contains no <action>, <await/> or <done/> tag");
    }

    private static Decision parseAction(String body, ObjectMapper json) {
        JsonNode node;
        try {
            node = json.readTree(body);
        } catch (Exception e) {
            throw new OracleException("Action is not valid JSON: " + e.getMessage(), e);
        }
        JsonNode capability = node.get("capability");
        if (capability == null || !capability.isTextual() || capability.asText().isBlank()) {
            throw new OracleException("Action must name a \"capability\"");
        }
        JsonNode args = node.get("args");
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (args != null && !args.isNull()) {
            if (!args.isObject()) {
                throw new OracleException("Action \"args\" must be a JSON object");
            }
            args.fields().forEachRemaining(e -> arguments.put(e.getKey(), json.convertValue(e.getValue(), Object.class)));
        }
        return Decision.propose(capability.asText(), arguments);
    }
}
