package com.mdpilot.orchestrator.dispatch;

import com.mdpilot.orchestrator.capability.Capability;
import com.mdpilot.orchestrator.capability.ParameterSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks proposed arguments against a capability's declared parameters.
 */
final class ArgumentValidator {

    private ArgumentValidator() {}

    /** @return one message per problem; empty when the arguments are acceptable */
    static List<String> validate(Capability capability, Map<String, Object> args) {
        List<String> problems = new ArrayList<>();

        for (ParameterSpec param : capability.parameters()) {
            if (!args.containsKey(param.name())) {
                if (param.required()) {
                    problems.add("missing required argument '" + param.name() + "'");
                }
                continue;
            }
            Object value = args.get(param.name());
            if (value == null) {
                if (param.required()) {
                    problems.add("argument '" + param.name() + "' must not be null");
                }
            } else if (!param.type().accepts(value)) {
                problems.add("argument '%s' must be %s, got %s".formatted(
                        param.name(), param.type().label(), value.getClass().getSimpleName()));
            }
        }

        Set<String> declared = capability.parameters().stream()
                .map(ParameterSpec::name)
                .collect(Collectors.toSet());
        args.keySet().stream()
                .filter(key -> !declared.contains(key))
                .sorted()
                .forEach(key -> problems.add("unexpected argument '" + key + "'"));

        return problems;
    }
}
