package com.mdpilot.orchestrator.capability;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One registrable operation an agent may ask the orchestrator to run.
 *
 * Immutable. Gate lists keep their declaration order and are de-duplicated,
 * so rejections always name unmet gates in a stable order.
 *
 * @param name                Unique name the oracle proposes, e.g. "validate_structure".
 * @param executorId          Id of the {@link CapabilityExecutor} bean that runs it.
 * @param parameters          Declared inputs, in signature order.
 * @param requiredGates       Gates that must all be OPEN before the capability may run.
 * @param affectedGates       Gates the capability is allowed to open or block.
 * @param mode                Synchronous call or batch job.
 * @param correctionSensitive Whether prior human corrections are recalled before it runs.
 * @param description         One sentence shown to the oracle.
 */
public record Capability(
        String              name,
        String              executorId,
        List<ParameterSpec> parameters,
        List<String>        requiredGates,
        List<String>        affectedGates,
        ExecutionMode       mode,
        boolean             correctionSensitive,
        String              description) {

    public Capability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
        Objects.requireNonNull(executorId, "executorId");
        parameters    = List.copyOf(parameters == null ? List.of() : parameters);
        requiredGates = distinct(requiredGates);
        affectedGates = distinct(affectedGates);
        mode          = mode == null ? ExecutionMode.SYNCHRONOUS : mode;
        description   = description == null ? "" : description;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean affects(String gate) {
        return affectedGates.contains(gate);
    }

    /** e.g. "prepare_system(pdb_file: string, padding?: number)". */
    public String signature() {
        return parameters.stream()
                .map(ParameterSpec::signature)
                .collect(Collectors.joining(", ", name + "(", ")"));
    }

    private static List<String> distinct(List<String> gates) {
        return gates == null ? List.of() : List.copyOf(new LinkedHashSet<>(gates));
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {
        private final String              name;
        private String                    executorId = "";
        private final List<ParameterSpec> parameters = new ArrayList<>();
        private final List<String>        requires   = new ArrayList<>();
        private final List<String>        affects    = new ArrayList<>();
        private ExecutionMode             mode       = ExecutionMode.SYNCHRONOUS;
        private boolean                   correctionSensitive;
        private String                    description = "";

        private Builder(String name) {
            this.name = name;
        }

        public Builder executor(String executorId)           { this.executorId = executorId; return this; }
        public Builder parameter(ParameterSpec parameter)    { this.parameters.add(parameter); return this; }
        public Builder requires(String... gates)             { this.requires.addAll(List.of(gates)); return this; }
        public Builder affects(String... gates)              { this.affects.addAll(List.of(gates)); return this; }
        public Builder mode(ExecutionMode mode)              { this.mode = mode; return this; }
        public Builder correctionSensitive(boolean value)    { this.correctionSensitive = value; return this; }
        public Builder description(String description)       { this.description = description; return this; }

        public Builder required(String param, ParameterType type) {
            return parameter(ParameterSpec.required(param, type));
        }

        public Builder optional(String param, ParameterType type) {
            return parameter(ParameterSpec.optional(param, type));
        }

        public Capability build() {
            return new Capability(name, executorId, parameters, requires, affects,
                    mode, correctionSensitive, description);
        }
    }
}
