package com.mdpilot.orchestrator.capability;

/**
 * One declared input of a capability.
 *
 * @param name     Argument key the oracle must use.
 * @param type     Expected value type.
 * @param required Whether the argument must be present and non-null.
 */
public record ParameterSpec(String name, ParameterType type, boolean required) {

    public static ParameterSpec required(String name, ParameterType type) {
        return new ParameterSpec(name, type, true);
    }

    public static ParameterSpec optional(String name, ParameterType type) {
        return new ParameterSpec(name, type, false);
    }

    /** "name: type" or "name?: type" for optional parameters. */
    public String signature() {
        return name + (required ? "" : "?") + ": " + type.label();
    }
}
