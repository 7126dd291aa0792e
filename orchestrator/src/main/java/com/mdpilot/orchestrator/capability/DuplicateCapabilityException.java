package com.mdpilot.orchestrator.capability;

public class DuplicateCapabilityException extends RuntimeException {
    public DuplicateCapabilityException(String name) {
        super("Capability already registered: '" + name + "'");
    }
}
