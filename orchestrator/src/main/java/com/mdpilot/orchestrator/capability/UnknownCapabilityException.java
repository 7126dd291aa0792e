package com.mdpilot.orchestrator.capability;

public class UnknownCapabilityException extends RuntimeException {
    public UnknownCapabilityException(String name) {
        super("No capability registered with name: '" + name + "'");
    }
}
