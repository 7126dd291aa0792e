package com.mdpilot.orchestrator.capability;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/** Declared type of a capability parameter, checked against decoded JSON values. */
public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    LIST,
    MAP;

    public boolean accepts(Object value) {
        return switch (this) {
            case STRING  -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                         || value instanceof Short   || value instanceof Byte
                         || value instanceof BigInteger;
            case NUMBER  -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case LIST    -> value instanceof List<?>;
            case MAP     -> value instanceof Map<?, ?>;
        };
    }

    /** Lower-case name used in capability signatures, e.g. "integer". */
    public String label() {
        return name().toLowerCase();
    }
}
