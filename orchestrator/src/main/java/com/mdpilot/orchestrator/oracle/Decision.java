package com.mdpilot.orchestrator.oracle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the oracle wants to happen next.
 *
 * @param kind            PROPOSE a capability, AWAIT outstanding jobs, or DONE.
 * @param capability      Capability to invoke (PROPOSE only).
 * @param args            Its arguments (PROPOSE only).
 * @param humanCorrection Operator correction this proposal acts on; non-null marks
 *                        the invocation as human-corrected.
 */
public record Decision(Kind kind, String capability, Map<String, Object> args, String humanCorrection) {

    public enum Kind { PROPOSE, AWAIT, DONE }

    public Decision {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        if (kind == Kind.PROPOSE && (capability == null || capability.isBlank())) {
            throw new IllegalArgumentException("A proposal must name a capability");
        }
    }

    public static Decision propose(String capability, Map<String, Object> args) {
        return new Decision(Kind.PROPOSE, capability, args, null);
    }

    public static Decision awaitJobs() {
        return new Decision(Kind.AWAIT, null, Map.of(), null);
    }

    public static Decision done() {
        return new Decision(Kind.DONE, null, Map.of(), null);
    }

    public Decision withHumanCorrection(String correction) {
        return new Decision(kind, capability, args, correction);
    }

    public boolean isHumanCorrected() {
        return humanCorrection != null && !humanCorrection.isBlank();
    }
}
