package com.mdpilot.orchestrator.capability;

import java.util.Map;

/**
 * Runs the capabilities bound to it in the catalog.
 *
 * Implementations are Spring beans; the registry collects them at startup and
 * binds each catalog entry to the executor whose {@link #id()} it names. One
 * executor usually serves several capabilities (the tool-service executor
 * forwards every structure, force-field and analysis call).
 *
 * <p>The dispatcher never lets an exception from {@link #execute} escape: it is
 * recorded as an executor fault on the invocation.
 */
public interface CapabilityExecutor {

    /** Id referenced by catalog entries, e.g. "tool-service". */
    String id();

    /**
     * Run one invocation synchronously.
     *
     * @param capability the capability being invoked
     * @param args       validated arguments
     * @param ctx        run, invocation and gate context
     */
    ExecutionResult execute(Capability capability, Map<String, Object> args, InvocationContext ctx);
}
