package com.mdpilot.orchestrator.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-process capability registry.
 *
 * All {@link CapabilityExecutor} beans are collected at startup via constructor
 * injection; capabilities are then registered from the static catalog, each one
 * bound to the executor its entry names. Registration happens once, before any
 * pipeline run starts.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Registration with duplicate detection ({@link #register}).</li>
 *   <li>Lookup by name ({@link #lookup}) and gate accessors.</li>
 *   <li>Catalog documentation ({@link #describeCapabilities}) for the oracle
 *       prompt, always in sync with what is registered.</li>
 * </ol>
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability>         capabilities = new ConcurrentHashMap<>();
    private final Map<String, CapabilityExecutor> executors;

    public CapabilityRegistry(List<CapabilityExecutor> allExecutors) {
        this.executors = allExecutors.stream()
                .collect(Collectors.toUnmodifiableMap(
                        CapabilityExecutor::id,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate executor id: " + a.id());
                        }));
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Register one capability.
     *
     * @throws DuplicateCapabilityException if the name is already taken
     * @throws IllegalArgumentException     if the executor id is unknown, or a
     *                                      JOB capability names an executor that
     *                                      cannot run batch jobs
     */
    public void register(Capability capability) {
        CapabilityExecutor executor = executors.get(capability.executorId());
        if (executor == null) {
            throw new IllegalArgumentException("Capability '" + capability.name()
                    + "' names unknown executor '" + capability.executorId() + "'");
        }
        if (capability.mode() == ExecutionMode.JOB && !(executor instanceof JobBackedExecutor)) {
            throw new IllegalArgumentException("Capability '" + capability.name()
                    + "' is job-backed but executor '" + executor.id() + "' cannot submit jobs");
        }
        if (capabilities.putIfAbsent(capability.name(), capability) != null) {
            throw new DuplicateCapabilityException(capability.name());
        }
        log.info("Registered capability '{}' -> executor '{}' [{}] requires={} affects={}",
                capability.name(), capability.executorId(), capability.mode(),
                capability.requiredGates(), capability.affectedGates());
    }

    public void registerAll(Collection<Capability> catalog) {
        catalog.forEach(this::register);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Capability lookup(String name) {
        Capability capability = name == null ? null : capabilities.get(name);
        if (capability == null) {
            throw new UnknownCapabilityException(name);
        }
        return capability;
    }

    public Optional<Capability> find(String name) {
        return Optional.ofNullable(name == null ? null : capabilities.get(name));
    }

    public CapabilityExecutor executorFor(String name) {
        return executors.get(lookup(name).executorId());
    }

    public List<String> requiredGates(String name) {
        return lookup(name).requiredGates();
    }

    public List<String> affectedGates(String name) {
        return lookup(name).affectedGates();
    }

    /** Returns all registered capability names (sorted). */
    public List<String> capabilityNames() {
        return capabilities.keySet().stream().sorted().toList();
    }

    /** Every gate any registered capability requires or affects (sorted). */
    public List<String> gateNames() {
        TreeSet<String> gates = new TreeSet<>();
        capabilities.values().forEach(c -> {
            gates.addAll(c.requiredGates());
            gates.addAll(c.affectedGates());
        });
        return List.copyOf(gates);
    }

    // ------------------------------------------------------------------
    // Catalog documentation
    // ------------------------------------------------------------------

    /**
     * Render the AVAILABLE CAPABILITIES block handed to the oracle.
     *
     * Capabilities with no required gates come first, so the entry points of
     * the pipeline head the list.
     */
    public String describeCapabilities() {
        StringBuilder sb = new StringBuilder("AVAILABLE CAPABILITIES:\n");
        capabilities.values().stream()
                .sorted((a, b) -> {
                    int byGates = Integer.compare(a.requiredGates().size(), b.requiredGates().size());
                    return byGates != 0 ? byGates : a.name().compareTo(b.name());
                })
                .forEach(c -> {
                    sb.append("  ").append(c.signature());
                    if (c.mode() == ExecutionMode.JOB) {
                        sb.append("  [batch job]");
                    }
                    sb.append("\n");
                    if (!c.description().isBlank()) {
                        sb.append("      ").append(c.description()).append("\n");
                    }
                    if (!c.requiredGates().isEmpty()) {
                        sb.append("      requires: ").append(String.join(", ", c.requiredGates())).append("\n");
                    }
                    if (!c.affectedGates().isEmpty()) {
                        sb.append("      affects:  ").append(String.join(", ", c.affectedGates())).append("\n");
                    }
                    sb.append("\n");
                });
        return sb.toString();
    }
}
