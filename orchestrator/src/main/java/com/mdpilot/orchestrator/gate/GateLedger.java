package com.mdpilot.orchestrator.gate;

import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The single authoritative record of which pipeline preconditions hold.
 *
 * <p>Writes to one gate are serialised through {@link ConcurrentHashMap#compute};
 * the timestamp is taken inside that critical section and never goes backwards
 * for a gate, so the later write always carries the later timestamp. Writes to
 * different gates do not contend.
 *
 * <p>Reads never fail: a gate the ledger has never heard of is {@link GateState#UNSET}.
 */
public class GateLedger {

    private static final Logger log = LoggerFactory.getLogger(GateLedger.class);

    private final Map<String, Gate>     gates   = new ConcurrentHashMap<>();
    private final List<GateTransition>  history = new CopyOnWriteArrayList<>();
    private final TransitionLog         transitionLog;
    private final Clock                 clock;

    /**
     * @param gateNames     gates known at pipeline start; each begins UNSET
     * @param transitionLog persisted audit trail for this run
     */
    public GateLedger(Collection<String> gateNames, TransitionLog transitionLog, Clock clock) {
        this.transitionLog = transitionLog;
        this.clock         = clock;
        Instant now = clock.instant();
        for (String name : gateNames) {
            gates.put(name, Gate.unset(name, now));
        }
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /** Open a gate. Re-opening an open gate replaces its evidence. */
    public Gate open(String gateName, String evidence, long invocationId) {
        return transition(gateName, GateState.OPEN, evidence, invocationId);
    }

    /** Block a gate. Blocking a gate that was never opened is a valid transition. */
    public Gate block(String gateName, String evidence, long invocationId) {
        return transition(gateName, GateState.BLOCKED, evidence, invocationId);
    }

    private Gate transition(String gateName, GateState target, String evidence, long invocationId) {
        Objects.requireNonNull(gateName, "gateName");
        String text = evidence == null ? "" : evidence;

        GateTransition[] recorded = new GateTransition[1];
        Gate updated = gates.compute(gateName, (name, current) -> {
            Instant now = clock.instant();
            GateState from = GateState.UNSET;
            if (current != null) {
                from = current.state();
                if (now.isBefore(current.updatedAt())) {
                    now = current.updatedAt();
                }
            }
            recorded[0] = new GateTransition(name, from, target, text, invocationId, now);
            history.add(recorded[0]);
            return new Gate(name, target, text, now, invocationId);
        });

        GateTransition t = recorded[0];
        log.info("Gate '{}' {} -> {} (invocation {}): {}", gateName, t.from(), t.to(), invocationId, text);
        transitionLog.append(Transition.gate(t));
        return updated;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public GateState stateOf(String gateName) {
        Gate gate = gateName == null ? null : gates.get(gateName);
        return gate == null ? GateState.UNSET : gate.state();
    }

    public Optional<Gate> gate(String gateName) {
        return Optional.ofNullable(gates.get(gateName));
    }

    public boolean allOpen(Collection<String> gateNames) {
        return unmet(gateNames).isEmpty();
    }

    /** Gates from {@code gateNames} that are not OPEN, in the order given. */
    public List<String> unmet(Collection<String> gateNames) {
        return gateNames.stream()
                .filter(name -> stateOf(name) != GateState.OPEN)
                .toList();
    }

    /** Point-in-time copy of every gate, sorted by name. */
    public Map<String, Gate> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(gates));
    }

    /** Gate name to state, sorted by name. Handy for executor and memory contexts. */
    public Map<String, GateState> states() {
        Map<String, GateState> states = new TreeMap<>();
        gates.forEach((name, gate) -> states.put(name, gate.state()));
        return Collections.unmodifiableMap(states);
    }

    /** Every transition since the run started, in write order. */
    public List<GateTransition> history() {
        return List.copyOf(history);
    }
}
