package com.mdpilot.orchestrator.gate;

import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionKind;
import com.mdpilot.orchestrator.job.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GateLedgerTest {

    static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    MutableClock     clock;
    List<Transition> audit;
    GateLedger       ledger;

    @BeforeEach
    void setUp() {
        clock  = new MutableClock(T0);
        audit  = Collections.synchronizedList(new ArrayList<>());
        ledger = new GateLedger(List.of("structure_validated", "system_prepared"), audit::add, clock);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Test
    void stateOf_newLedger_everyGateUnset() {
        assertThat(ledger.stateOf("structure_validated")).isEqualTo(GateState.UNSET);
        assertThat(ledger.gate("system_prepared").orElseThrow().evidence()).isEqualTo("Not evaluated yet");
    }

    @Test
    void stateOf_unknownGate_isUnsetNotAnError() {
        assertThat(ledger.stateOf("no_such_gate")).isEqualTo(GateState.UNSET);
        assertThat(ledger.stateOf(null)).isEqualTo(GateState.UNSET);
        assertThat(ledger.gate("no_such_gate")).isEmpty();
    }

    @Test
    void unmet_keepsRequestedOrder() {
        ledger.open("structure_validated", "ok", 1);

        assertThat(ledger.unmet(List.of("system_prepared", "structure_validated", "forcefield_validated")))
                .containsExactly("system_prepared", "forcefield_validated");
        assertThat(ledger.allOpen(List.of("structure_validated"))).isTrue();
        assertThat(ledger.allOpen(List.of())).isTrue();
    }

    @Test
    void snapshot_isSortedAndUnmodifiable() {
        ledger.open("analysis_completed", "done", 9);

        Map<String, Gate> snapshot = ledger.snapshot();

        assertThat(snapshot.keySet()).containsExactly("analysis_completed", "structure_validated", "system_prepared");
        assertThatThrownBy(() -> snapshot.remove("system_prepared"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    @Test
    void openThenBlock_recordsBothTransitionsWithEvidence() {
        ledger.open("structure_validated", "0 chain breaks", 3);
        clock.advance(Duration.ofSeconds(5));
        Gate blocked = ledger.block("structure_validated", "structure changed by prepare_system", 4);

        assertThat(blocked.state()).isEqualTo(GateState.BLOCKED);
        assertThat(blocked.invocationId()).isEqualTo(4L);
        assertThat(blocked.updatedAt()).isEqualTo(T0.plusSeconds(5));

        List<GateTransition> history = ledger.history();
        assertThat(history).extracting(GateTransition::from)
                .containsExactly(GateState.UNSET, GateState.OPEN);
        assertThat(history).extracting(GateTransition::to)
                .containsExactly(GateState.OPEN, GateState.BLOCKED);
        assertThat(history.get(0).evidence()).isEqualTo("0 chain breaks");

        assertThat(audit).hasSize(2);
        assertThat(audit).allMatch(t -> t.kind() == TransitionKind.GATE);
    }

    @Test
    void block_gateNeverOpened_isValid() {
        ledger.block("system_prepared", "missing forcefield parameters for HEM", 2);

        assertThat(ledger.stateOf("system_prepared")).isEqualTo(GateState.BLOCKED);
        assertThat(ledger.history().get(0).from()).isEqualTo(GateState.UNSET);
    }

    @Test
    void open_gateNotDeclaredUpFront_isCreated() {
        ledger.open("custom_check", "ok", 1);

        assertThat(ledger.stateOf("custom_check")).isEqualTo(GateState.OPEN);
    }

    @Test
    void transition_clockGoesBackwards_timestampNeverDecreases() {
        clock.set(T0.plusSeconds(60));
        ledger.open("structure_validated", "first", 1);
        clock.set(T0.plusSeconds(10));
        Gate second = ledger.block("structure_validated", "second", 2);

        assertThat(second.updatedAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void transition_concurrentWritersOnOneGate_historyIsLinear() throws Exception {
        int threads = 8;
        int writesPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            long invocation = t + 1;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < writesPerThread; i++) {
                    if (i % 2 == 0) {
                        ledger.open("structure_validated", "w" + i, invocation);
                    } else {
                        ledger.block("structure_validated", "w" + i, invocation);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<GateTransition> history = ledger.history();
        assertThat(history).hasSize(threads * writesPerThread);
        // every transition starts from the state the previous one left behind
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).from()).isEqualTo(history.get(i - 1).to());
        }
        assertThat(ledger.stateOf("structure_validated")).isEqualTo(history.get(history.size() - 1).to());
    }
}
