package com.mdpilot.orchestrator.memory;

import com.mdpilot.orchestrator.gate.GateState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCorrectiveMemoryTest {

    static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    static final Map<String, GateState> VALIDATED = Map.of(
            "structure_validated", GateState.OPEN,
            "forcefield_validated", GateState.OPEN,
            "system_prepared", GateState.UNSET);

    @Test
    void recall_onlyCorrectionsForSameCapability() {
        InMemoryCorrectiveMemory memory = new InMemoryCorrectiveMemory(5);
        memory.store(correction("prepare_system", "pad 1.2 nm", VALIDATED, T0));
        memory.store(correction("run_simulation", "use 2 fs timestep", VALIDATED, T0));

        assertThat(memory.recall(new CorrectionContext("prepare_system", VALIDATED)))
                .extracting(Correction::content)
                .containsExactly("pad 1.2 nm");
    }

    @Test
    void recall_ranksBySharedGateStatesThenRecency() {
        InMemoryCorrectiveMemory memory = new InMemoryCorrectiveMemory(5);
        Map<String, GateState> blocked = Map.of(
                "structure_validated", GateState.OPEN,
                "forcefield_validated", GateState.BLOCKED,
                "system_prepared", GateState.UNSET);
        memory.store(correction("prepare_system", "older exact match", VALIDATED, T0));
        memory.store(correction("prepare_system", "partial match", blocked, T0.plusSeconds(60)));
        memory.store(correction("prepare_system", "newer exact match", VALIDATED, T0.plusSeconds(30)));

        assertThat(memory.recall(new CorrectionContext("prepare_system", VALIDATED)))
                .extracting(Correction::content)
                .containsExactly("newer exact match", "older exact match", "partial match");
    }

    @Test
    void recall_limitedToConfiguredCount() {
        InMemoryCorrectiveMemory memory = new InMemoryCorrectiveMemory(2);
        for (int i = 0; i < 4; i++) {
            memory.store(correction("prepare_system", "correction " + i, VALIDATED, T0.plusSeconds(i)));
        }

        assertThat(memory.recall(new CorrectionContext("prepare_system", VALIDATED)))
                .extracting(Correction::content)
                .containsExactly("correction 3", "correction 2");
        assertThat(memory.size()).isEqualTo(4);
    }

    @Test
    void recall_nothingStored_empty() {
        assertThat(new InMemoryCorrectiveMemory(5).recall(new CorrectionContext("prepare_system", Map.of())))
                .isEmpty();
    }

    @Test
    void store_beyondCapacity_evictsOldestStored() {
        InMemoryCorrectiveMemory memory = new InMemoryCorrectiveMemory(5, 3);
        for (int i = 0; i < 5; i++) {
            memory.store(correction("prepare_system", "correction " + i, VALIDATED, T0.plusSeconds(i)));
        }

        assertThat(memory.size()).isEqualTo(3);
        assertThat(memory.recall(new CorrectionContext("prepare_system", VALIDATED)))
                .extracting(Correction::content)
                .containsExactly("correction 4", "correction 3", "correction 2");
    }

    @Test
    void store_evictionIgnoresCapability() {
        InMemoryCorrectiveMemory memory = new InMemoryCorrectiveMemory(5, 2);
        memory.store(correction("run_simulation", "use 2 fs timestep", VALIDATED, T0));
        memory.store(correction("prepare_system", "pad 1.2 nm", VALIDATED, T0.plusSeconds(1)));
        memory.store(correction("prepare_system", "ionic strength 0.15 M", VALIDATED, T0.plusSeconds(2)));

        assertThat(memory.recall(new CorrectionContext("run_simulation", VALIDATED))).isEmpty();
        assertThat(memory.recall(new CorrectionContext("prepare_system", VALIDATED))).hasSize(2);
    }

    @Test
    void constructor_nonPositiveLimit_rejected() {
        assertThatThrownBy(() -> new InMemoryCorrectiveMemory(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_nonPositiveCapacity_rejected() {
        assertThatThrownBy(() -> new InMemoryCorrectiveMemory(5, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void correction_blankContent_rejected() {
        assertThatThrownBy(() -> correction("prepare_system", "  ", VALIDATED, T0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Correction correction(String capability, String content,
                                         Map<String, GateState> gates, Instant at) {
        return new Correction(content, new CorrectionContext(capability, gates), at);
    }
}
