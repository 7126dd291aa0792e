package com.mdpilot.orchestrator.api;

import com.mdpilot.orchestrator.audit.AuditTrail;
import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.audit.TransitionKind;
import com.mdpilot.orchestrator.capability.CapabilityRegistry;
import com.mdpilot.orchestrator.oracle.Decision;
import com.mdpilot.orchestrator.pipeline.PipelineRun;
import com.mdpilot.orchestrator.pipeline.PipelineRuns;
import com.mdpilot.orchestrator.pipeline.PipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for PipelineController.
 *
 * PipelineService and AuditTrail are mocked; the runs handed back are real
 * in-memory runs, driven to completion on the test thread where needed.
 */
@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    @Autowired MockMvc mockMvc;
    @MockitoBean PipelineService pipelineService;
    @MockitoBean AuditTrail      auditTrail;

    final CapabilityRegistry registry = PipelineRuns.registry();

    // ------------------------------------------------------------------
    // POST /pipelines
    // ------------------------------------------------------------------

    @Test
    void start_validGoal_returns201Running() throws Exception {
        PipelineRun run = PipelineRuns.newRun("Simulate 1UBQ", registry, CLOCK);
        when(pipelineService.start("Simulate 1UBQ")).thenReturn(run);

        mockMvc.perform(post("/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"Simulate 1UBQ"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.id().toString()))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.totalGates").value(2))
                .andExpect(jsonPath("$.openGates").value(0));
    }

    @Test
    void start_blankGoal_returns400() throws Exception {
        mockMvc.perform(post("/pipelines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"goal":"  "}
                                """))
                .andExpect(status().isBadRequest());

        verify(pipelineService, never()).start(anyString());
    }

    // ------------------------------------------------------------------
    // GET /pipelines/{id}
    // ------------------------------------------------------------------

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(pipelineService.find(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/pipelines/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    @Test
    void get_finishedRun_returnsSignal() throws Exception {
        PipelineRun run = finishedRun();
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/pipelines/{id}", run.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PIPELINE_COMPLETE"))
                .andExpect(jsonPath("$.invocations").value(3))
                .andExpect(jsonPath("$.openGates").value(2));
    }

    @Test
    void list_returnsTrackedRuns() throws Exception {
        PipelineRun run = PipelineRuns.newRun("Simulate 1UBQ", registry, CLOCK);
        when(pipelineService.runs()).thenReturn(List.of(run));

        mockMvc.perform(get("/pipelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].goal").value("Simulate 1UBQ"));
    }

    // ------------------------------------------------------------------
    // Gates, invocations, report
    // ------------------------------------------------------------------

    @Test
    void gates_returnsLedgerSortedByName() throws Exception {
        PipelineRun run = finishedRun();
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/pipelines/{id}/gates", run.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("structure_downloaded"))
                .andExpect(jsonPath("$[0].state").value("OPEN"))
                .andExpect(jsonPath("$[1].name").value("structure_validated"));
    }

    @Test
    void invocations_includeRejectionWithUnmetGates() throws Exception {
        PipelineRun run = finishedRun();
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/pipelines/{id}/invocations", run.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].capability").value("validate_structure"))
                .andExpect(jsonPath("$[0].status").value("REJECTED"))
                .andExpect(jsonPath("$[0].reason").value("GATE_NOT_OPEN"))
                .andExpect(jsonPath("$[0].unmetGates[0]").value("structure_downloaded"))
                .andExpect(jsonPath("$[1].status").value("SUCCEEDED"))
                .andExpect(jsonPath("$[1].gatesChanged[0]").value("structure_downloaded=OPEN"));
    }

    @Test
    void report_runningRun_returns202() throws Exception {
        PipelineRun run = PipelineRuns.newRun("Simulate 1UBQ", registry, CLOCK);
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/pipelines/{id}/report", run.id()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void report_finishedRun_returnsEvidenceTrail() throws Exception {
        PipelineRun run = finishedRun();
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/pipelines/{id}/report", run.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.signal").value("PIPELINE_COMPLETE"))
                .andExpect(jsonPath("$.evidence").value(containsString("structure_downloaded UNSET -> OPEN")));
    }

    @Test
    void audit_returnsPersistedTransitions() throws Exception {
        UUID runId = UUID.randomUUID();
        when(auditTrail.history(runId)).thenReturn(List.of(new Transition(CLOCK.instant(), 1L,
                TransitionKind.GATE, "structure_downloaded", "UNSET", "OPEN", "1ubq.pdb")));

        mockMvc.perform(get("/pipelines/{id}/audit", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("GATE"))
                .andExpect(jsonPath("$[0].toState").value("OPEN"));
    }

    // ------------------------------------------------------------------
    // Cancel and corrections
    // ------------------------------------------------------------------

    @Test
    void cancel_knownRun_returns202() throws Exception {
        PipelineRun run = PipelineRuns.newRun("Simulate 1UBQ", registry, CLOCK);
        when(pipelineService.cancel(run.id(), "wrong protonation")).thenReturn(true);
        when(pipelineService.find(run.id())).thenReturn(Optional.of(run));

        mockMvc.perform(post("/pipelines/{id}/cancel", run.id())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reason":"wrong protonation"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(run.id().toString()));
    }

    @Test
    void cancel_unknownRun_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(pipelineService.cancel(any(), any())).thenReturn(false);

        mockMvc.perform(post("/pipelines/{id}/cancel", unknown))
                .andExpect(status().isNotFound());
    }

    @Test
    void correct_knownRun_returns202() throws Exception {
        UUID runId = UUID.randomUUID();
        when(pipelineService.addCorrection(runId, "use amber14 not charmm36")).thenReturn(true);

        mockMvc.perform(post("/pipelines/{id}/corrections", runId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"use amber14 not charmm36"}
                                """))
                .andExpect(status().isAccepted());
    }

    @Test
    void correct_blankText_returns400() throws Exception {
        mockMvc.perform(post("/pipelines/{id}/corrections", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":""}
                                """))
                .andExpect(status().isBadRequest());

        verify(pipelineService, never()).addCorrection(any(), anyString());
    }

    @Test
    void correct_unknownRun_returns404() throws Exception {
        when(pipelineService.addCorrection(any(), anyString())).thenReturn(false);

        mockMvc.perform(post("/pipelines/{id}/corrections", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"use amber14"}
                                """))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** validate_structure (rejected), download_structure, validate_structure, done. */
    private PipelineRun finishedRun() {
        PipelineRun run = PipelineRuns.newRun("Simulate 1UBQ", registry, CLOCK);
        AtomicInteger turn = new AtomicInteger();
        PipelineRuns.drive(run, registry, CLOCK, snapshot -> switch (turn.getAndIncrement()) {
            case 0, 2 -> Decision.propose("validate_structure", Map.of("pdb_file", "1ubq.pdb"));
            case 1    -> Decision.propose("download_structure", Map.of("pdb_id", "1UBQ"));
            default   -> Decision.done();
        });
        return run;
    }
}
