package com.mdpilot.orchestrator.api;

import com.mdpilot.orchestrator.api.dto.CancelRequest;
import com.mdpilot.orchestrator.api.dto.CorrectionRequest;
import com.mdpilot.orchestrator.api.dto.GateResponse;
import com.mdpilot.orchestrator.api.dto.InvocationResponse;
import com.mdpilot.orchestrator.api.dto.PipelineResponse;
import com.mdpilot.orchestrator.api.dto.StartPipelineRequest;
import com.mdpilot.orchestrator.audit.AuditTrail;
import com.mdpilot.orchestrator.audit.Transition;
import com.mdpilot.orchestrator.pipeline.PipelineResult;
import com.mdpilot.orchestrator.pipeline.PipelineRun;
import com.mdpilot.orchestrator.pipeline.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST /pipelines                    start a run
 * GET  /pipelines                    list tracked runs
 * GET  /pipelines/{id}               poll a run
 * GET  /pipelines/{id}/gates         current gate ledger
 * GET  /pipelines/{id}/invocations   invocation history
 * GET  /pipelines/{id}/report        evidence trail once the run has ended
 * GET  /pipelines/{id}/audit         persisted transition log
 * POST /pipelines/{id}/cancel        cancel a run
 * POST /pipelines/{id}/corrections   queue an operator correction for the oracle
 */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final PipelineService pipelineService;
    private final AuditTrail      auditTrail;

    public PipelineController(PipelineService pipelineService, AuditTrail auditTrail) {
        this.pipelineService = pipelineService;
        this.auditTrail      = auditTrail;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/pipelines \
     *     -H "Content-Type: application/json" \
     *     -d '{"goal":"Prepare and simulate PDB 1UBQ for 10 ns"}'
     */
    @PostMapping
    public ResponseEntity<PipelineResponse> start(@RequestBody StartPipelineRequest req) {
        if (req.goal() == null || req.goal().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "goal must not be blank");
        }
        PipelineRun run = pipelineService.start(req.goal());
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(run));
    }

    @GetMapping
    public List<PipelineResponse> list() {
        return pipelineService.runs().stream().map(PipelineResponse::from).toList();
    }

    @GetMapping("/{id}")
    public PipelineResponse get(@PathVariable UUID id) {
        return PipelineResponse.from(require(id));
    }

    @GetMapping("/{id}/gates")
    public List<GateResponse> gates(@PathVariable UUID id) {
        return require(id).ledger().snapshot().values().stream()
                .map(GateResponse::from)
                .toList();
    }

    @GetMapping("/{id}/invocations")
    public List<InvocationResponse> invocations(@PathVariable UUID id) {
        return require(id).dispatcher().invocations().stream()
                .map(InvocationResponse::from)
                .toList();
    }

    /**
     * HTTP 200 with the evidence trail once the run has ended,
     * HTTP 202 while it is still running.
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Map<String, Object>> report(@PathVariable UUID id) {
        PipelineRun run = require(id);
        PipelineResult result = run.result().orElse(null);
        if (result == null) {
            return ResponseEntity.accepted().body(Map.of("status", "RUNNING"));
        }
        return ResponseEntity.ok(Map.of(
                "signal",   result.signal().name(),
                "reason",   result.reason() == null ? "" : result.reason().name(),
                "message",  result.message(),
                "evidence", result.evidenceTrail()));
    }

    /** Transitions as persisted; also works for runs no longer held in memory. */
    @GetMapping("/{id}/audit")
    public List<Transition> audit(@PathVariable UUID id) {
        return auditTrail.history(id);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PipelineResponse> cancel(@PathVariable UUID id,
                                                   @RequestBody(required = false) CancelRequest req) {
        String reason = req == null ? null : req.reason();
        if (!pipelineService.cancel(id, reason)) {
            throw notFound(id);
        }
        return ResponseEntity.accepted().body(PipelineResponse.from(require(id)));
    }

    @PostMapping("/{id}/corrections")
    public ResponseEntity<Void> correct(@PathVariable UUID id, @RequestBody CorrectionRequest req) {
        if (req.text() == null || req.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text must not be blank");
        }
        if (!pipelineService.addCorrection(id, req.text())) {
            throw notFound(id);
        }
        return ResponseEntity.accepted().build();
    }

    private PipelineRun require(UUID id) {
        return pipelineService.find(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Pipeline not found: " + id);
    }
}
