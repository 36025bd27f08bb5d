package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.RunResponse;
import com.conveyor.orchestrator.api.dto.StartRunRequest;
import com.conveyor.orchestrator.ledger.LedgerQuery;
import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.pipeline.DefinitionInvalidException;
import com.conveyor.orchestrator.pipeline.UnknownPipelineException;
import com.conveyor.orchestrator.service.RunService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for runs.
 *
 * POST /runs              start a run of a configured pipeline
 * GET  /runs/{id}         state and stage breakdown of a live or recorded run
 * POST /runs/{id}/cancel  cancel a live run
 * GET  /runs              ledger entries, filtered by pipeline/window/outcome
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Start a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"pipeline":"ci","sourceVersion":"9f1c2e7"}'
     *
     * 404 for an unknown pipeline, 422 if the definition cannot run.
     */
    @PostMapping
    public ResponseEntity<RunResponse> start(@RequestBody StartRunRequest req) {
        if (req.pipeline() == null || req.pipeline().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "pipeline is required");
        }
        if ((req.artifactId() == null) != (req.artifactVersion() == null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "artifactId and artifactVersion must be given together");
        }
        ArtifactReference artifact = req.artifactId() == null ? null
                : new ArtifactReference(req.artifactId(), req.artifactVersion());
        RunContext context = new RunContext(req.sourceVersion(), artifact, null,
                req.parameters() == null ? Map.of() : req.parameters());
        try {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(RunResponse.from(runService.startRun(req.pipeline(), context)));
        } catch (UnknownPipelineException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (DefinitionInvalidException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        }
    }

    /** Returns 404 if the run ID is neither live nor recorded. */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.getRun(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    /**
     * HTTP 202: cancellation requested; poll GET /runs/{id} for the outcome
     * HTTP 409: the run already finished
     * HTTP 404: run ID not found
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable UUID id) {
        return switch (runService.cancel(id)) {
            case REQUESTED -> ResponseEntity.accepted()
                    .body(Map.of("runId", id.toString(), "status", "cancelling"));
            case ALREADY_FINISHED -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT, "Run already finished: " + id);
            case NOT_FOUND -> throw new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Run not found: " + id);
        };
    }

    /**
     * Recorded runs ordered by completion time.
     *
     * Example: GET /runs?pipeline=cd&amp;outcome=FAILED&amp;from=2024-05-01T00:00:00Z&amp;limit=20
     */
    @GetMapping
    public List<RunResponse> listRuns(
            @RequestParam(required = false) String pipeline,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) RunState outcome,
            @RequestParam(required = false) Integer limit) {
        LedgerQuery query;
        try {
            query = new LedgerQuery(pipeline, from, to, outcome, limit);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return runService.listRuns(query).stream()
                .map(entry -> RunResponse.from(entry.toOutcome()))
                .toList();
    }
}
