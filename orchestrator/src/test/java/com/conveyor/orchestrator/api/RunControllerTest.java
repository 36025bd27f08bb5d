package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.ledger.LedgerEntry;
import com.conveyor.orchestrator.ledger.LedgerQuery;
import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.pipeline.DefinitionInvalidException;
import com.conveyor.orchestrator.pipeline.UnknownPipelineException;
import com.conveyor.orchestrator.service.RunService;
import com.conveyor.orchestrator.service.RunService.CancelResult;
import com.conveyor.orchestrator.testutil.TestRuns;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RunController.
 *
 * Only the web layer starts; RunService is a mock.
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    static final Instant DONE = Instant.parse("2024-05-01T10:05:00Z");

    @Autowired MockMvc      mockMvc;
    @MockitoBean RunService runService;

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void startRun_validRequest_returns201WithOutcome() throws Exception {
        Run run = TestRuns.finished("ci", RunState.SUCCEEDED, DONE);
        when(runService.startRun(eq("ci"), any())).thenReturn(run.toOutcome());

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipeline":"ci","sourceVersion":"9f1c2e7","parameters":{"env":"staging"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.state").value("SUCCEEDED"))
                .andExpect(jsonPath("$.stages[1].name").value("publish"))
                .andExpect(jsonPath("$.stages[1].artifact").value("web-api:9f1c2e7"));

        ArgumentCaptor<RunContext> ctx = ArgumentCaptor.forClass(RunContext.class);
        verify(runService).startRun(eq("ci"), ctx.capture());
        assertThat(ctx.getValue().sourceVersion()).isEqualTo("9f1c2e7");
        assertThat(ctx.getValue().artifact()).isNull();
        assertThat(ctx.getValue().parameters()).isEqualTo(Map.of("env", "staging"));
    }

    @Test
    void startRun_withArtifact_passesItToTheRun() throws Exception {
        Run run = TestRuns.finished("cd", RunState.SUCCEEDED, DONE);
        when(runService.startRun(eq("cd"), any())).thenReturn(run.toOutcome());

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipeline":"cd","sourceVersion":"9f1c2e7","artifactId":"web-api","artifactVersion":"9f1c2e7"}
                                """))
                .andExpect(status().isCreated());

        ArgumentCaptor<RunContext> ctx = ArgumentCaptor.forClass(RunContext.class);
        verify(runService).startRun(eq("cd"), ctx.capture());
        assertThat(ctx.getValue().artifact()).isEqualTo(new ArtifactReference("web-api", "9f1c2e7"));
    }

    @Test
    void startRun_missingPipeline_returns400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceVersion":"9f1c2e7"}
                                """))
                .andExpect(status().isBadRequest());

        verify(runService, never()).startRun(any(), any());
    }

    @Test
    void startRun_artifactIdWithoutVersion_returns400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipeline":"cd","artifactId":"web-api"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void startRun_unknownPipeline_returns404() throws Exception {
        when(runService.startRun(eq("nightly"), any())).thenThrow(new UnknownPipelineException("nightly"));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipeline":"nightly","sourceVersion":"9f1c2e7"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void startRun_invalidDefinition_returns422() throws Exception {
        when(runService.startRun(eq("ci"), any())).thenThrow(
                new DefinitionInvalidException("ci", List.of("dependency cycle among stages [a, b]")));

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"pipeline":"ci","sourceVersion":"9f1c2e7"}
                                """))
                .andExpect(status().isUnprocessableEntity());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_recordedRun_returns200WithStages() throws Exception {
        Run run = TestRuns.finished("ci", RunState.FAILED, DONE);
        when(runService.getRun(run.getId())).thenReturn(Optional.of(run.toOutcome()));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("FAILED"))
                .andExpect(jsonPath("$.stages[0].state").value("FAILED"))
                .andExpect(jsonPath("$.stages[0].attempts").value(2))
                .andExpect(jsonPath("$.stages[1].state").value("SKIPPED"));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(runService.getRun(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void getRun_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/runs/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /runs/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_liveRun_returns202() throws Exception {
        UUID id = UUID.randomUUID();
        when(runService.cancel(id)).thenReturn(CancelResult.REQUESTED);

        mockMvc.perform(post("/runs/{id}/cancel", id))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").value(id.toString()))
                .andExpect(jsonPath("$.status").value("cancelling"));
    }

    @Test
    void cancel_finishedRun_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(runService.cancel(id)).thenReturn(CancelResult.ALREADY_FINISHED);

        mockMvc.perform(post("/runs/{id}/cancel", id))
                .andExpect(status().isConflict());
    }

    @Test
    void cancel_unknownRun_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(runService.cancel(id)).thenReturn(CancelResult.NOT_FOUND);

        mockMvc.perform(post("/runs/{id}/cancel", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs
    // ------------------------------------------------------------------

    @Test
    void listRuns_passesFiltersToTheLedgerQuery() throws Exception {
        Run run = TestRuns.finished("cd", RunState.FAILED, DONE);
        when(runService.listRuns(any())).thenReturn(List.of(LedgerEntry.from(run)));

        mockMvc.perform(get("/runs")
                        .param("pipeline", "cd")
                        .param("outcome", "FAILED")
                        .param("from", "2024-05-01T00:00:00Z")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].pipeline").value("cd"))
                .andExpect(jsonPath("$[0].state").value("FAILED"));

        ArgumentCaptor<LedgerQuery> query = ArgumentCaptor.forClass(LedgerQuery.class);
        verify(runService).listRuns(query.capture());
        assertThat(query.getValue()).isEqualTo(new LedgerQuery("cd",
                Instant.parse("2024-05-01T00:00:00Z"), null, RunState.FAILED, 20));
    }

    @Test
    void listRuns_windowEndsBeforeItStarts_returns400() throws Exception {
        mockMvc.perform(get("/runs")
                        .param("from", "2024-05-02T00:00:00Z")
                        .param("to", "2024-05-01T00:00:00Z"))
                .andExpect(status().isBadRequest());

        verify(runService, never()).listRuns(any());
    }

    @Test
    void listRuns_unknownOutcome_returns400() throws Exception {
        mockMvc.perform(get("/runs").param("outcome", "EXPLODED"))
                .andExpect(status().isBadRequest());
    }
}
