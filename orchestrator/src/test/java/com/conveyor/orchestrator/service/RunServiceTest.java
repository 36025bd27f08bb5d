package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.ledger.InMemoryRunLedger;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunOutcome;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.pipeline.PipelineCatalog;
import com.conveyor.orchestrator.pipeline.UnknownPipelineException;
import com.conveyor.orchestrator.stage.StageActionRegistry;
import com.conveyor.orchestrator.testutil.ScriptedAction;
import com.conveyor.orchestrator.testutil.TestRuns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.conveyor.orchestrator.testutil.TestPipelines.pipeline;
import static com.conveyor.orchestrator.testutil.TestPipelines.scripted;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunServiceTest {

    static final Instant DONE = Instant.parse("2024-05-01T10:05:00Z");

    @Mock RunCoordinator coordinator;

    final InMemoryRunLedger ledger = new InMemoryRunLedger();

    PipelineDefinition ci;
    RunService         runService;

    @BeforeEach
    void setUp() {
        ci = pipeline("ci", scripted("build"));
        PipelineCatalog catalog = new PipelineCatalog(List.of(ci),
                new StageActionRegistry(List.of(new ScriptedAction())));
        runService = new RunService(coordinator, catalog, ledger);
    }

    @Test
    void startRun_returnsTheLiveView() {
        RunHandle handle = new RunHandle(UUID.randomUUID(), "ci");
        RunOutcome live = TestRuns.finished(handle.runId(), "ci", RunState.SUCCEEDED, DONE).toOutcome();
        RunContext ctx = RunContext.of("9f1c2e7");
        when(coordinator.start(ci, ctx)).thenReturn(handle);
        when(coordinator.find(handle.runId())).thenReturn(Optional.of(live));

        assertThat(runService.startRun("ci", ctx)).isEqualTo(live);
    }

    @Test
    void startRun_thatFinishedBeforeTheLookup_isReadFromTheLedger() {
        Run run = TestRuns.finished("ci", RunState.FAILED, DONE);
        ledger.record(run);
        RunContext ctx = RunContext.of("9f1c2e7");
        when(coordinator.start(ci, ctx)).thenReturn(new RunHandle(run.getId(), "ci"));
        when(coordinator.find(run.getId())).thenReturn(Optional.empty());

        assertThat(runService.startRun("ci", ctx).state()).isEqualTo(RunState.FAILED);
    }

    @Test
    void startRun_unknownPipeline_throwsWithoutStarting() {
        assertThatThrownBy(() -> runService.startRun("nightly", RunContext.of("v1")))
                .isInstanceOf(UnknownPipelineException.class);
        verify(coordinator, never()).start(any(), any());
    }

    @Test
    void cancel_distinguishesLiveFinishedAndUnknownRuns() {
        UUID live = UUID.randomUUID();
        Run finished = TestRuns.finished("ci", RunState.SUCCEEDED, DONE);
        ledger.record(finished);
        UUID unknown = UUID.randomUUID();
        when(coordinator.cancel(live)).thenReturn(true);
        when(coordinator.cancel(finished.getId())).thenReturn(false);
        when(coordinator.cancel(unknown)).thenReturn(false);

        assertThat(runService.cancel(live)).isEqualTo(RunService.CancelResult.REQUESTED);
        assertThat(runService.cancel(finished.getId())).isEqualTo(RunService.CancelResult.ALREADY_FINISHED);
        assertThat(runService.cancel(unknown)).isEqualTo(RunService.CancelResult.NOT_FOUND);
    }

    @Test
    void getRun_prefersTheLiveViewOverTheLedger() {
        Run run = TestRuns.finished("ci", RunState.SUCCEEDED, DONE);
        RunOutcome live = new RunOutcome(run.getId(), "ci", "1", run.getDefinition().kind(), RunState.RUNNING,
                "9f1c2e7", null, null, DONE.minusSeconds(60), null, run.stageSnapshots());
        ledger.record(run);
        when(coordinator.find(run.getId())).thenReturn(Optional.of(live));

        assertThat(runService.getRun(run.getId())).contains(live);
    }
}
