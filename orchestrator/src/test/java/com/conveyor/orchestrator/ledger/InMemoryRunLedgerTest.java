package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.model.StageSnapshot;
import com.conveyor.orchestrator.model.StageState;
import com.conveyor.orchestrator.testutil.TestRuns;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Record/query semantics shared by every ledger store, exercised on the
 * in-memory one.
 */
class InMemoryRunLedgerTest {

    static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    final InMemoryRunLedger ledger = new InMemoryRunLedger();

    // ------------------------------------------------------------------
    // record()
    // ------------------------------------------------------------------

    @Test
    void record_storesSnapshotOfEveryStage() {
        Run run = TestRuns.finished("ci", RunState.SUCCEEDED, T0);

        assertThat(ledger.record(run)).isTrue();

        LedgerEntry entry = ledger.find(run.getId()).orElseThrow();
        assertThat(entry.outcome()).isEqualTo(RunState.SUCCEEDED);
        assertThat(entry.pipeline()).isEqualTo("ci");
        assertThat(entry.completedAt()).isEqualTo(T0);
        assertThat(entry.stages()).extracting(StageSnapshot::name).containsExactly("build", "publish");
        assertThat(entry.stages().get(1).artifact().coordinates()).isEqualTo("web-api:9f1c2e7");
    }

    @Test
    void record_sameOutcomeTwice_isNoOp() {
        Run run = TestRuns.finished("ci", RunState.FAILED, T0);

        assertThat(ledger.record(run)).isTrue();
        assertThat(ledger.record(run)).isFalse();
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    void record_differentOutcome_conflictsAndKeepsOriginal() {
        UUID id = UUID.randomUUID();
        ledger.record(TestRuns.finished(id, "ci", RunState.SUCCEEDED, T0));

        assertThatThrownBy(() -> ledger.record(TestRuns.finished(id, "ci", RunState.FAILED, T0)))
                .isInstanceOfSatisfying(LedgerConflictException.class, e -> {
                    assertThat(e.getRecorded()).isEqualTo(RunState.SUCCEEDED);
                    assertThat(e.getAttempted()).isEqualTo(RunState.FAILED);
                });
        assertThat(ledger.find(id).orElseThrow().outcome()).isEqualTo(RunState.SUCCEEDED);
    }

    @Test
    void record_nonTerminalRun_isRejected() {
        Run run = TestRuns.finished("ci", RunState.SUCCEEDED, T0);
        run.setState(RunState.RUNNING);

        assertThatThrownBy(() -> ledger.record(run)).isInstanceOf(IllegalArgumentException.class);
        assertThat(ledger.size()).isZero();
    }

    @Test
    void record_concurrentDuplicates_exactlyOneWins() throws Exception {
        Run run = TestRuns.finished("ci", RunState.SUCCEEDED, T0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) calls.add(() -> ledger.record(run));

            int written = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) written++;
            }
            assertThat(written).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void entry_isUnaffectedByLaterChangesToTheRun() {
        Run run = TestRuns.finished("ci", RunState.FAILED, T0);
        ledger.record(run);

        run.setState(RunState.CANCELLED);

        LedgerEntry entry = ledger.find(run.getId()).orElseThrow();
        assertThat(entry.outcome()).isEqualTo(RunState.FAILED);
        assertThat(entry.stages().get(0).state()).isEqualTo(StageState.FAILED);
    }

    // ------------------------------------------------------------------
    // query()
    // ------------------------------------------------------------------

    @Test
    void query_ordersByCompletionThenRunId() {
        UUID low  = UUID.fromString("00000000-0000-0000-0000-000000000001");
        UUID high = UUID.fromString("00000000-0000-0000-0000-000000000002");
        Run late  = TestRuns.finished("ci", RunState.SUCCEEDED, T0.plusSeconds(60));
        ledger.record(late);
        ledger.record(TestRuns.finished(high, "ci", RunState.SUCCEEDED, T0));
        ledger.record(TestRuns.finished(low,  "ci", RunState.FAILED,    T0));

        assertThat(ledger.query(LedgerQuery.all()))
                .extracting(LedgerEntry::runId)
                .containsExactly(low, high, late.getId());
    }

    @Test
    void query_sameCompletionTime_ordersRunIdsAsUnsignedBytes() {
        UUID low  = UUID.fromString("7fffffff-ffff-ffff-ffff-ffffffffffff");
        UUID high = UUID.fromString("80000000-0000-0000-0000-000000000000");
        ledger.record(TestRuns.finished(high, "ci", RunState.SUCCEEDED, T0));
        ledger.record(TestRuns.finished(low,  "ci", RunState.SUCCEEDED, T0));

        assertThat(high.compareTo(low)).isNegative();
        assertThat(ledger.query(LedgerQuery.all()))
                .extracting(LedgerEntry::runId)
                .containsExactly(low, high);
    }

    @Test
    void query_filtersByPipelineWindowAndOutcome() {
        ledger.record(TestRuns.finished("ci", RunState.SUCCEEDED, T0));
        Run inWindow = TestRuns.finished("ci", RunState.FAILED, T0.plusSeconds(30));
        ledger.record(inWindow);
        ledger.record(TestRuns.finished("ci", RunState.FAILED, T0.plusSeconds(60)));   // at 'to': excluded
        ledger.record(TestRuns.finished("cd", RunState.FAILED, T0.plusSeconds(30)));

        List<LedgerEntry> result = ledger.query(
                new LedgerQuery("ci", T0.plusSeconds(1), T0.plusSeconds(60), RunState.FAILED, null));

        assertThat(result).extracting(LedgerEntry::runId).containsExactly(inWindow.getId());
    }

    @Test
    void query_limitKeepsTheEarliest() {
        Run first = TestRuns.finished("ci", RunState.SUCCEEDED, T0);
        ledger.record(TestRuns.finished("ci", RunState.SUCCEEDED, T0.plusSeconds(20)));
        ledger.record(first);
        ledger.record(TestRuns.finished("ci", RunState.SUCCEEDED, T0.plusSeconds(10)));

        assertThat(ledger.query(new LedgerQuery("ci", null, null, null, 1)))
                .extracting(LedgerEntry::runId).containsExactly(first.getId());
    }

    @Test
    void query_emptyWindow_isRejected() {
        assertThatThrownBy(() -> new LedgerQuery(null, T0, T0.minusSeconds(1), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
