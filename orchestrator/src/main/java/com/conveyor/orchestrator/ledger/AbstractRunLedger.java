package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Idempotent {@link RunLedger#record} on top of a plain insert.
 *
 * Records of the same run id are serialised through a striped lock; records
 * of different runs proceed in parallel. Stores shared between processes may
 * still lose an insert race, which {@link #append} reports by returning false.
 */
public abstract class AbstractRunLedger implements RunLedger {

    private static final Logger log = LoggerFactory.getLogger(AbstractRunLedger.class);

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    protected AbstractRunLedger() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public final boolean record(Run run) {
        if (!run.getState().isTerminal()) {
            throw new IllegalArgumentException("Run " + run.getId() + " is " + run.getState()
                    + "; only terminal runs are recorded");
        }
        LedgerEntry entry = LedgerEntry.from(run);

        ReentrantLock lock = locks[Math.floorMod(entry.runId().hashCode(), STRIPES)];
        lock.lock();
        try {
            Optional<LedgerEntry> existing = find(entry.runId());
            if (existing.isPresent()) {
                return sameOutcome(existing.get(), entry);
            }
            if (append(entry)) {
                log.info("Recorded run {} of '{}' as {}", entry.runId(), entry.pipeline(), entry.outcome());
                return true;
            }
            LedgerEntry winner = find(entry.runId()).orElseThrow(() ->
                    new IllegalStateException("Insert of run " + entry.runId() + " failed but no entry exists"));
            return sameOutcome(winner, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert a new entry.
     *
     * @return false if an entry with the same run id already exists
     */
    protected abstract boolean append(LedgerEntry entry);

    private static boolean sameOutcome(LedgerEntry recorded, LedgerEntry attempted) {
        if (recorded.outcome() != attempted.outcome()) {
            throw new LedgerConflictException(recorded.runId(), recorded.outcome(), attempted.outcome());
        }
        log.debug("Run {} already recorded as {}", recorded.runId(), recorded.outcome());
        return false;
    }
}
