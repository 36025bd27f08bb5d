package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.RunState;

import java.time.Instant;

/**
 * Filter for {@link RunLedger#query}. Every field is optional.
 *
 * @param pipeline only entries of this pipeline
 * @param from     completed at or after (inclusive)
 * @param to       completed before (exclusive)
 * @param outcome  only entries with this outcome
 * @param limit    at most this many entries, the earliest first
 */
public record LedgerQuery(String pipeline, Instant from, Instant to, RunState outcome, Integer limit) {

    public LedgerQuery {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Empty time window: " + from + " .. " + to);
        }
    }

    public static LedgerQuery all() {
        return new LedgerQuery(null, null, null, null, null);
    }

    public boolean matches(LedgerEntry entry) {
        if (pipeline != null && !pipeline.equals(entry.pipeline())) return false;
        if (outcome  != null && outcome != entry.outcome())          return false;
        if (from     != null && entry.completedAt().isBefore(from))  return false;
        if (to       != null && !entry.completedAt().isBefore(to))   return false;
        return true;
    }
}
