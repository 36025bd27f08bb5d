package com.conveyor.orchestrator.ledger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Process-local ledger for tests and single-node development
 * ({@code conveyor.ledger.store=memory}). Entries are lost on restart.
 */
public class InMemoryRunLedger extends AbstractRunLedger {

    private final Map<UUID, LedgerEntry> entries = new ConcurrentHashMap<>();

    @Override
    protected boolean append(LedgerEntry entry) {
        return entries.putIfAbsent(entry.runId(), entry) == null;
    }

    @Override
    public Optional<LedgerEntry> find(UUID runId) {
        return Optional.ofNullable(entries.get(runId));
    }

    @Override
    public List<LedgerEntry> query(LedgerQuery query) {
        Stream<LedgerEntry> matching = entries.values().stream()
                .filter(query::matches)
                .sorted(LedgerEntry.ORDER);
        if (query.limit() != null) {
            matching = matching.limit(query.limit());
        }
        return matching.toList();
    }

    public int size() {
        return entries.size();
    }
}
