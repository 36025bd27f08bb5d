package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.LedgerRecord;
import com.conveyor.orchestrator.model.RunState;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.Instant;
import java.util.UUID;

/**
 * Insert + query operations for the ledger_entries table.
 *
 * Spring Data JPA generates the implementation at startup. Ledger queries
 * combine the optional filters below into one {@link Specification}.
 */
public interface LedgerRecordRepository extends JpaRepository<LedgerRecord, UUID>,
        JpaSpecificationExecutor<LedgerRecord> {

    static Specification<LedgerRecord> pipelineIs(String pipeline) {
        return (root, query, cb) -> pipeline == null ? null : cb.equal(root.get("pipeline"), pipeline);
    }

    static Specification<LedgerRecord> outcomeIs(RunState outcome) {
        return (root, query, cb) -> outcome == null ? null : cb.equal(root.get("outcome"), outcome);
    }

    static Specification<LedgerRecord> completedFrom(Instant from) {
        return (root, query, cb) -> from == null ? null
                : cb.greaterThanOrEqualTo(root.<Instant>get("completedAt"), from);
    }

    static Specification<LedgerRecord> completedBefore(Instant to) {
        return (root, query, cb) -> to == null ? null
                : cb.lessThan(root.<Instant>get("completedAt"), to);
    }
}
