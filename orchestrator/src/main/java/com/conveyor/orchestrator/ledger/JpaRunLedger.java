package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.LedgerRecord;
import com.conveyor.orchestrator.model.StageSnapshot;
import com.conveyor.orchestrator.repository.LedgerRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.conveyor.orchestrator.repository.LedgerRecordRepository.*;

/**
 * PostgreSQL ledger ({@code conveyor.ledger.store=jpa}). The stage breakdown
 * is stored as JSON text next to the run columns.
 */
public class JpaRunLedger extends AbstractRunLedger {

    // uuid columns sort by unsigned bytes, matching LedgerEntry.ORDER
    private static final Sort ORDER = Sort.by("completedAt", "runId");

    private final LedgerRecordRepository repository;
    private final ObjectMapper           objectMapper;

    public JpaRunLedger(LedgerRecordRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean append(LedgerEntry entry) {
        try {
            repository.saveAndFlush(toRecord(entry));
            return true;
        } catch (DataIntegrityViolationException e) {
            // another node recorded the same run first
            return false;
        }
    }

    @Override
    public Optional<LedgerEntry> find(UUID runId) {
        return repository.findById(runId).map(this::toEntry);
    }

    @Override
    public List<LedgerEntry> query(LedgerQuery query) {
        Specification<LedgerRecord> spec = Specification.where(pipelineIs(query.pipeline()))
                .and(outcomeIs(query.outcome()))
                .and(completedFrom(query.from()))
                .and(completedBefore(query.to()));

        List<LedgerRecord> records = query.limit() == null
                ? repository.findAll(spec, ORDER)
                : query.limit() == 0
                        ? List.of()
                        : repository.findAll(spec, PageRequest.of(0, query.limit(), ORDER)).getContent();
        return records.stream().map(this::toEntry).toList();
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    LedgerRecord toRecord(LedgerEntry entry) {
        LedgerRecord record = new LedgerRecord(entry.runId(), entry.pipeline(), entry.pipelineVersion(),
                entry.kind(), entry.outcome(), entry.startedAt(), entry.completedAt(), writeStages(entry));
        record.setSourceVersion(entry.sourceVersion());
        record.setTriggeredBy(entry.triggeredBy());
        if (entry.artifact() != null) {
            record.setArtifactId(entry.artifact().id());
            record.setArtifactVersion(entry.artifact().version());
        }
        return record;
    }

    LedgerEntry toEntry(LedgerRecord record) {
        ArtifactReference artifact = record.getArtifactId() == null ? null
                : new ArtifactReference(record.getArtifactId(), record.getArtifactVersion());
        return new LedgerEntry(record.getRunId(), record.getPipeline(), record.getPipelineVersion(),
                record.getKind(), record.getSourceVersion(), artifact, record.getTriggeredBy(),
                record.getOutcome(), record.getStartedAt(), record.getCompletedAt(), readStages(record));
    }

    private String writeStages(LedgerEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.stages());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise stages of run " + entry.runId(), e);
        }
    }

    private List<StageSnapshot> readStages(LedgerRecord record) {
        try {
            return objectMapper.readValue(record.getStagesJson(), new TypeReference<List<StageSnapshot>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt stage breakdown for run " + record.getRunId(), e);
        }
    }
}
