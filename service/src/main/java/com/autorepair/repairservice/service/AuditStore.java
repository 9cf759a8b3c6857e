package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.AuditLogEntry;
import com.autorepair.repairservice.entity.AuditOperation;
import com.autorepair.repairservice.exception.StoreUnavailableException;
import com.autorepair.repairservice.repository.AuditLogRepository;
import com.autorepair.repairservice.repository.AuditLogSpecification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only change log behind every audited write.
 *
 * <p>{@link #record} joins the caller's transaction and refuses to run without one, so the row
 * change and its log entry commit or roll back together. Any failure to append is reported as
 * {@link StoreUnavailableException}, which aborts the enclosing write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditStore {

    private static final TypeReference<LinkedHashMap<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${app.audit.default-query-limit:50}")
    private int defaultQueryLimit;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry record(String table, Long recordId, AuditOperation operation,
                                Map<String, Object> oldSnapshot, Map<String, Object> newSnapshot) {
        return record(table, recordId, operation, oldSnapshot, newSnapshot, null);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry record(String table, Long recordId, AuditOperation operation,
                                Map<String, Object> oldSnapshot, Map<String, Object> newSnapshot,
                                Long revertsLogId) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.setTableName(table);
        entry.setRecordId(recordId);
        entry.setOperation(operation);
        entry.setOldData(writeSnapshot(oldSnapshot));
        entry.setNewData(writeSnapshot(newSnapshot));
        entry.setOperatedAt(Timestamps.now(clock));
        entry.setRevertsLogId(revertsLogId);

        try {
            AuditLogEntry saved = auditLogRepository.saveAndFlush(entry);
            log.debug("Audit {} {} {} logged as entry {}", operation, table, recordId, saved.getId());
            return saved;
        } catch (DataAccessException e) {
            log.error("Audit append failed for {} {} {}: {}", operation, table, recordId, e.getMessage());
            throw new StoreUnavailableException(
                    String.format("Audit append failed for %s %s %d", operation, table, recordId), e);
        }
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> query(String table, AuditOperation operation) {
        return query(table, operation, defaultQueryLimit);
    }

    /** Newest-first slice of the log, optionally narrowed to one table and/or operation. */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> query(String table, AuditOperation operation, int limit) {
        Specification<AuditLogEntry> spec = Specification
                .where(AuditLogSpecification.hasTable(table))
                .and(AuditLogSpecification.hasOperation(operation));

        return auditLogRepository.findAll(spec,
                PageRequest.of(0, Math.max(1, limit), Sort.by(Sort.Direction.DESC, "id"))).getContent();
    }

    /** Newest-first history of one record, capped at the default query limit. */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> historyOf(String table, Long recordId) {
        Specification<AuditLogEntry> spec = Specification
                .where(AuditLogSpecification.hasTable(table))
                .and(AuditLogSpecification.hasRecordId(recordId));

        return auditLogRepository.findAll(spec,
                PageRequest.of(0, Math.max(1, defaultQueryLimit), Sort.by(Sort.Direction.DESC, "id"))).getContent();
    }

    public Map<String, Object> readSnapshot(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, SNAPSHOT_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Unreadable audit snapshot", e);
        }
    }

    private String writeSnapshot(Map<String, Object> snapshot) {
        if (snapshot == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Audit snapshot could not be serialized", e);
        }
    }
}
