package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.RollbackResult;
import com.autorepair.repairservice.entity.AuditLogEntry;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.NoAuditHistoryException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import com.autorepair.repairservice.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Undo for audited writes. Reversing an entry applies the structural inverse of its operation
 * (INSERT -> delete, UPDATE -> write back old data, DELETE -> reinsert old data) as a normal
 * audited write that points back at the entry it reverses.
 *
 * <p>"Last" and "most recent" only consider entries that are neither rollbacks nor already rolled
 * back, so consecutive calls walk further back through history. A rollback is undone by reversing
 * its own entry with {@link #rollbackEntry(Long)}.
 */
@Slf4j
@Service
public class RollbackCoordinator {

    private static final PageRequest NEWEST = PageRequest.of(0, 1);

    private final AuditLogRepository auditLogRepository;
    private final AuditStore auditStore;
    private final Map<String, AuditedTable> tables;

    public RollbackCoordinator(AuditLogRepository auditLogRepository, AuditStore auditStore,
                               List<AuditedTable> auditedTables) {
        this.auditLogRepository = auditLogRepository;
        this.auditStore = auditStore;
        this.tables = auditedTables.stream()
                .collect(Collectors.toUnmodifiableMap(AuditedTable::tableName, Function.identity()));
    }

    @Transactional
    public RollbackResult rollbackLast(String table, Long recordId) {
        AuditLogEntry entry = auditLogRepository.findReversibleForRecord(table, recordId, NEWEST).stream()
                .findFirst()
                .orElseThrow(() -> new NoAuditHistoryException(table, recordId));
        return revert(entry);
    }

    @Transactional
    public RollbackResult rollbackMostRecent() {
        AuditLogEntry entry = auditLogRepository.findReversible(NEWEST).stream()
                .findFirst()
                .orElseThrow(NoAuditHistoryException::new);
        return revert(entry);
    }

    @Transactional
    public RollbackResult rollbackEntry(Long logId) {
        AuditLogEntry entry = auditLogRepository.findById(logId)
                .orElseThrow(() -> new RecordNotFoundException("audit_log", logId));
        if (auditLogRepository.existsByRevertsLogId(logId)) {
            throw new InvalidStateException(String.format("Audit entry %d has already been rolled back", logId));
        }
        return revert(entry);
    }

    private RollbackResult revert(AuditLogEntry entry) {
        AuditedTable table = tables.get(entry.getTableName());
        if (table == null) {
            throw new InvalidStateException(String.format(
                    "Audit entry %d refers to table %s, which has no rollback support",
                    entry.getId(), entry.getTableName()));
        }

        Long recordId = entry.getRecordId();
        switch (entry.getOperation()) {
            case INSERT -> table.removeRecord(recordId, entry.getId());
            case UPDATE, DELETE -> table.restoreRecord(recordId, auditStore.readSnapshot(entry.getOldData()), entry.getId());
        }

        String message = String.format("Reverted %s of %s %d (audit entry %d)",
                entry.getOperation(), entry.getTableName(), recordId, entry.getId());
        log.info(message);
        return new RollbackResult(entry.getId(), entry.getTableName(), recordId, entry.getOperation(), message);
    }
}
