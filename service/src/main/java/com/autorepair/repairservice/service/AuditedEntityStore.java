package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.AuditOperation;
import com.autorepair.repairservice.entity.AuditedRecord;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Typed CRUD over one table where every write is paired with an {@link AuditStore} entry in the
 * same transaction: the row is written and flushed first, then the entry is appended. If the
 * append fails the exception propagates and the row change rolls back with it.
 *
 * <p>Snapshots are the entity's field map as Jackson sees it, so whatever is restored from a
 * snapshot is exactly what was logged.
 */
@Slf4j
public abstract class AuditedEntityStore<T extends AuditedRecord> implements AuditedTable {

    private static final TypeReference<LinkedHashMap<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    protected final JpaRepository<T, Long> repository;
    protected final AuditStore auditStore;
    private final ObjectMapper objectMapper;
    private final RecordIdGenerator idGenerator;
    private final Class<T> entityType;
    private final String tableName;

    protected AuditedEntityStore(JpaRepository<T, Long> repository, AuditStore auditStore,
                                 ObjectMapper objectMapper, RecordIdGenerator idGenerator,
                                 Class<T> entityType, String tableName) {
        this.repository = repository;
        this.auditStore = auditStore;
        this.objectMapper = objectMapper;
        this.idGenerator = idGenerator;
        this.entityType = entityType;
        this.tableName = tableName;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Transactional(readOnly = true)
    public Optional<T> find(Long id) {
        return repository.findById(id);
    }

    @Transactional(readOnly = true)
    public T get(Long id) {
        return repository.findById(id).orElseThrow(() -> new RecordNotFoundException(tableName, id));
    }

    @Transactional
    public T insert(T entity) {
        if (entity.getId() == null) {
            entity.setId(idGenerator.nextId());
        }
        T saved = repository.saveAndFlush(entity);
        auditStore.record(tableName, saved.getId(), AuditOperation.INSERT, null, snapshot(saved));
        return saved;
    }

    @Transactional
    public T update(Long id, Consumer<T> change) {
        T entity = repository.findById(id).orElseThrow(() -> new RecordNotFoundException(tableName, id));
        return applyUpdate(entity, change);
    }

    /** Same as {@link #update(Long, Consumer)} for a row the caller already loaded (and possibly locked). */
    @Transactional
    public T applyUpdate(T entity, Consumer<T> change) {
        Map<String, Object> before = snapshot(entity);
        change.accept(entity);
        T saved = repository.saveAndFlush(entity);
        auditStore.record(tableName, saved.getId(), AuditOperation.UPDATE, before, snapshot(saved));
        return saved;
    }

    /**
     * Logs an UPDATE for a change already written by a bulk statement. {@code before} is the row
     * as it was read before the statement ran.
     */
    @Transactional
    public T recordUpdated(Map<String, Object> before, Long id) {
        T after = repository.findById(id).orElseThrow(() -> new RecordNotFoundException(tableName, id));
        auditStore.record(tableName, id, AuditOperation.UPDATE, before, snapshot(after));
        return after;
    }

    @Transactional
    public void delete(Long id) {
        T entity = repository.findById(id).orElseThrow(() -> new RecordNotFoundException(tableName, id));
        Map<String, Object> before = snapshot(entity);
        repository.delete(entity);
        repository.flush();
        auditStore.record(tableName, id, AuditOperation.DELETE, before, null);
    }

    @Override
    @Transactional
    public void removeRecord(Long recordId, Long revertsLogId) {
        T entity = repository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(tableName, recordId));
        Map<String, Object> before = snapshot(entity);
        repository.delete(entity);
        repository.flush();
        auditStore.record(tableName, recordId, AuditOperation.DELETE, before, null, revertsLogId);
        log.info("Removed {} {} reverting audit entry {}", tableName, recordId, revertsLogId);
    }

    @Override
    @Transactional
    public void restoreRecord(Long recordId, Map<String, Object> snapshot, Long revertsLogId) {
        Map<String, Object> before = repository.findById(recordId).map(this::snapshot).orElse(null);

        T restored = objectMapper.convertValue(snapshot, entityType);
        restored.setId(recordId);
        T saved = repository.saveAndFlush(restored);

        AuditOperation operation = before == null ? AuditOperation.INSERT : AuditOperation.UPDATE;
        auditStore.record(tableName, recordId, operation, before, snapshot(saved), revertsLogId);
        log.info("Restored {} {} ({}) reverting audit entry {}", tableName, recordId, operation, revertsLogId);
    }

    public Map<String, Object> snapshot(T entity) {
        return objectMapper.convertValue(entity, SNAPSHOT_TYPE);
    }
}
