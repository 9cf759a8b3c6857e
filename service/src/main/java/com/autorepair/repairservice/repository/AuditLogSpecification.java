package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AuditLogEntry;
import com.autorepair.repairservice.entity.AuditOperation;
import org.springframework.data.jpa.domain.Specification;

public class AuditLogSpecification {

    public static Specification<AuditLogEntry> hasTable(String tableName) {
        return (root, query, cb) ->
                (tableName == null || tableName.isBlank()) ? cb.conjunction()
                        : cb.equal(root.get("tableName"), tableName);
    }

    public static Specification<AuditLogEntry> hasOperation(AuditOperation operation) {
        return (root, query, cb) ->
                operation == null ? cb.conjunction() : cb.equal(root.get("operation"), operation);
    }

    public static Specification<AuditLogEntry> hasRecordId(Long recordId) {
        return (root, query, cb) ->
                recordId == null ? cb.conjunction() : cb.equal(root.get("recordId"), recordId);
    }
}
