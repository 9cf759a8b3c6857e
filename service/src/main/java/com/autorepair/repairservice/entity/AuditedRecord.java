package com.autorepair.repairservice.entity;

/**
 * A row whose writes are paired with an audit log entry. Identifiers are assigned by the
 * application before insert so that a deleted row can be restored under its original id.
 */
public interface AuditedRecord {

    Long getId();

    void setId(Long id);
}
