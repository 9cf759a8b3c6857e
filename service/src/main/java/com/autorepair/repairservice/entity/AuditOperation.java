package com.autorepair.repairservice.entity;

public enum AuditOperation {
    INSERT,
    UPDATE,
    DELETE
}
