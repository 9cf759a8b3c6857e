package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Append-only record of one write to an audited table. {@code oldData}/{@code newData} hold the
 * JSON field map of the row before and after the write; {@code revertsLogId} is set when the
 * write was a rollback of another entry.
 */
@Entity
@Table(name = "audit_log")
@Getter
@Setter
public class AuditLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long id;

    @Column(name = "table_name", nullable = false, length = 50)
    private String tableName;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AuditOperation operation;

    @Column(name = "old_data", length = 8000)
    private String oldData;

    @Column(name = "new_data", length = 8000)
    private String newData;

    @Column(name = "operated_at", nullable = false, updatable = false)
    private OffsetDateTime operatedAt;

    @Column(name = "reverts_log_id", updatable = false)
    private Long revertsLogId;
}
