package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AuditLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long>, JpaSpecificationExecutor<AuditLogEntry> {

    /**
     * Newest entries for a record that are neither rollbacks themselves nor already rolled back.
     */
    @Query("""
            SELECT e FROM AuditLogEntry e
            WHERE e.tableName = :tableName
              AND e.recordId = :recordId
              AND e.revertsLogId IS NULL
              AND NOT EXISTS (SELECT r.id FROM AuditLogEntry r WHERE r.revertsLogId = e.id)
            ORDER BY e.id DESC
            """)
    List<AuditLogEntry> findReversibleForRecord(@Param("tableName") String tableName,
                                                @Param("recordId") Long recordId,
                                                Pageable pageable);

    @Query("""
            SELECT e FROM AuditLogEntry e
            WHERE e.revertsLogId IS NULL
              AND NOT EXISTS (SELECT r.id FROM AuditLogEntry r WHERE r.revertsLogId = e.id)
            ORDER BY e.id DESC
            """)
    List<AuditLogEntry> findReversible(Pageable pageable);

    boolean existsByRevertsLogId(Long revertsLogId);

    long countByTableNameAndRecordId(String tableName, Long recordId);
}
