package com.autorepair.repairservice.service;

import java.util.Map;

/**
 * Rollback's view of an audited table: enough to apply the structural inverse of a logged write.
 * Both operations are themselves audited, tagged with the entry they reverse.
 */
public interface AuditedTable {

    String tableName();

    void removeRecord(Long recordId, Long revertsLogId);

    /** Writes {@code snapshot} as the row's full state, inserting the row if it no longer exists. */
    void restoreRecord(Long recordId, Map<String, Object> snapshot, Long revertsLogId);
}
