package com.autorepair.repairservice.exception;

public class NoAuditHistoryException extends RepairServiceException {
    public NoAuditHistoryException(String table, Long recordId) {
        super(ErrorKind.NO_AUDIT_HISTORY,
                String.format("No reversible audit history for %s %d", table, recordId));
    }

    public NoAuditHistoryException() {
        super(ErrorKind.NO_AUDIT_HISTORY, "No reversible audit history");
    }
}
