package com.autorepair.repairservice.exception;

public class RecordNotFoundException extends RepairServiceException {
    public RecordNotFoundException(String table, Long id) {
        super(ErrorKind.NOT_FOUND, String.format("%s not found: %d", table, id));
    }

    public RecordNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
