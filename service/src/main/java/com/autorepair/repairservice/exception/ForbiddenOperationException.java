package com.autorepair.repairservice.exception;

public class ForbiddenOperationException extends RepairServiceException {
    public ForbiddenOperationException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
