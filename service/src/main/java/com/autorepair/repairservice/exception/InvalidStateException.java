package com.autorepair.repairservice.exception;

public class InvalidStateException extends RepairServiceException {
    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
