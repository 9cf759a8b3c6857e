package com.autorepair.repairservice.exception;

public class StoreUnavailableException extends RepairServiceException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
