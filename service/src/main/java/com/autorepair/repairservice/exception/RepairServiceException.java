package com.autorepair.repairservice.exception;

import lombok.Getter;

/**
 * Base of every failure the repair core reports to its callers. None of them is retried here;
 * the kind tells the caller whether a retry or a user-facing message makes sense.
 */
@Getter
public abstract class RepairServiceException extends RuntimeException {

    private final ErrorKind kind;

    protected RepairServiceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RepairServiceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
