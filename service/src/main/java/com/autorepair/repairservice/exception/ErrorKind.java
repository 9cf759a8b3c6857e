package com.autorepair.repairservice.exception;

public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    INVALID_STATE,
    NO_ELIGIBLE_STAFF,
    NO_AUDIT_HISTORY,
    STORE_UNAVAILABLE,
    ORDER_UPDATE_FAILED
}
