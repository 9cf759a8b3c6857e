package com.autorepair.repairservice.entity;

public enum RequestStatus {
    PENDING,
    ORDER_CREATED
}
