package com.autorepair.repairservice.entity;

public enum UserRole {
    CUSTOMER,
    STAFF,
    ADMIN
}
