package com.autorepair.repairservice.entity;

public enum StaffJobType {
    PAINT_WORKER,
    WELDER,
    AUTO_REPAIR_WORKER,
    AUTO_ELECTRICIAN,
    SHEET_METAL_WORKER,
    DIAGNOSTIC_TECHNICIAN,
    SERVICE_ADVISOR,
    PARTS_SPECIALIST
}
