package com.autorepair.repairservice.entity;

import java.util.EnumSet;
import java.util.Set;

public enum RepairStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(RepairStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<RepairStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(RepairStatus.class);
        };
    }
}
