package com.autorepair.repairservice.entity;

import java.util.EnumSet;
import java.util.Set;

public enum AssignmentStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    CANCELLED;

    /** Pending or accepted: the assignment still binds its order. */
    public boolean isLive() {
        return this == PENDING || this == ACCEPTED;
    }

    public static Set<AssignmentStatus> liveStatuses() {
        return EnumSet.of(PENDING, ACCEPTED);
    }
}
