package com.autorepair.repairservice.exception;

import com.autorepair.repairservice.entity.RepairStatus;

public class InvalidStatusTransitionException extends InvalidStateException {
    public InvalidStatusTransitionException(Long orderId, RepairStatus current, RepairStatus target) {
        super(String.format("Repair order %d: invalid transition %s -> %s", orderId, current, target));
    }
}
