package com.autorepair.repairservice.exception;

import com.autorepair.repairservice.entity.RepairStatus;

public class OrderUpdateFailedException extends RepairServiceException {
    public OrderUpdateFailedException(Long orderId, RepairStatus current, RepairStatus target) {
        super(ErrorKind.ORDER_UPDATE_FAILED, String.format(
                "Failed to update repair order %d from %s to %s", orderId, current, target));
    }

    public OrderUpdateFailedException(Long orderId, String reason) {
        super(ErrorKind.ORDER_UPDATE_FAILED,
                String.format("Failed to update repair order %d: %s", orderId, reason));
    }

    public OrderUpdateFailedException(Long orderId, Throwable cause) {
        super(ErrorKind.ORDER_UPDATE_FAILED,
                String.format("Failed to update repair order %d", orderId), cause);
    }
}
