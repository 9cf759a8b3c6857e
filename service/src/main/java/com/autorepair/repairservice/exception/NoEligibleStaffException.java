package com.autorepair.repairservice.exception;

import com.autorepair.repairservice.entity.StaffJobType;

public class NoEligibleStaffException extends RepairServiceException {
    public NoEligibleStaffException(Long orderId, StaffJobType jobType, Long excludedStaffId) {
        super(ErrorKind.NO_ELIGIBLE_STAFF, excludedStaffId == null
                ? String.format("Repair order %d: no eligible staff of type %s", orderId, jobType)
                : String.format("Repair order %d: no eligible staff of type %s excluding staff %d",
                        orderId, jobType, excludedStaffId));
    }
}
