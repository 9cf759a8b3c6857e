package com.autorepair.repairservice.dto;

import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.entity.StaffJobType;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
public class OrderResponse {
    private Long id;
    private Long vehicleId;
    private Long customerId;
    private Long requestId;
    private StaffJobType requiredStaffType;
    private RepairStatus status;
    private OffsetDateTime orderTime;
    private OffsetDateTime finishTime;
    private String remarks;
    private List<AssignmentResponse> assignments;
    private FeeBreakdown fees;
}
