package com.autorepair.repairservice.dto;

import com.autorepair.repairservice.entity.AssignmentStatus;
import lombok.Data;

@Data
public class AssignmentResponse {
    private Long id;
    private Long orderId;
    private Long staffId;
    private AssignmentStatus status;
    private Double timeWorked;
}
