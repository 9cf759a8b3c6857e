package com.autorepair.repairservice.dto;

import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
public class RepairLogResponse {
    private Long id;
    private Long orderId;
    private Long staffId;
    private OffsetDateTime logTime;
    private String logMessage;
    private List<MaterialResponse> materials;
}
