package com.autorepair.repairservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class FeeBreakdown {
    private Long orderId;
    private double materialFee;
    private double laborFee;
    private double total;
}
