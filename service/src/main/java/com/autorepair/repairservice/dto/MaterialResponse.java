package com.autorepair.repairservice.dto;

import lombok.Data;

@Data
public class MaterialResponse {
    private Long id;
    private String name;
    private double quantity;
    private double unitPrice;
    private double totalPrice;
    private String remarks;
}
