package com.autorepair.repairservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MaterialLine {

    @NotBlank(message = "Material name must not be blank")
    private String name;

    @Positive(message = "quantity must be positive")
    private double quantity;

    @PositiveOrZero(message = "unitPrice must not be negative")
    private double unitPrice;

    private String remarks;
}
