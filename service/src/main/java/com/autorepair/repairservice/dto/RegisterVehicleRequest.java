package com.autorepair.repairservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RegisterVehicleRequest {

    @NotNull(message = "customerId must not be null")
    private Long customerId;

    @NotBlank(message = "License plate must not be blank")
    private String licensePlate;

    private String brand;
    private String model;
    private String type;
    private String color;
    private String remarks;
}
