package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "vehicle")
@Getter
@Setter
public class Vehicle implements AuditedRecord {

    @Id
    @Column(name = "vehicle_id")
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "license_plate", nullable = false, length = 20)
    private String licensePlate;

    @Column(length = 50)
    private String brand;

    @Column(length = 100)
    private String model;

    @Column(length = 30)
    private String type;

    @Column(length = 30)
    private String color;

    @Column(length = 1000)
    private String remarks;
}
