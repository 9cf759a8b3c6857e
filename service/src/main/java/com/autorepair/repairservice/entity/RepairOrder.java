package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "repair_order")
@Getter
@Setter
public class RepairOrder implements AuditedRecord {

    @Id
    @Column(name = "order_id")
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "request_id", nullable = false)
    private Long requestId;

    @Enumerated(EnumType.STRING)
    @Column(name = "required_staff_type", length = 40)
    private StaffJobType requiredStaffType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RepairStatus status;

    @Column(name = "order_time", nullable = false)
    private OffsetDateTime orderTime;

    @Column(name = "finish_time")
    private OffsetDateTime finishTime;

    @Column(length = 1000)
    private String remarks;
}
