package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "repair_assignment")
@Getter
@Setter
public class RepairAssignment implements AuditedRecord {

    @Id
    @Column(name = "assignment_id")
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status;

    // hours
    @Column(name = "time_worked")
    private Double timeWorked;
}
