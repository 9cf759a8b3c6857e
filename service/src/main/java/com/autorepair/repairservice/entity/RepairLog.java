package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "repair_log")
@Getter
@Setter
public class RepairLog implements AuditedRecord {

    @Id
    @Column(name = "log_id")
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(name = "log_time", nullable = false)
    private OffsetDateTime logTime;

    @Column(name = "log_message", nullable = false, length = 2000)
    private String logMessage;
}
