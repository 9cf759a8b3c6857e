package com.autorepair.repairservice.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "feedback")
@Getter
@Setter
public class Feedback implements AuditedRecord {

    @Id
    @Column(name = "feedback_id")
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "log_id", nullable = false)
    private Long logId;

    @Column(nullable = false)
    private Integer rating;

    @Column(length = 1000)
    private String comments;

    @Column(name = "feedback_time", nullable = false)
    private OffsetDateTime feedbackTime;
}
