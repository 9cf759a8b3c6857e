package com.autorepair.repairservice.dto;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class FeedbackResponse {
    private Long id;
    private Long customerId;
    private Long logId;
    private Integer rating;
    private String comments;
    private OffsetDateTime feedbackTime;
}
