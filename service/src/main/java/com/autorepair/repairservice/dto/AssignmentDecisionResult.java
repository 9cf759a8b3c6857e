package com.autorepair.repairservice.dto;

import lombok.Data;

/**
 * Outcome of a staff member answering an assignment. On rejection {@code replacement} is the
 * follow-up assignment, or null with {@code manualInterventionRequired} set when nobody else
 * is eligible.
 */
@Data
public class AssignmentDecisionResult {
    private AssignmentResponse assignment;
    private AssignmentResponse replacement;
    private boolean manualInterventionRequired;
    private String message;
}
