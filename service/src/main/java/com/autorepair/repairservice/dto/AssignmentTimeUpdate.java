package com.autorepair.repairservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentTimeUpdate {

    @NotNull(message = "assignmentId must not be null")
    private Long assignmentId;

    @NotNull(message = "timeWorked must not be null")
    @PositiveOrZero(message = "timeWorked must not be negative")
    private Double timeWorked;
}
