package com.autorepair.repairservice.dto;

import com.autorepair.repairservice.entity.StaffJobType;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StaffCandidate {
    private Long staffId;
    private String name;
    private StaffJobType jobType;
    private Double hourlyRate;
}
