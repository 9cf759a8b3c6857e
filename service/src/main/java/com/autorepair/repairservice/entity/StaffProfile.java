package com.autorepair.repairservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Staff-only part of a user: what they can be assigned to and what an hour of their work costs. */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class StaffProfile {

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", length = 40)
    private StaffJobType jobType;

    @Column(name = "hourly_rate")
    private Double hourlyRate;

    public StaffProfile(StaffJobType jobType, Double hourlyRate) {
        this.jobType = jobType;
        this.hourlyRate = hourlyRate;
    }
}
