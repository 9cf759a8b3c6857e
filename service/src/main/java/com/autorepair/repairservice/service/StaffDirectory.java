package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import com.autorepair.repairservice.entity.StaffJobType;

import java.util.List;
import java.util.Optional;

/** Read access to staff records owned by the account layer. */
public interface StaffDirectory {

    /** Staff whose job type is {@code jobType}, without {@code excludeStaffId} when it is given. */
    List<StaffCandidate> eligibleStaff(StaffJobType jobType, Long excludeStaffId);

    /** Empty when the staff member does not exist or has no rate on file. */
    Optional<Double> hourlyRate(Long staffId);
}
