package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import com.autorepair.repairservice.entity.AppUser;
import com.autorepair.repairservice.entity.StaffJobType;
import com.autorepair.repairservice.entity.UserRole;
import com.autorepair.repairservice.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserStaffDirectory implements StaffDirectory {

    private final AppUserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public List<StaffCandidate> eligibleStaff(StaffJobType jobType, Long excludeStaffId) {
        return userRepository.findAllByRoleAndStaffProfileJobTypeOrderByIdAsc(UserRole.STAFF, jobType).stream()
                .filter(u -> !Objects.equals(u.getId(), excludeStaffId))
                .map(this::toCandidate)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Double> hourlyRate(Long staffId) {
        return userRepository.findById(staffId)
                .filter(AppUser::isStaff)
                .map(u -> u.getStaffProfile().getHourlyRate());
    }

    private StaffCandidate toCandidate(AppUser user) {
        return new StaffCandidate(user.getId(), user.getName(),
                user.getStaffProfile().getJobType(), user.getStaffProfile().getHourlyRate());
    }
}
