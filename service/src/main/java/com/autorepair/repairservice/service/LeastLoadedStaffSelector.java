package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.repository.RepairAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Picks the candidate with the fewest pending or accepted assignments; lowest staff id wins ties. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.assignment.selection-strategy", havingValue = "least-loaded")
public class LeastLoadedStaffSelector implements StaffSelector {

    private final RepairAssignmentRepository assignmentRepository;

    @Override
    public StaffCandidate select(List<StaffCandidate> eligible) {
        if (eligible.isEmpty()) {
            throw new IllegalArgumentException("eligible staff must not be empty");
        }
        Map<Long, Long> load = eligible.stream().collect(Collectors.toMap(
                StaffCandidate::getStaffId,
                c -> assignmentRepository.countByStaffIdAndStatusIn(c.getStaffId(), AssignmentStatus.liveStatuses()),
                (a, b) -> a));

        return eligible.stream()
                .min(Comparator.comparing((StaffCandidate c) -> load.get(c.getStaffId()))
                        .thenComparing(StaffCandidate::getStaffId))
                .orElseThrow();
    }
}
