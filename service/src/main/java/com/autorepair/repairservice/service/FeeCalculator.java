package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.FeeBreakdown;
import com.autorepair.repairservice.entity.Material;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Billable amounts for a repair order. Pure reads; whether to bill only completed orders is up to
 * the caller.
 */
@Service
@RequiredArgsConstructor
public class FeeCalculator {

    private final RepairOrderStore orderStore;
    private final RepairLogStore logStore;
    private final MaterialStore materialStore;
    private final RepairAssignmentStore assignmentStore;
    private final StaffDirectory staffDirectory;

    /** Sum of quantity x unit price over the materials of every log on the order. */
    @Transactional(readOnly = true)
    public double materialFee(Long orderId) {
        List<Long> logIds = logStore.findByOrder(orderId).stream().map(RepairLog::getId).toList();
        if (logIds.isEmpty()) {
            return 0.0;
        }
        return materialStore.findByLogs(logIds).stream()
                .mapToDouble(Material::getTotalPrice)
                .sum();
    }

    /**
     * Sum of hours worked x hourly rate over the order's assignments. Assignments without hours,
     * or whose staff member has no rate on file, add nothing.
     */
    @Transactional(readOnly = true)
    public double laborFee(Long orderId) {
        return assignmentStore.findByOrder(orderId).stream()
                .filter(a -> a.getTimeWorked() != null && a.getTimeWorked() > 0)
                .mapToDouble(this::assignmentFee)
                .sum();
    }

    @Transactional(readOnly = true)
    public FeeBreakdown breakdown(Long orderId) {
        if (orderStore.find(orderId).isEmpty()) {
            throw new RecordNotFoundException(RepairOrderStore.TABLE, orderId);
        }
        double material = materialFee(orderId);
        double labor = laborFee(orderId);
        return new FeeBreakdown(orderId, material, labor, material + labor);
    }

    private double assignmentFee(RepairAssignment assignment) {
        return staffDirectory.hourlyRate(assignment.getStaffId())
                .map(rate -> assignment.getTimeWorked() * rate)
                .orElse(0.0);
    }
}
