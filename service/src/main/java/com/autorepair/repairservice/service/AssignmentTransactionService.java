package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.exception.ForbiddenOperationException;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.NoEligibleStaffException;
import com.autorepair.repairservice.exception.OrderUpdateFailedException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Single assignment steps, each in its own transaction (REQUIRES_NEW) so a rejection is committed
 * before the follow-up assignment is created. Kept as a separate bean so calls from
 * {@link AssignmentEngine} go through the transactional proxy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentTransactionService {

    private final RepairOrderStore orderStore;
    private final RepairAssignmentStore assignmentStore;
    private final StaffDirectory staffDirectory;
    private final StaffSelector staffSelector;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RepairAssignment assign(Long orderId, Long excludeStaffId) {
        // The order row lock serialises concurrent assignment of the same order.
        RepairOrder order = orderStore.findForUpdate(orderId)
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, orderId));

        if (order.getRequiredStaffType() == null) {
            throw new InvalidStateException(
                    String.format("Repair order %d has no required staff type", orderId));
        }
        if (order.getStatus() != RepairStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Repair order %d is in status %s, expected PENDING", orderId, order.getStatus()));
        }
        if (assignmentStore.hasLiveAssignment(orderId)) {
            throw new InvalidStateException(
                    String.format("Repair order %d already has a pending or accepted assignment", orderId));
        }

        List<StaffCandidate> eligible = staffDirectory.eligibleStaff(order.getRequiredStaffType(), excludeStaffId);
        if (eligible.isEmpty()) {
            throw new NoEligibleStaffException(orderId, order.getRequiredStaffType(), excludeStaffId);
        }
        StaffCandidate chosen = staffSelector.select(eligible);

        RepairAssignment assignment = new RepairAssignment();
        assignment.setOrderId(orderId);
        assignment.setStaffId(chosen.getStaffId());
        assignment.setStatus(AssignmentStatus.PENDING);
        RepairAssignment saved = assignmentStore.insert(assignment);

        log.info("Repair order {} assigned to staff {} (assignment {}, {} eligible)",
                orderId, chosen.getStaffId(), saved.getId(), eligible.size());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RepairAssignment decide(Long assignmentId, Long staffId, boolean accept) {
        RepairAssignment assignment = assignmentStore.find(assignmentId)
                .orElseThrow(() -> new RecordNotFoundException(RepairAssignmentStore.TABLE, assignmentId));

        if (!assignment.getStaffId().equals(staffId)) {
            throw new ForbiddenOperationException(String.format(
                    "Assignment %d does not belong to staff %d", assignmentId, staffId));
        }
        if (assignment.getStatus() != AssignmentStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Assignment %d is in status %s, expected PENDING", assignmentId, assignment.getStatus()));
        }

        Long orderId = assignment.getOrderId();
        if (accept) {
            RepairOrder order = orderStore.findForUpdate(orderId)
                    .orElseThrow(() -> new OrderUpdateFailedException(orderId, "order not found"));
            if (!order.getStatus().canTransitionTo(RepairStatus.IN_PROGRESS)) {
                throw new OrderUpdateFailedException(orderId, order.getStatus(), RepairStatus.IN_PROGRESS);
            }
        }

        AssignmentStatus target = accept ? AssignmentStatus.ACCEPTED : AssignmentStatus.REJECTED;
        RepairAssignment updated = assignmentStore.transition(assignment, AssignmentStatus.PENDING, target)
                .orElseThrow(() -> new InvalidStateException(String.format(
                        "Assignment %d is no longer PENDING, it was answered concurrently", assignmentId)));

        if (accept) {
            try {
                orderStore.update(orderId, o -> o.setStatus(RepairStatus.IN_PROGRESS));
            } catch (DataAccessException e) {
                throw new OrderUpdateFailedException(orderId, e);
            }
        }

        log.info("Assignment {} {} by staff {} (order {})", assignmentId, target, staffId, orderId);
        return updated;
    }
}
