package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.AssignmentDecisionResult;
import com.autorepair.repairservice.dto.AssignmentResponse;
import com.autorepair.repairservice.dto.AssignmentTimeUpdate;
import com.autorepair.repairservice.dto.OrderResponse;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.InvalidStatusTransitionException;
import com.autorepair.repairservice.exception.NoEligibleStaffException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.List;

/**
 * Drives repair orders through assignment: who gets an order, what happens when they answer,
 * and closing the order once the work is done.
 *
 * <p>Order lifecycle: PENDING -> IN_PROGRESS (first accepted assignment) -> COMPLETED. An order
 * has at most one pending or accepted assignment at a time; a rejection is final for that
 * assignment and triggers exactly one replacement, excluding the staff member who rejected.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class AssignmentEngine {

    private final AssignmentTransactionService txService;
    private final RepairOrderStore orderStore;
    private final RepairAssignmentStore assignmentStore;
    private final RepairMapper mapper;
    private final Clock clock;

    public AssignmentResponse assignOrder(Long orderId) {
        return assignOrder(orderId, null);
    }

    public AssignmentResponse assignOrder(Long orderId, Long excludeStaffId) {
        return mapper.toResponse(txService.assign(orderId, excludeStaffId));
    }

    /**
     * Records a staff member's answer. The accept/reject write only succeeds while the assignment
     * is still PENDING. On rejection the replacement is created in a separate transaction after
     * the rejection has committed, and only while the order is still PENDING. When nobody else is
     * eligible, or the order has moved on, the order is not reassigned and the result says so; the
     * committed rejection is never reported as a failure.
     */
    public AssignmentDecisionResult respondToAssignment(Long assignmentId, Long staffId, boolean accept) {
        RepairAssignment decided = txService.decide(assignmentId, staffId, accept);

        AssignmentDecisionResult result = new AssignmentDecisionResult();
        result.setAssignment(mapper.toResponse(decided));
        if (accept) {
            result.setMessage("Assignment accepted, order " + decided.getOrderId() + " is in progress");
            return result;
        }

        Long orderId = decided.getOrderId();
        RepairStatus orderStatus = orderStore.find(orderId).map(RepairOrder::getStatus).orElse(null);
        if (orderStatus != RepairStatus.PENDING) {
            log.info("Assignment {} rejected by staff {}; repair order {} is {}, not reassigning",
                    assignmentId, staffId, orderId, orderStatus);
            result.setMessage(String.format("Assignment rejected, repair order %d is %s and was not reassigned",
                    orderId, orderStatus == null ? "gone" : orderStatus));
            return result;
        }

        try {
            RepairAssignment replacement = txService.assign(orderId, staffId);
            result.setReplacement(mapper.toResponse(replacement));
            result.setMessage("Assignment rejected, order reassigned to staff " + replacement.getStaffId());
        } catch (NoEligibleStaffException e) {
            log.warn("Repair order {} has no live assignment after staff {} rejected assignment {}: {}",
                    orderId, staffId, assignmentId, e.getMessage());
            result.setManualInterventionRequired(true);
            result.setMessage("Assignment rejected, no other eligible staff: " + e.getMessage());
        } catch (InvalidStateException | RecordNotFoundException e) {
            // The order moved on (cancelled, assigned by someone else, or removed) after the check above.
            log.info("Assignment {} rejected by staff {}; repair order {} not reassigned: {}",
                    assignmentId, staffId, orderId, e.getMessage());
            result.setMessage("Assignment rejected, order not reassigned: " + e.getMessage());
        }
        return result;
    }

    /**
     * Books the hours worked on each listed assignment and completes the order, all in one
     * transaction: if any assignment is missing nothing is applied.
     */
    @Transactional
    public OrderResponse finishOrder(@NotNull Long orderId, @NotNull @Valid List<AssignmentTimeUpdate> timeUpdates) {
        RepairOrder order = orderStore.findForUpdate(orderId)
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, orderId));

        if (order.getStatus() == RepairStatus.COMPLETED) {
            throw new InvalidStateException(String.format("Repair order %d is already COMPLETED", orderId));
        }
        if (!order.getStatus().canTransitionTo(RepairStatus.COMPLETED)) {
            throw new InvalidStatusTransitionException(orderId, order.getStatus(), RepairStatus.COMPLETED);
        }

        for (AssignmentTimeUpdate update : timeUpdates) {
            RepairAssignment assignment = assignmentStore.find(update.getAssignmentId())
                    .filter(a -> a.getOrderId().equals(orderId))
                    .orElseThrow(() -> new RecordNotFoundException(String.format(
                            "Assignment %d not found on repair order %d", update.getAssignmentId(), orderId)));
            assignmentStore.applyUpdate(assignment, a -> a.setTimeWorked(update.getTimeWorked()));
        }

        RepairOrder completed = orderStore.applyUpdate(order, o -> {
            o.setStatus(RepairStatus.COMPLETED);
            o.setFinishTime(Timestamps.now(clock));
        });
        log.info("Repair order {} completed ({} assignment time updates)", orderId, timeUpdates.size());

        return mapper.toResponse(completed, assignmentStore.findByOrder(orderId));
    }
}
