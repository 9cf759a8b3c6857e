package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.OrderResponse;
import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.exception.InvalidStatusTransitionException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RepairOrderService {

    private final RepairOrderStore orderStore;
    private final RepairAssignmentStore assignmentStore;
    private final FeeCalculator feeCalculator;
    private final RepairMapper mapper;

    @Transactional(readOnly = true)
    public OrderResponse getOrder(Long orderId) {
        RepairOrder order = orderStore.find(orderId)
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, orderId));
        OrderResponse resp = mapper.toResponse(order, assignmentStore.findByOrder(orderId));
        resp.setFees(feeCalculator.breakdown(orderId));
        return resp;
    }

    /** Administrative cancellation of an order that is not yet completed or cancelled. */
    @Transactional
    public OrderResponse cancelOrder(Long orderId, String remarks) {
        RepairOrder order = orderStore.findForUpdate(orderId)
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, orderId));
        if (!order.getStatus().canTransitionTo(RepairStatus.CANCELLED)) {
            throw new InvalidStatusTransitionException(orderId, order.getStatus(), RepairStatus.CANCELLED);
        }

        RepairOrder cancelled = orderStore.applyUpdate(order, o -> {
            o.setStatus(RepairStatus.CANCELLED);
            if (remarks != null) {
                o.setRemarks(remarks);
            }
        });

        // Close the live assignment so it can no longer be answered against a cancelled order.
        // Accepting needs the order lock held here, so the only concurrent change is a rejection.
        int closed = 0;
        for (RepairAssignment assignment : assignmentStore.findByOrder(orderId)) {
            AssignmentStatus status = assignment.getStatus();
            if (status.isLive()
                    && assignmentStore.transition(assignment, status, AssignmentStatus.CANCELLED).isPresent()) {
                closed++;
            }
        }
        log.info("Repair order {} cancelled ({} live assignments closed)", orderId, closed);
        return mapper.toResponse(cancelled, assignmentStore.findByOrder(orderId));
    }
}
