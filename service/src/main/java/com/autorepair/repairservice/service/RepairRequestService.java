package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.OrderResponse;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairRequest;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.entity.RequestStatus;
import com.autorepair.repairservice.entity.StaffJobType;
import com.autorepair.repairservice.entity.Vehicle;
import com.autorepair.repairservice.exception.ForbiddenOperationException;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/** Customer repair requests and their conversion into repair orders. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepairRequestService {

    private final RepairRequestStore requestStore;
    private final RepairOrderStore orderStore;
    private final VehicleStore vehicleStore;
    private final RepairMapper mapper;
    private final Clock clock;

    @Transactional
    public RepairRequest fileRequest(Long customerId, Long vehicleId, String description) {
        Vehicle vehicle = vehicleStore.find(vehicleId)
                .orElseThrow(() -> new RecordNotFoundException(VehicleStore.TABLE, vehicleId));
        if (!vehicle.getCustomerId().equals(customerId)) {
            throw new ForbiddenOperationException(String.format(
                    "Vehicle %d does not belong to customer %d", vehicleId, customerId));
        }

        RepairRequest request = new RepairRequest();
        request.setVehicleId(vehicleId);
        request.setCustomerId(customerId);
        request.setDescription(description);
        request.setStatus(RequestStatus.PENDING);
        request.setRequestTime(Timestamps.now(clock));

        RepairRequest saved = requestStore.insert(request);
        log.info("Repair request filed: id={}, vehicle={}, customer={}", saved.getId(), vehicleId, customerId);
        return saved;
    }

    /** Turns a pending request into a PENDING repair order and marks the request as converted. */
    @Transactional
    public OrderResponse convertToOrder(Long requestId, StaffJobType requiredStaffType, String remarks) {
        RepairRequest request = requestStore.findForUpdate(requestId)
                .orElseThrow(() -> new RecordNotFoundException(RepairRequestStore.TABLE, requestId));
        if (request.getStatus() != RequestStatus.PENDING) {
            throw new InvalidStateException(String.format(
                    "Repair request %d is in status %s, expected PENDING", requestId, request.getStatus()));
        }

        RepairOrder order = new RepairOrder();
        order.setVehicleId(request.getVehicleId());
        order.setCustomerId(request.getCustomerId());
        order.setRequestId(requestId);
        order.setRequiredStaffType(requiredStaffType);
        order.setStatus(RepairStatus.PENDING);
        order.setOrderTime(Timestamps.now(clock));
        order.setRemarks(remarks);
        RepairOrder saved = orderStore.insert(order);

        requestStore.applyUpdate(request, r -> r.setStatus(RequestStatus.ORDER_CREATED));

        log.info("Repair request {} converted to order {} (requires {})", requestId, saved.getId(), requiredStaffType);
        return mapper.toResponse(saved, List.of());
    }
}
