package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.MaterialLine;
import com.autorepair.repairservice.dto.RepairLogResponse;
import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.Material;
import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.exception.ForbiddenOperationException;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import com.autorepair.repairservice.repository.RepairAssignmentRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/** Progress entries written by the staff member working an order, with the materials they used. */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class RepairLogService {

    private final RepairOrderStore orderStore;
    private final RepairLogStore logStore;
    private final MaterialStore materialStore;
    private final RepairAssignmentRepository assignmentRepository;
    private final RepairMapper mapper;
    private final Clock clock;

    @Transactional
    public RepairLogResponse addLog(Long orderId, Long staffId, @NotBlank String message,
                                    @Valid List<MaterialLine> materials) {
        RepairOrder order = orderStore.find(orderId)
                .orElseThrow(() -> new RecordNotFoundException(RepairOrderStore.TABLE, orderId));
        if (order.getStatus() != RepairStatus.IN_PROGRESS) {
            throw new InvalidStateException(String.format(
                    "Repair order %d is in status %s, expected IN_PROGRESS", orderId, order.getStatus()));
        }
        if (!assignmentRepository.existsByOrderIdAndStaffIdAndStatus(orderId, staffId, AssignmentStatus.ACCEPTED)) {
            throw new ForbiddenOperationException(String.format(
                    "Staff %d holds no accepted assignment on repair order %d", staffId, orderId));
        }

        RepairLog entry = new RepairLog();
        entry.setOrderId(orderId);
        entry.setStaffId(staffId);
        entry.setLogTime(Timestamps.now(clock));
        entry.setLogMessage(message);
        RepairLog saved = logStore.insert(entry);

        List<Material> savedMaterials = new ArrayList<>(materials.size());
        for (MaterialLine line : materials) {
            Material material = new Material();
            material.setLogId(saved.getId());
            material.setName(line.getName());
            material.setQuantity(line.getQuantity());
            material.setUnitPrice(line.getUnitPrice());
            material.setRemarks(line.getRemarks());
            savedMaterials.add(materialStore.insert(material));
        }

        log.info("Repair log {} added to order {} by staff {} ({} materials)",
                saved.getId(), orderId, staffId, savedMaterials.size());
        return mapper.toResponse(saved, savedMaterials);
    }
}
