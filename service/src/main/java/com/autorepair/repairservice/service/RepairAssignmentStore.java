package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairAssignment;
import com.autorepair.repairservice.repository.RepairAssignmentRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class RepairAssignmentStore extends AuditedEntityStore<RepairAssignment> {

    public static final String TABLE = "repair_assignment";

    private final RepairAssignmentRepository assignments;

    public RepairAssignmentStore(RepairAssignmentRepository repository, AuditStore auditStore,
                                 ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, RepairAssignment.class, TABLE);
        this.assignments = repository;
    }

    @Transactional(readOnly = true)
    public List<RepairAssignment> findByOrder(Long orderId) {
        return assignments.findAllByOrderIdOrderByIdAsc(orderId);
    }

    @Transactional(readOnly = true)
    public boolean hasLiveAssignment(Long orderId) {
        return assignments.existsByOrderIdAndStatusIn(orderId, AssignmentStatus.liveStatuses());
    }

    /**
     * Moves an assignment from {@code expected} to {@code target} only if it is still in
     * {@code expected}, and logs the change. Empty when another caller got there first.
     */
    @Transactional
    public Optional<RepairAssignment> transition(RepairAssignment current, AssignmentStatus expected,
                                                 AssignmentStatus target) {
        Map<String, Object> before = snapshot(current);
        int changed = assignments.compareAndSetStatus(current.getId(), expected, target);
        if (changed == 0) {
            return Optional.empty();
        }
        return Optional.of(recordUpdated(before, current.getId()));
    }
}
