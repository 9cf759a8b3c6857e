package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.RepairRequest;
import com.autorepair.repairservice.repository.RepairRequestRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class RepairRequestStore extends AuditedEntityStore<RepairRequest> {

    public static final String TABLE = "repair_request";

    private final RepairRequestRepository requests;

    public RepairRequestStore(RepairRequestRepository repository, AuditStore auditStore,
                              ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, RepairRequest.class, TABLE);
        this.requests = repository;
    }

    public Optional<RepairRequest> findForUpdate(Long id) {
        return requests.findByIdForUpdate(id);
    }
}
