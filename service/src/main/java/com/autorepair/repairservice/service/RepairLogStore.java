package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.RepairLog;
import com.autorepair.repairservice.repository.RepairLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
public class RepairLogStore extends AuditedEntityStore<RepairLog> {

    public static final String TABLE = "repair_log";

    private final RepairLogRepository logs;

    public RepairLogStore(RepairLogRepository repository, AuditStore auditStore,
                          ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, RepairLog.class, TABLE);
        this.logs = repository;
    }

    @Transactional(readOnly = true)
    public List<RepairLog> findByOrder(Long orderId) {
        return logs.findAllByOrderIdOrderByLogTimeAsc(orderId);
    }
}
