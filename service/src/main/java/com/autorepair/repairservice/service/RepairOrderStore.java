package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.repository.RepairOrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class RepairOrderStore extends AuditedEntityStore<RepairOrder> {

    public static final String TABLE = "repair_order";

    private final RepairOrderRepository orders;

    public RepairOrderStore(RepairOrderRepository repository, AuditStore auditStore,
                            ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, RepairOrder.class, TABLE);
        this.orders = repository;
    }

    /** Loads the order with a write lock held until the surrounding transaction ends. */
    public Optional<RepairOrder> findForUpdate(Long id) {
        return orders.findByIdForUpdate(id);
    }
}
