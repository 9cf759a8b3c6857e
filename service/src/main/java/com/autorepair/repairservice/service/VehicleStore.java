package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.Vehicle;
import com.autorepair.repairservice.repository.VehicleRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class VehicleStore extends AuditedEntityStore<Vehicle> {

    public static final String TABLE = "vehicle";

    public VehicleStore(VehicleRepository repository, AuditStore auditStore,
                        ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, Vehicle.class, TABLE);
    }
}
