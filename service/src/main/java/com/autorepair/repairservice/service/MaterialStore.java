package com.autorepair.repairservice.service;

import com.autorepair.repairservice.entity.Material;
import com.autorepair.repairservice.repository.MaterialRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Component
public class MaterialStore extends AuditedEntityStore<Material> {

    public static final String TABLE = "material";

    private final MaterialRepository materials;

    public MaterialStore(MaterialRepository repository, AuditStore auditStore,
                         ObjectMapper objectMapper, RecordIdGenerator idGenerator) {
        super(repository, auditStore, objectMapper, idGenerator, Material.class, TABLE);
        this.materials = repository;
    }

    @Transactional(readOnly = true)
    public List<Material> findByLogs(Collection<Long> logIds) {
        if (logIds.isEmpty()) {
            return List.of();
        }
        return materials.findAllByLogIdIn(logIds);
    }
}
