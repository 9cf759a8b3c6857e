package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.Material;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface MaterialRepository extends JpaRepository<Material, Long> {

    List<Material> findAllByLogIdIn(Collection<Long> logIds);
}
