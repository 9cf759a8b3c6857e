package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.RepairLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RepairLogRepository extends JpaRepository<RepairLog, Long> {

    List<RepairLog> findAllByOrderIdOrderByLogTimeAsc(Long orderId);
}
