package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.RepairRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Optional;

public interface RepairRequestRepository extends JpaRepository<RepairRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM RepairRequest r WHERE r.id = :id")
    Optional<RepairRequest> findByIdForUpdate(@Param("id") Long id);
}
