package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairOrder;
import com.autorepair.repairservice.entity.RepairStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.Optional;

public interface RepairOrderRepository extends JpaRepository<RepairOrder, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM RepairOrder o WHERE o.id = :id")
    Optional<RepairOrder> findByIdForUpdate(@Param("id") Long id);

    /** Orders in the given status that have no pending or accepted assignment. */
    @Query("""
            SELECT o.id FROM RepairOrder o
            WHERE o.status = :status
              AND NOT EXISTS (
                  SELECT a.id FROM RepairAssignment a
                  WHERE a.orderId = o.id
                    AND a.status IN :liveStatuses)
            ORDER BY o.orderTime ASC
            """)
    Page<Long> findIdsWithoutLiveAssignment(@Param("status") RepairStatus status,
                                            @Param("liveStatuses") Collection<AssignmentStatus> liveStatuses,
                                            Pageable pageable);
}
