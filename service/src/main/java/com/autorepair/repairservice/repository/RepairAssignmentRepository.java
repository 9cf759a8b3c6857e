package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface RepairAssignmentRepository extends JpaRepository<RepairAssignment, Long> {

    List<RepairAssignment> findAllByOrderIdOrderByIdAsc(Long orderId);

    boolean existsByOrderIdAndStatusIn(Long orderId, Collection<AssignmentStatus> statuses);

    boolean existsByOrderIdAndStaffIdAndStatus(Long orderId, Long staffId, AssignmentStatus status);

    long countByStaffIdAndStatusIn(Long staffId, Collection<AssignmentStatus> statuses);

    /**
     * Compare-and-set on the assignment status. Returns the number of rows changed: zero when the
     * row is gone or no longer in {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RepairAssignment a SET a.status = :target WHERE a.id = :id AND a.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") AssignmentStatus expected,
                            @Param("target") AssignmentStatus target);
}
