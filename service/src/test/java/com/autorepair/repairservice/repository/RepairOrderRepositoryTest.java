package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(LiquibaseAutoConfiguration.class)
class RepairOrderRepositoryTest {

    @Autowired private RepairOrderRepository orderRepository;
    @Autowired private RepairAssignmentRepository assignmentRepository;

    @BeforeEach
    void cleanUp() {
        assignmentRepository.deleteAll();
        orderRepository.deleteAll();
    }

    private RepairOrder order(long id, RepairStatus status) {
        RepairOrder o = new RepairOrder();
        o.setId(id);
        o.setVehicleId(1L);
        o.setCustomerId(1L);
        o.setRequestId(id);
        o.setRequiredStaffType(StaffJobType.WELDER);
        o.setStatus(status);
        o.setOrderTime(OffsetDateTime.now());
        return orderRepository.saveAndFlush(o);
    }

    private RepairAssignment assignment(long id, long orderId, long staffId, AssignmentStatus status) {
        RepairAssignment a = new RepairAssignment();
        a.setId(id);
        a.setOrderId(orderId);
        a.setStaffId(staffId);
        a.setStatus(status);
        return assignmentRepository.saveAndFlush(a);
    }

    @Test
    void findIdsWithoutLiveAssignment_returnsOnlyOrphanedPendingOrders() {
        order(1L, RepairStatus.PENDING);
        order(2L, RepairStatus.PENDING);
        order(3L, RepairStatus.PENDING);
        order(4L, RepairStatus.CANCELLED);
        assignment(10L, 1L, 7L, AssignmentStatus.REJECTED);
        assignment(11L, 2L, 7L, AssignmentStatus.PENDING);

        Page<Long> ids = orderRepository.findIdsWithoutLiveAssignment(
                RepairStatus.PENDING, AssignmentStatus.liveStatuses(), PageRequest.of(0, 10));

        assertThat(ids.getContent()).containsExactlyInAnyOrder(1L, 3L);
    }

    @Test
    void compareAndSetStatus_onlyChangesExpectedStatus() {
        order(1L, RepairStatus.PENDING);
        assignment(10L, 1L, 7L, AssignmentStatus.PENDING);

        int first = assignmentRepository.compareAndSetStatus(10L, AssignmentStatus.PENDING, AssignmentStatus.ACCEPTED);
        int second = assignmentRepository.compareAndSetStatus(10L, AssignmentStatus.PENDING, AssignmentStatus.REJECTED);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(assignmentRepository.findById(10L).orElseThrow().getStatus()).isEqualTo(AssignmentStatus.ACCEPTED);
    }

    @Test
    void liveAssignmentQueries_ignoreRejected() {
        order(1L, RepairStatus.PENDING);
        assignment(10L, 1L, 7L, AssignmentStatus.REJECTED);
        assignment(11L, 1L, 8L, AssignmentStatus.ACCEPTED);

        assertThat(assignmentRepository.existsByOrderIdAndStatusIn(1L, AssignmentStatus.liveStatuses())).isTrue();
        assertThat(assignmentRepository.countByStaffIdAndStatusIn(7L, AssignmentStatus.liveStatuses())).isZero();
        assertThat(assignmentRepository.countByStaffIdAndStatusIn(8L, AssignmentStatus.liveStatuses())).isEqualTo(1);
        assertThat(assignmentRepository.existsByOrderIdAndStaffIdAndStatus(1L, 8L, AssignmentStatus.ACCEPTED)).isTrue();
    }
}
