package com.autorepair.repairservice.scheduler;

import com.autorepair.repairservice.entity.AssignmentStatus;
import com.autorepair.repairservice.entity.RepairStatus;
import com.autorepair.repairservice.repository.RepairOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reports PENDING orders that have no pending or accepted assignment, typically because every
 * eligible staff member rejected them. Reporting only: reassignment is left to an operator.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.workers.unassigned-monitor.enabled", havingValue = "true", matchIfMissing = true)
public class UnassignedOrderMonitor {

    private final RepairOrderRepository orderRepository;

    @Value("${app.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${app.workers.unassigned-monitor.fixed-delay-ms:60000}")
    public void process() {
        Page<Long> page = orderRepository.findIdsWithoutLiveAssignment(
                RepairStatus.PENDING, AssignmentStatus.liveStatuses(), PageRequest.of(0, batchSize));

        if (page.isEmpty()) {
            log.debug("[UNASSIGNED-monitor] All pending orders have a live assignment");
            return;
        }

        List<Long> ids = page.getContent();
        log.warn("[UNASSIGNED-monitor] {} pending orders need manual assignment (showing {}): {}",
                page.getTotalElements(), ids.size(), ids);
    }
}
