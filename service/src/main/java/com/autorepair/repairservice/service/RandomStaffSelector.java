package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Uniform random choice. Current workload is not taken into account. */
@Component
@ConditionalOnProperty(name = "app.assignment.selection-strategy", havingValue = "random", matchIfMissing = true)
public class RandomStaffSelector implements StaffSelector {

    @Override
    public StaffCandidate select(List<StaffCandidate> eligible) {
        if (eligible.isEmpty()) {
            throw new IllegalArgumentException("eligible staff must not be empty");
        }
        return eligible.get(ThreadLocalRandom.current().nextInt(eligible.size()));
    }
}
