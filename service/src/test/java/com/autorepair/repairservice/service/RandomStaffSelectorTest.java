package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.StaffCandidate;
import com.autorepair.repairservice.entity.StaffJobType;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomStaffSelectorTest {

    private final RandomStaffSelector selector = new RandomStaffSelector();

    @Test
    void select_alwaysReturnsOneOfTheCandidates() {
        List<StaffCandidate> eligible = List.of(
                new StaffCandidate(1L, "A", StaffJobType.WELDER, 30.0),
                new StaffCandidate(2L, "B", StaffJobType.WELDER, 35.0),
                new StaffCandidate(3L, "C", StaffJobType.WELDER, 40.0));

        Set<Long> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            StaffCandidate picked = selector.select(eligible);
            assertThat(eligible).contains(picked);
            seen.add(picked.getStaffId());
        }
        // 500 uniform draws over 3 candidates miss one with negligible probability
        assertThat(seen).containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    void select_singleCandidate_returnsIt() {
        StaffCandidate only = new StaffCandidate(7L, "Solo", StaffJobType.PAINT_WORKER, 25.0);

        assertThat(selector.select(List.of(only))).isSameAs(only);
    }

    @Test
    void select_emptyList_isRejected() {
        assertThatThrownBy(() -> selector.select(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
