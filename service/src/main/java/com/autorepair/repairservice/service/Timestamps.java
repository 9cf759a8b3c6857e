package com.autorepair.repairservice.service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

final class Timestamps {

    private Timestamps() {
    }

    // Truncated to what timestamptz stores, so a snapshot taken before a flush matches the row read back.
    static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
