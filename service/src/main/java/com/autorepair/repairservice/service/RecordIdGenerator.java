package com.autorepair.repairservice.service;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands out identifiers for audited rows from the {@code record_id_seq} database sequence, so ids stay
 * unique across restarts and across service instances sharing the database. Restores reuse the
 * original id and never draw from the sequence.
 */
@Component
@RequiredArgsConstructor
public class RecordIdGenerator {

    static final String NEXT_ID_SQL = "SELECT nextval('record_id_seq')";

    private final JdbcTemplate jdbcTemplate;

    public long nextId() {
        Long id = jdbcTemplate.queryForObject(NEXT_ID_SQL, Long.class);
        if (id == null) {
            throw new IllegalStateException("record_id_seq returned no value");
        }
        return id;
    }
}
