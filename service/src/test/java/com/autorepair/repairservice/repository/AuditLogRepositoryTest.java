package com.autorepair.repairservice.repository;

import com.autorepair.repairservice.entity.AuditLogEntry;
import com.autorepair.repairservice.entity.AuditOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(LiquibaseAutoConfiguration.class)
class AuditLogRepositoryTest {

    @Autowired private AuditLogRepository auditLogRepository;

    @BeforeEach
    void cleanUp() {
        auditLogRepository.deleteAll();
    }

    private AuditLogEntry save(String table, long recordId, AuditOperation op, Long revertsLogId) {
        AuditLogEntry e = new AuditLogEntry();
        e.setTableName(table);
        e.setRecordId(recordId);
        e.setOperation(op);
        e.setNewData(op == AuditOperation.DELETE ? null : "{\"id\":" + recordId + "}");
        e.setOperatedAt(OffsetDateTime.now());
        e.setRevertsLogId(revertsLogId);
        return auditLogRepository.saveAndFlush(e);
    }

    @Test
    void findReversibleForRecord_skipsRollbacksAndReversedEntries() {
        AuditLogEntry insert = save("vehicle", 7L, AuditOperation.INSERT, null);
        AuditLogEntry update = save("vehicle", 7L, AuditOperation.UPDATE, null);
        save("vehicle", 7L, AuditOperation.UPDATE, update.getId());
        save("vehicle", 8L, AuditOperation.INSERT, null);

        List<AuditLogEntry> found = auditLogRepository.findReversibleForRecord("vehicle", 7L, PageRequest.of(0, 5));

        assertThat(found).extracting(AuditLogEntry::getId).containsExactly(insert.getId());
    }

    @Test
    void findReversible_newestFirstAcrossTables() {
        save("vehicle", 1L, AuditOperation.INSERT, null);
        AuditLogEntry order = save("repair_order", 2L, AuditOperation.INSERT, null);

        List<AuditLogEntry> newest = auditLogRepository.findReversible(PageRequest.of(0, 1));

        assertThat(newest).extracting(AuditLogEntry::getId).containsExactly(order.getId());
    }

    @Test
    void specifications_filterByTableAndOperation() {
        save("vehicle", 1L, AuditOperation.INSERT, null);
        save("vehicle", 1L, AuditOperation.DELETE, null);
        save("material", 3L, AuditOperation.INSERT, null);

        List<AuditLogEntry> inserts = auditLogRepository.findAll(
                Specification.where(AuditLogSpecification.hasTable("vehicle"))
                        .and(AuditLogSpecification.hasOperation(AuditOperation.INSERT)),
                Sort.by("id"));
        List<AuditLogEntry> all = auditLogRepository.findAll(
                Specification.where(AuditLogSpecification.hasTable(null))
                        .and(AuditLogSpecification.hasRecordId(1L)));

        assertThat(inserts).hasSize(1);
        assertThat(inserts.get(0).getRecordId()).isEqualTo(1L);
        assertThat(all).hasSize(2);
    }

    @Test
    void existsByRevertsLogId_tracksReversal() {
        AuditLogEntry insert = save("vehicle", 9L, AuditOperation.INSERT, null);
        assertThat(auditLogRepository.existsByRevertsLogId(insert.getId())).isFalse();

        save("vehicle", 9L, AuditOperation.DELETE, insert.getId());

        assertThat(auditLogRepository.existsByRevertsLogId(insert.getId())).isTrue();
        assertThat(auditLogRepository.countByTableNameAndRecordId("vehicle", 9L)).isEqualTo(2);
    }
}
