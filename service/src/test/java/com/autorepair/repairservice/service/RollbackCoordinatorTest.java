package com.autorepair.repairservice.service;

import com.autorepair.repairservice.dto.RollbackResult;
import com.autorepair.repairservice.entity.AuditLogEntry;
import com.autorepair.repairservice.entity.AuditOperation;
import com.autorepair.repairservice.exception.InvalidStateException;
import com.autorepair.repairservice.exception.NoAuditHistoryException;
import com.autorepair.repairservice.exception.RecordNotFoundException;
import com.autorepair.repairservice.repository.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RollbackCoordinatorTest {

    @Mock private AuditLogRepository auditLogRepository;
    @Mock private AuditStore auditStore;
    @Mock private AuditedTable vehicles;
    @Mock private AuditedTable orders;

    private RollbackCoordinator coordinator;

    @BeforeEach
    void setUp() {
        when(vehicles.tableName()).thenReturn("vehicle");
        when(orders.tableName()).thenReturn("repair_order");
        coordinator = new RollbackCoordinator(auditLogRepository, auditStore, List.of(vehicles, orders));
    }

    private AuditLogEntry entry(long id, String table, long recordId, AuditOperation op, String oldData) {
        AuditLogEntry e = new AuditLogEntry();
        e.setId(id);
        e.setTableName(table);
        e.setRecordId(recordId);
        e.setOperation(op);
        e.setOldData(oldData);
        return e;
    }

    @Test
    void rollbackLast_insert_removesRecord() {
        when(auditLogRepository.findReversibleForRecord(eq("vehicle"), eq(7L), any()))
                .thenReturn(List.of(entry(30L, "vehicle", 7L, AuditOperation.INSERT, null)));

        RollbackResult result = coordinator.rollbackLast("vehicle", 7L);

        verify(vehicles).removeRecord(7L, 30L);
        assertThat(result.getRevertedLogId()).isEqualTo(30L);
        assertThat(result.getRevertedOperation()).isEqualTo(AuditOperation.INSERT);
    }

    @Test
    void rollbackLast_update_writesBackOldData() {
        Map<String, Object> old = Map.of("id", 5, "status", "PENDING");
        when(auditLogRepository.findReversibleForRecord(eq("repair_order"), eq(5L), any()))
                .thenReturn(List.of(entry(31L, "repair_order", 5L, AuditOperation.UPDATE, "{old}")));
        when(auditStore.readSnapshot("{old}")).thenReturn(old);

        coordinator.rollbackLast("repair_order", 5L);

        verify(orders).restoreRecord(5L, old, 31L);
        verify(vehicles, never()).restoreRecord(any(), any(), any());
        verify(vehicles, never()).removeRecord(any(), any());
    }

    @Test
    void rollbackLast_noHistory_throwsNoAuditHistory() {
        when(auditLogRepository.findReversibleForRecord(eq("vehicle"), eq(8L), any())).thenReturn(List.of());

        assertThatThrownBy(() -> coordinator.rollbackLast("vehicle", 8L))
                .isInstanceOf(NoAuditHistoryException.class);
    }

    @Test
    void rollbackMostRecent_delete_reinsertsOldData() {
        Map<String, Object> old = Map.of("id", 7, "licensePlate", "KA-7");
        when(auditLogRepository.findReversible(any()))
                .thenReturn(List.of(entry(40L, "vehicle", 7L, AuditOperation.DELETE, "{v}")));
        when(auditStore.readSnapshot("{v}")).thenReturn(old);

        RollbackResult result = coordinator.rollbackMostRecent();

        verify(vehicles).restoreRecord(7L, old, 40L);
        assertThat(result.getTableName()).isEqualTo("vehicle");
        assertThat(result.getMessage()).contains("Reverted DELETE of vehicle 7");
    }

    @Test
    void rollbackMostRecent_emptyLog_throwsNoAuditHistory() {
        when(auditLogRepository.findReversible(any())).thenReturn(List.of());

        assertThatThrownBy(() -> coordinator.rollbackMostRecent())
                .isInstanceOf(NoAuditHistoryException.class);
    }

    @Test
    void rollbackEntry_unknownLog_throwsNotFound() {
        when(auditLogRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator.rollbackEntry(99L))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void rollbackEntry_alreadyReversed_throwsInvalidState() {
        when(auditLogRepository.findById(30L))
                .thenReturn(Optional.of(entry(30L, "vehicle", 7L, AuditOperation.INSERT, null)));
        when(auditLogRepository.existsByRevertsLogId(30L)).thenReturn(true);

        assertThatThrownBy(() -> coordinator.rollbackEntry(30L))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("already been rolled back");
        verify(vehicles, never()).removeRecord(any(), any());
    }

    @Test
    void revert_unknownTable_throwsInvalidState() {
        when(auditLogRepository.findReversible(any()))
                .thenReturn(List.of(entry(50L, "invoice", 1L, AuditOperation.INSERT, null)));

        assertThatThrownBy(() -> coordinator.rollbackMostRecent())
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("invoice");
    }
}
