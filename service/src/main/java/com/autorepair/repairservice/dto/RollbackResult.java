package com.autorepair.repairservice.dto;

import com.autorepair.repairservice.entity.AuditOperation;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RollbackResult {
    private Long revertedLogId;
    private String tableName;
    private Long recordId;
    private AuditOperation revertedOperation;
    private String message;
}
