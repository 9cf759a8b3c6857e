package com.autorepair.repairservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "material")
@Getter
@Setter
public class Material implements AuditedRecord {

    @Id
    @Column(name = "material_id")
    private Long id;

    @Column(name = "log_id", nullable = false)
    private Long logId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private double quantity;

    @Column(name = "unit_price", nullable = false)
    private double unitPrice;

    @Column(length = 500)
    private String remarks;

    @JsonIgnore
    public double getTotalPrice() {
        return quantity * unitPrice;
    }
}
