package com.bomengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(
    name = "materials",
    indexes = {
        @Index(name = "idx_material_tenant",   columnList = "tenant_id"),
        @Index(name = "idx_material_category", columnList = "tenant_id, category"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaterialRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(nullable = false)
    private String name;

    @Column(length = 100)
    private String sku;

    @Column(length = 100)
    private String category;

    private String supplier;

    @Column(nullable = false, length = 20)
    private String unit;

    @Column(name = "stock_quantity", nullable = false, precision = 15, scale = 4)
    private BigDecimal stockQuantity;

    @Column(name = "reorder_level", nullable = false, precision = 15, scale = 4)
    private BigDecimal reorderLevel;

    @Column(name = "unit_cost", precision = 15, scale = 4)
    private BigDecimal unitCost;
}
