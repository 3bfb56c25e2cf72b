package com.bomengine.entity;

import com.bomengine.domain.InventoryManagementType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(
    name = "products",
    indexes = {
        @Index(name = "idx_product_tenant", columnList = "tenant_id"),
        @Index(name = "idx_product_sku",    columnList = "tenant_id, sku"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductRecord {

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

    @Enumerated(EnumType.STRING)
    @Column(name = "inventory_management_type", nullable = false, length = 20)
    private InventoryManagementType inventoryManagementType;
}
