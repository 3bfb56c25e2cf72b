package com.bomengine.entity;

import com.bomengine.domain.TransactionType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only stock movement written by the inventory subsystem. Read here as usage history.
 */
@Entity
@Table(
    name = "inventory_transactions",
    indexes = {
        @Index(name = "idx_tx_tenant_created", columnList = "tenant_id, created_at"),
        @Index(name = "idx_tx_material",       columnList = "material_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryTransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "material_id", nullable = false)
    private UUID materialId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionType type;

    @Column(name = "quantity_change", nullable = false, precision = 15, scale = 4)
    private BigDecimal quantityChange;

    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
