package com.bomengine.repository;

import com.bomengine.entity.InventoryTransactionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface InventoryTransactionRepository extends JpaRepository<InventoryTransactionRecord, UUID> {

    List<InventoryTransactionRecord> findByTenantIdAndCreatedAtBetweenOrderByCreatedAtAsc(
        UUID tenantId, Instant from, Instant to);
}
