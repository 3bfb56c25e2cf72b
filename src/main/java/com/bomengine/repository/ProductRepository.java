package com.bomengine.repository;

import com.bomengine.entity.ProductRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProductRepository extends JpaRepository<ProductRecord, UUID> {

    Optional<ProductRecord> findByIdAndTenantId(UUID id, UUID tenantId);

    List<ProductRecord> findByTenantIdAndIdIn(UUID tenantId, Collection<UUID> ids);

    List<ProductRecord> findByTenantIdOrderByNameAsc(UUID tenantId);
}
