package com.bomengine.repository;

import com.bomengine.entity.MaterialRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface MaterialRepository extends JpaRepository<MaterialRecord, UUID> {

    List<MaterialRecord> findByTenantIdOrderByNameAsc(UUID tenantId);
}
