package com.bomengine.repository;

import com.bomengine.entity.RecipeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface RecipeRepository extends JpaRepository<RecipeRecord, UUID> {

    @Query("""
        SELECT DISTINCT r FROM RecipeRecord r
        LEFT JOIN FETCH r.components c
        LEFT JOIN FETCH c.material
        WHERE r.tenantId = :tenantId
          AND r.active = true
        ORDER BY r.createdAt DESC
    """)
    List<RecipeRecord> findActiveWithComponents(@Param("tenantId") UUID tenantId);

    @Query("""
        SELECT DISTINCT r FROM RecipeRecord r
        LEFT JOIN FETCH r.components c
        LEFT JOIN FETCH c.material
        WHERE r.tenantId = :tenantId
          AND r.active = true
          AND r.productId IN :productIds
        ORDER BY r.createdAt DESC
    """)
    List<RecipeRecord> findActiveWithComponentsForProducts(
        @Param("tenantId") UUID tenantId, @Param("productIds") Collection<UUID> productIds);
}
