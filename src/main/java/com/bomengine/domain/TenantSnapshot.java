package com.bomengine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Everything the alert and report calculations need for one tenant, read in a single transaction.
 */
@Value
@Builder
public class TenantSnapshot {
    UUID tenantId;
    List<Product> products;
    List<Material> materials;
    List<Recipe> activeRecipes;
    List<InventoryTransaction> history;
    Instant asOf;
}
