package com.bomengine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * A finished good together with its active recipe, if any. The recipe is
 * pre-fetched so calculations never reach back into persistence.
 */
@Value
@Builder
public class Product {
    UUID id;
    UUID tenantId;
    String name;
    String sku;

    @Builder.Default
    InventoryManagementType inventoryManagementType = InventoryManagementType.BOM;

    Recipe activeRecipe;

    public boolean isBomManaged() {
        return inventoryManagementType == InventoryManagementType.BOM;
    }
}
