package com.bomengine.exception;

import com.bomengine.domain.InventoryManagementType;

public class NotBomManagedException extends BomEngineException {
    public NotBomManagedException(String productName, InventoryManagementType actual) {
        super("NOT_BOM_MANAGED",
              "Product '" + productName + "' does not use BOM inventory management. Current type: "
                  + (actual != null ? actual.name().toLowerCase() : "simple"));
    }
}
