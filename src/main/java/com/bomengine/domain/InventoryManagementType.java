package com.bomengine.domain;

public enum InventoryManagementType {
    SIMPLE,
    BOM
}
