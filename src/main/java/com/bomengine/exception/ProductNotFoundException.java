package com.bomengine.exception;

import java.util.UUID;

public class ProductNotFoundException extends BomEngineException {
    public ProductNotFoundException(UUID productId) {
        super("PRODUCT_NOT_FOUND", "Product with id '" + productId + "' not found for this tenant.");
    }
}
