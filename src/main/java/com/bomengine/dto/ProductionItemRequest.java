package com.bomengine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class ProductionItemRequest {

    @NotNull(message = "productId is required")
    UUID productId;

    @Min(value = 1, message = "quantity must be >= 1")
    @Max(value = 1_000_000, message = "quantity must be <= 1000000")
    int quantity;
}
