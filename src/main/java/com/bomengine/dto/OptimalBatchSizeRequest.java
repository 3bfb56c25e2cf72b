package com.bomengine.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class OptimalBatchSizeRequest {

    @NotNull(message = "productId is required")
    UUID productId;

    @Min(value = 1, message = "minQuantity must be >= 1")
    Integer minQuantity;

    @Min(value = 1, message = "maxQuantity must be >= 1")
    Integer maxQuantity;
}
