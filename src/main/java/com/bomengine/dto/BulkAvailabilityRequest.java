package com.bomengine.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class BulkAvailabilityRequest {

    @NotEmpty(message = "productIds must not be empty")
    @Size(max = 100, message = "productIds supports up to 100 values")
    List<@NotNull(message = "productIds must not contain null") UUID> productIds;
}
