package com.bomengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class MultiProductPlanRequest {

    @NotEmpty(message = "products must not be empty")
    @Size(max = 50, message = "products supports up to 50 entries")
    @Valid
    List<@Valid ProductionItemRequest> products;
}
