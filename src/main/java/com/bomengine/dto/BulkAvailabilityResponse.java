package com.bomengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class BulkAvailabilityResponse {
    int itemCount;
    int failureCount;
    Map<UUID, Entry> results;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        UUID productId;
        String productName;
        int availableQuantity;
        boolean canProduce;
        AvailabilityResult availability;
        String error;

        public boolean isFailed() {
            return error != null;
        }
    }
}
