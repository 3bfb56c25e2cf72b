package com.bomengine.controller;

import com.bomengine.dto.AvailabilityResult;
import com.bomengine.dto.BulkAvailabilityRequest;
import com.bomengine.dto.BulkAvailabilityResponse;
import com.bomengine.dto.ProductionCapacity;
import com.bomengine.dto.ProductionFeasibility;
import com.bomengine.service.BomCalculationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bom")
@RequiredArgsConstructor
public class BomCalculationController {

    private final BomCalculationService calculationService;

    @GetMapping("/products/{productId}/availability")
    public ResponseEntity<AvailabilityResult> availability(
            @PathVariable UUID tenantId, @PathVariable UUID productId) {
        return ResponseEntity.ok(calculationService.availability(tenantId, productId));
    }

    @PostMapping("/bulk-availability")
    public ResponseEntity<BulkAvailabilityResponse> bulkAvailability(
            @PathVariable UUID tenantId, @Valid @RequestBody BulkAvailabilityRequest request) {
        return ResponseEntity.ok(calculationService.bulkAvailability(tenantId, request.getProductIds()));
    }

    @GetMapping("/products/{productId}/production-capacity")
    public ResponseEntity<ProductionCapacity> productionCapacity(
            @PathVariable UUID tenantId, @PathVariable UUID productId) {
        return ResponseEntity.ok(calculationService.productionCapacity(tenantId, productId));
    }

    @GetMapping("/products/{productId}/feasibility")
    public ResponseEntity<ProductionFeasibility> feasibility(
            @PathVariable UUID tenantId,
            @PathVariable UUID productId,
            @RequestParam @Min(1) @Max(1_000_000) int quantity) {
        return ResponseEntity.ok(calculationService.feasibility(tenantId, productId, quantity));
    }
}
