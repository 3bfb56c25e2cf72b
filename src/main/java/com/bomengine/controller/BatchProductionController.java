package com.bomengine.controller;

import com.bomengine.dto.BatchRequirements;
import com.bomengine.dto.MultiProductPlan;
import com.bomengine.dto.MultiProductPlanRequest;
import com.bomengine.dto.OptimalBatchSize;
import com.bomengine.dto.OptimalBatchSizeRequest;
import com.bomengine.dto.ProductionItemRequest;
import com.bomengine.dto.ProductionSimulation;
import com.bomengine.service.BatchProductionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bom")
@RequiredArgsConstructor
public class BatchProductionController {

    private final BatchProductionService productionService;

    @PostMapping("/batch-requirements")
    public ResponseEntity<BatchRequirements> batchRequirements(
            @PathVariable UUID tenantId, @Valid @RequestBody ProductionItemRequest request) {
        return ResponseEntity.ok(productionService.batchRequirements(tenantId, request));
    }

    @PostMapping("/optimal-batch-size")
    public ResponseEntity<OptimalBatchSize> optimalBatchSize(
            @PathVariable UUID tenantId, @Valid @RequestBody OptimalBatchSizeRequest request) {
        return ResponseEntity.ok(productionService.optimalBatchSize(tenantId, request));
    }

    @PostMapping("/simulate-production")
    public ResponseEntity<ProductionSimulation> simulateProduction(
            @PathVariable UUID tenantId, @Valid @RequestBody ProductionItemRequest request) {
        return ResponseEntity.ok(productionService.simulate(tenantId, request));
    }

    @PostMapping("/multi-product-plan")
    public ResponseEntity<MultiProductPlan> multiProductPlan(
            @PathVariable UUID tenantId, @Valid @RequestBody MultiProductPlanRequest request) {
        return ResponseEntity.ok(productionService.multiProductPlan(tenantId, request));
    }
}
