package com.bomengine.service;

import com.bomengine.domain.Product;
import com.bomengine.domain.ProductionRequest;
import com.bomengine.dto.BatchRequirements;
import com.bomengine.dto.MultiProductPlan;
import com.bomengine.dto.MultiProductPlanRequest;
import com.bomengine.dto.OptimalBatchSize;
import com.bomengine.dto.OptimalBatchSizeRequest;
import com.bomengine.dto.ProductionItemRequest;
import com.bomengine.dto.ProductionSimulation;
import com.bomengine.engine.BatchPlanner;
import com.bomengine.engine.MultiProductAllocator;
import com.bomengine.exception.ProductNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchProductionService {

    private final BomSnapshotService    snapshotService;
    private final BatchPlanner          batchPlanner;
    private final MultiProductAllocator allocator;

    public BatchRequirements batchRequirements(UUID tenantId, ProductionItemRequest request) {
        Product product = snapshotService.loadProduct(tenantId, request.getProductId());
        BatchRequirements requirements = batchPlanner.computeBatchRequirements(product, request.getQuantity());
        log.info("Batch requirements computed | tenantId={} | productId={} | quantity={} | canProduce={} | cost={}",
                 tenantId, product.getId(), request.getQuantity(), requirements.isCanProduce(),
                 requirements.getTotalMaterialCost());
        return requirements;
    }

    public OptimalBatchSize optimalBatchSize(UUID tenantId, OptimalBatchSizeRequest request) {
        Product product = snapshotService.loadProduct(tenantId, request.getProductId());
        OptimalBatchSize result = batchPlanner.computeOptimalBatchSize(
            product, request.getMinQuantity(), request.getMaxQuantity());
        log.info("Optimal batch size computed | tenantId={} | productId={} | maximum={} | options={}",
                 tenantId, product.getId(), result.getMaximumProducible(), result.getSuggestedBatches().size());
        return result;
    }

    public ProductionSimulation simulate(UUID tenantId, ProductionItemRequest request) {
        Product product = snapshotService.loadProduct(tenantId, request.getProductId());
        ProductionSimulation simulation = batchPlanner.simulateProduction(product, request.getQuantity());
        log.info("Production simulated | tenantId={} | productId={} | quantity={} | success={}",
                 tenantId, product.getId(), request.getQuantity(), simulation.isSuccess());
        return simulation;
    }

    /**
     * Every requested product must exist for the tenant; the plan is built from one snapshot.
     */
    public MultiProductPlan multiProductPlan(UUID tenantId, MultiProductPlanRequest request) {
        Set<UUID> ids = new LinkedHashSet<>();
        request.getProducts().forEach(item -> ids.add(item.getProductId()));
        Map<UUID, Product> products = snapshotService.loadProducts(tenantId, ids);

        List<ProductionRequest> requests = request.getProducts().stream()
            .map(item -> ProductionRequest.builder()
                .product(require(products, item.getProductId()))
                .quantity(item.getQuantity())
                .build())
            .toList();

        MultiProductPlan plan = allocator.planMultiProduct(requests);
        log.info("Multi-product plan computed | tenantId={} | products={} | feasible={} | shortages={} | cost={}",
                 tenantId, plan.getTotalProducts(), plan.isFeasible(), plan.getMaterialShortages().size(),
                 plan.getTotalProductionCost());
        return plan;
    }

    private static Product require(Map<UUID, Product> products, UUID productId) {
        Product product = products.get(productId);
        if (product == null) {
            throw new ProductNotFoundException(productId);
        }
        return product;
    }
}
