package com.bomengine.service;

import com.bomengine.domain.Product;
import com.bomengine.dto.AvailabilityResult;
import com.bomengine.dto.BulkAvailabilityResponse;
import com.bomengine.dto.ProductionCapacity;
import com.bomengine.dto.ProductionFeasibility;
import com.bomengine.engine.AvailabilityCalculator;
import com.bomengine.exception.BatchSizeExceededException;
import com.bomengine.exception.ProductNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Service
@RequiredArgsConstructor
public class BomCalculationService {

    private final BomSnapshotService     snapshotService;
    private final AvailabilityCalculator availabilityCalculator;

    @Value("${bom.bulk.pool-size:4}")
    private int poolSize;

    @Value("${bom.bulk.max-products:100}")
    private int maxProducts;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public AvailabilityResult availability(UUID tenantId, UUID productId) {
        Product product = snapshotService.loadProduct(tenantId, productId);
        AvailabilityResult result = availabilityCalculator.computeAvailableQuantity(product);
        log.info("Availability computed | tenantId={} | productId={} | available={} | bottleneck={}",
                 tenantId, productId, result.getAvailableQuantity(),
                 result.getBottleneckMaterial() != null ? result.getBottleneckMaterial().getMaterialName() : null);
        return result;
    }

    /**
     * Availability for many products at once. Duplicate ids are collapsed; unknown or
     * non-BOM products are reported on their own entry.
     */
    public BulkAvailabilityResponse bulkAvailability(UUID tenantId, List<UUID> productIds) {
        Set<UUID> distinct = new LinkedHashSet<>(productIds);
        if (distinct.size() > maxProducts) {
            throw new BatchSizeExceededException(distinct.size(), maxProducts);
        }

        Map<UUID, Product> found = snapshotService.loadProducts(tenantId, distinct);
        List<Product> products = new ArrayList<>();
        for (UUID id : distinct) {
            Product product = found.get(id);
            if (product != null) {
                products.add(product);
            }
        }

        Map<UUID, BulkAvailabilityResponse.Entry> computed = new LinkedHashMap<>();
        for (BulkAvailabilityResponse.Entry entry : availabilityCalculator.computeBulkAvailability(products, executor)) {
            computed.put(entry.getProductId(), entry);
        }

        Map<UUID, BulkAvailabilityResponse.Entry> results = new LinkedHashMap<>();
        for (UUID id : distinct) {
            BulkAvailabilityResponse.Entry entry = computed.get(id);
            results.put(id, entry != null ? entry : missingEntry(id));
        }
        int failures = (int) results.values().stream().filter(BulkAvailabilityResponse.Entry::isFailed).count();

        log.info("Bulk availability computed | tenantId={} | products={} | failures={}",
                 tenantId, results.size(), failures);
        return BulkAvailabilityResponse.builder()
            .itemCount(results.size())
            .failureCount(failures)
            .results(results)
            .build();
    }

    public ProductionCapacity productionCapacity(UUID tenantId, UUID productId) {
        Product product = snapshotService.loadProduct(tenantId, productId);
        ProductionCapacity capacity = availabilityCalculator.computeProductionCapacity(product);
        log.info("Production capacity computed | tenantId={} | productId={} | available={} | status={}",
                 tenantId, productId, capacity.getAvailableQuantity(), capacity.getStockStatus());
        return capacity;
    }

    public ProductionFeasibility feasibility(UUID tenantId, UUID productId, int quantity) {
        Product product = snapshotService.loadProduct(tenantId, productId);
        ProductionFeasibility feasibility = availabilityCalculator.checkProductionFeasibility(product, quantity);
        log.info("Feasibility checked | tenantId={} | productId={} | requested={} | feasible={}",
                 tenantId, productId, quantity, feasibility.isFeasible());
        return feasibility;
    }

    Executor executor() {
        return executor;
    }

    private BulkAvailabilityResponse.Entry missingEntry(UUID productId) {
        return BulkAvailabilityResponse.Entry.builder()
            .productId(productId)
            .availableQuantity(0)
            .canProduce(false)
            .error(new ProductNotFoundException(productId).getMessage())
            .build();
    }
}
