package com.bomengine.engine;

import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.domain.RecipeComponent;
import com.bomengine.dto.AvailabilityResult;
import com.bomengine.dto.BottleneckMaterial;
import com.bomengine.dto.BulkAvailabilityResponse;
import com.bomengine.dto.ProductionCapacity;
import com.bomengine.dto.ProductionFeasibility;
import com.bomengine.dto.ProductionStockStatus;
import com.bomengine.exception.NotBomManagedException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * BOM explosion: how many units of a product the current material stock allows,
 * and which material binds first.
 */
@Component
public class AvailabilityCalculator {

    private static final String DEFAULT_UNIT = "pcs";

    public AvailabilityResult computeAvailableQuantity(Product product) {
        requireBomManaged(product);

        Recipe recipe = product.getActiveRecipe();
        if (recipe == null) {
            return emptyResult(product, null, "No active recipe found for this product");
        }
        if (recipe.getComponents().isEmpty()) {
            return emptyResult(product, recipe, "No materials defined in recipe");
        }

        List<Candidate> candidates = new ArrayList<>();
        for (RecipeComponent component : recipe.getComponents()) {
            BigDecimal effective = component.getEffectiveQuantity();
            if (effective.signum() <= 0) {
                candidates.add(new Candidate(component, effective, null));
                continue;
            }
            int maxUnits = stockOf(component)
                .divide(effective, 0, RoundingMode.FLOOR)
                .max(BigDecimal.ZERO)
                .min(BigDecimal.valueOf(Integer.MAX_VALUE))
                .intValue();
            candidates.add(new Candidate(component, effective, maxUnits));
        }

        Candidate bottleneck = candidates.stream()
            .filter(Candidate::constraining)
            .min(Comparator.comparingInt(Candidate::maxUnitsOrZero)
                .thenComparing(c -> c.component().getMaterialId().toString()))
            .orElse(null);
        int available = bottleneck != null ? Math.max(0, bottleneck.maxUnits()) : 0;

        List<AvailabilityResult.ComponentStatus> statuses = candidates.stream()
            .map(c -> toStatus(c, bottleneck != null && c.constraining() && c.maxUnits() == available))
            .toList();

        return AvailabilityResult.builder()
            .productId(product.getId())
            .productName(product.getName())
            .recipeId(recipe.getId())
            .recipeName(recipe.getName())
            .availableQuantity(available)
            .canProduce(available > 0)
            .bottleneckMaterial(bottleneck != null ? toBottleneck(bottleneck) : null)
            .components(statuses)
            .yieldQuantity(recipe.getYieldQuantity())
            .yieldUnit(recipe.getYieldUnit())
            .message(bottleneck == null ? "No constraining materials in recipe" : null)
            .build();
    }

    /**
     * Runs {@link #computeAvailableQuantity(Product)} for every product on the given executor.
     * Entries come back in input order; a failing product only marks its own entry.
     */
    public List<BulkAvailabilityResponse.Entry> computeBulkAvailability(List<Product> products, Executor executor) {
        List<CompletableFuture<BulkAvailabilityResponse.Entry>> futures = products.stream()
            .map(product -> CompletableFuture.supplyAsync(() -> bulkEntry(product), executor))
            .toList();
        return futures.stream()
            .map(CompletableFuture::join)
            .toList();
    }

    public ProductionCapacity computeProductionCapacity(Product product) {
        AvailabilityResult availability = computeAvailableQuantity(product);
        Recipe recipe = product.getActiveRecipe();
        return ProductionCapacity.builder()
            .productId(product.getId())
            .productName(product.getName())
            .availableQuantity(availability.getAvailableQuantity())
            .canProduce(availability.getAvailableQuantity() > 0)
            .stockStatus(toStockStatus(availability.getAvailableQuantity()))
            .unit(recipe != null ? recipe.getYieldUnit() : DEFAULT_UNIT)
            .recipeId(recipe != null ? recipe.getId() : null)
            .bottleneckMaterial(availability.getBottleneckMaterial())
            .componentsStatus(availability.getComponents())
            .build();
    }

    public ProductionFeasibility checkProductionFeasibility(Product product, int requestedQuantity) {
        AvailabilityResult availability = computeAvailableQuantity(product);
        int available = availability.getAvailableQuantity();
        boolean feasible = available >= requestedQuantity;
        return ProductionFeasibility.builder()
            .productId(product.getId())
            .productName(product.getName())
            .recipeId(availability.getRecipeId())
            .requestedQuantity(requestedQuantity)
            .availableQuantity(available)
            .feasible(feasible)
            .shortage(feasible ? 0 : requestedQuantity - available)
            .bottleneckMaterial(availability.getBottleneckMaterial())
            .build();
    }

    ProductionStockStatus toStockStatus(int availableQuantity) {
        if (availableQuantity <= 0) {
            return ProductionStockStatus.OUT_OF_STOCK;
        }
        if (availableQuantity < 10) {
            return ProductionStockStatus.LOW_STOCK;
        }
        if (availableQuantity < 50) {
            return ProductionStockStatus.MODERATE_STOCK;
        }
        return ProductionStockStatus.IN_STOCK;
    }

    static void requireBomManaged(Product product) {
        if (!product.isBomManaged()) {
            throw new NotBomManagedException(product.getName(), product.getInventoryManagementType());
        }
    }

    static BigDecimal stockOf(RecipeComponent component) {
        Material material = component.getMaterial();
        return material != null && material.getStockQuantity() != null
            ? material.getStockQuantity()
            : BigDecimal.ZERO;
    }

    private BulkAvailabilityResponse.Entry bulkEntry(Product product) {
        try {
            AvailabilityResult result = computeAvailableQuantity(product);
            return BulkAvailabilityResponse.Entry.builder()
                .productId(product.getId())
                .productName(product.getName())
                .availableQuantity(result.getAvailableQuantity())
                .canProduce(result.isCanProduce())
                .availability(result)
                .build();
        } catch (RuntimeException ex) {
            return BulkAvailabilityResponse.Entry.builder()
                .productId(product.getId())
                .productName(product.getName())
                .availableQuantity(0)
                .canProduce(false)
                .error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName())
                .build();
        }
    }

    private AvailabilityResult emptyResult(Product product, Recipe recipe, String message) {
        return AvailabilityResult.builder()
            .productId(product.getId())
            .productName(product.getName())
            .recipeId(recipe != null ? recipe.getId() : null)
            .recipeName(recipe != null ? recipe.getName() : null)
            .availableQuantity(0)
            .canProduce(false)
            .components(List.of())
            .yieldQuantity(recipe != null ? recipe.getYieldQuantity() : null)
            .yieldUnit(recipe != null ? recipe.getYieldUnit() : null)
            .message(message)
            .build();
    }

    private AvailabilityResult.ComponentStatus toStatus(Candidate candidate, boolean limiting) {
        RecipeComponent component = candidate.component();
        Material material = component.getMaterial();
        BigDecimal stock = stockOf(component);
        return AvailabilityResult.ComponentStatus.builder()
            .materialId(component.getMaterialId())
            .materialName(material != null ? material.getName() : null)
            .unit(material != null ? material.getUnit() : null)
            .quantityRequired(component.getQuantityRequired())
            .wastePercentage(component.getWastePercentage())
            .effectiveQuantity(candidate.effective())
            .availableStock(stock)
            .sufficient(stock.compareTo(candidate.effective()) >= 0)
            .maxProducible(candidate.maxUnits())
            .constraining(candidate.constraining())
            .limiting(limiting)
            .build();
    }

    private BottleneckMaterial toBottleneck(Candidate candidate) {
        RecipeComponent component = candidate.component();
        Material material = component.getMaterial();
        return BottleneckMaterial.builder()
            .materialId(component.getMaterialId())
            .materialName(material != null ? material.getName() : null)
            .unit(material != null ? material.getUnit() : null)
            .requiredPerUnit(candidate.effective())
            .availableStock(stockOf(component))
            .maxUnits(candidate.maxUnits())
            .build();
    }

    private record Candidate(RecipeComponent component, BigDecimal effective, Integer maxUnits) {
        boolean constraining() {
            return maxUnits != null;
        }

        int maxUnitsOrZero() {
            return maxUnits != null ? maxUnits : 0;
        }
    }
}
