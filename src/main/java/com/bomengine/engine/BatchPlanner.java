package com.bomengine.engine;

import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.domain.RecipeComponent;
import com.bomengine.dto.AvailabilityResult;
import com.bomengine.dto.BatchRequirements;
import com.bomengine.dto.MaterialShortage;
import com.bomengine.dto.OptimalBatchSize;
import com.bomengine.dto.ProductionSimulation;
import com.bomengine.exception.PlanningInputException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

@Component
@RequiredArgsConstructor
public class BatchPlanner {

    private static final int[] STANDARD_BATCH_SIZES = {10, 25, 50, 100, 200, 500};

    private final AvailabilityCalculator availabilityCalculator;

    public BatchRequirements computeBatchRequirements(Product product, int quantity) {
        AvailabilityCalculator.requireBomManaged(product);
        if (quantity <= 0) {
            throw new PlanningInputException("quantity must be greater than 0");
        }

        Recipe recipe = product.getActiveRecipe();
        if (recipe == null || recipe.getComponents().isEmpty()) {
            return BatchRequirements.builder()
                .productId(product.getId())
                .productName(product.getName())
                .recipeId(recipe != null ? recipe.getId() : null)
                .recipeName(recipe != null ? recipe.getName() : null)
                .requestedQuantity(quantity)
                .canProduce(false)
                .materialRequirements(List.of())
                .shortages(List.of())
                .totalMaterialCost(money(BigDecimal.ZERO))
                .costPerUnit(money(BigDecimal.ZERO))
                .build();
        }

        BigDecimal batch = BigDecimal.valueOf(quantity);
        List<BatchRequirements.MaterialRequirement> requirements = new ArrayList<>();
        List<MaterialShortage> shortages = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;
        boolean canProduce = true;

        for (RecipeComponent component : recipe.getComponents()) {
            Material material = component.getMaterial();
            BigDecimal effective = component.getEffectiveQuantity();
            BigDecimal totalRequired = effective.multiply(batch);
            BigDecimal stock = AvailabilityCalculator.stockOf(component);
            BigDecimal unitCost = unitCostOf(material);
            BigDecimal componentCost = totalRequired.multiply(unitCost);
            BigDecimal shortage = totalRequired.subtract(stock).max(BigDecimal.ZERO);
            boolean sufficient = stock.compareTo(totalRequired) >= 0;

            if (!sufficient) {
                canProduce = false;
                shortages.add(MaterialShortage.builder()
                    .materialId(component.getMaterialId())
                    .materialName(material != null ? material.getName() : null)
                    .unit(material != null ? material.getUnit() : null)
                    .currentStock(stock)
                    .totalRequired(totalRequired)
                    .shortage(shortage)
                    .build());
            }
            totalCost = totalCost.add(componentCost);

            requirements.add(BatchRequirements.MaterialRequirement.builder()
                .materialId(component.getMaterialId())
                .materialName(material != null ? material.getName() : null)
                .unit(material != null ? material.getUnit() : null)
                .quantityPerUnit(component.getQuantityRequired())
                .wastePercentage(component.getWastePercentage())
                .effectiveQuantityPerUnit(effective)
                .totalRequired(totalRequired)
                .currentStock(stock)
                .remainingAfterProduction(stock.subtract(totalRequired))
                .sufficient(sufficient)
                .shortage(shortage)
                .unitCost(unitCost)
                .totalCost(money(componentCost))
                .build());
        }

        return BatchRequirements.builder()
            .productId(product.getId())
            .productName(product.getName())
            .recipeId(recipe.getId())
            .recipeName(recipe.getName())
            .requestedQuantity(quantity)
            .canProduce(canProduce)
            .materialRequirements(requirements)
            .shortages(shortages)
            .totalMaterialCost(money(totalCost))
            .costPerUnit(money(totalCost.divide(batch, 2, RoundingMode.HALF_UP)))
            .build();
    }

    public OptimalBatchSize computeOptimalBatchSize(Product product, Integer minQuantity, Integer maxQuantity) {
        AvailabilityResult availability = availabilityCalculator.computeAvailableQuantity(product);
        int maximum = clamp(availability.getAvailableQuantity(), minQuantity, maxQuantity);
        int floor = Math.max(1, minQuantity != null ? minQuantity : 1);

        TreeSet<Integer> candidates = new TreeSet<>();
        if (maximum > 0) {
            candidates.add(maximum);
            candidates.add(maximum / 2);
            candidates.add(maximum / 4);
            for (int size : STANDARD_BATCH_SIZES) {
                candidates.add(size);
            }
        }
        List<Integer> suggested = candidates.stream()
            .filter(size -> size >= floor && size <= maximum)
            .toList();

        List<OptimalBatchSize.BatchOption> options = new ArrayList<>();
        for (int size : suggested) {
            BatchRequirements requirements = computeBatchRequirements(product, size);
            options.add(OptimalBatchSize.BatchOption.builder()
                .batchSize(size)
                .totalCost(requirements.getTotalMaterialCost())
                .costPerUnit(requirements.getCostPerUnit())
                .utilizationPercentage(round2((double) size / maximum * 100.0))
                .build());
        }

        return OptimalBatchSize.builder()
            .productId(product.getId())
            .productName(product.getName())
            .maximumProducible(maximum)
            .bottleneckMaterial(availability.getBottleneckMaterial())
            .suggestedBatches(suggested)
            .batchOptions(options)
            .recommendation(recommendation(maximum, options))
            .build();
    }

    /**
     * What-if view of a production run: stock before and after, without touching stock.
     */
    public ProductionSimulation simulateProduction(Product product, int quantity) {
        BatchRequirements requirements = computeBatchRequirements(product, quantity);
        if (!requirements.isCanProduce()) {
            return ProductionSimulation.builder()
                .success(false)
                .message(requirements.getMaterialRequirements().isEmpty()
                    ? "Cannot simulate production without an active recipe"
                    : "Cannot simulate production due to material shortages")
                .productId(product.getId())
                .productName(product.getName())
                .quantity(quantity)
                .materialChanges(List.of())
                .shortages(requirements.getShortages())
                .build();
        }

        List<ProductionSimulation.MaterialChange> changes = new ArrayList<>();
        for (RecipeComponent component : product.getActiveRecipe().getComponents()) {
            BatchRequirements.MaterialRequirement requirement = requirements.getMaterialRequirements().stream()
                .filter(r -> r.getMaterialId().equals(component.getMaterialId()))
                .findFirst()
                .orElseThrow();
            Material material = component.getMaterial();
            BigDecimal after = requirement.getRemainingAfterProduction();
            changes.add(ProductionSimulation.MaterialChange.builder()
                .materialId(requirement.getMaterialId())
                .materialName(requirement.getMaterialName())
                .unit(requirement.getUnit())
                .beforeProduction(requirement.getCurrentStock())
                .consumed(requirement.getTotalRequired())
                .afterProduction(after)
                .belowReorderLevel(material != null && after.compareTo(material.getReorderLevel()) < 0)
                .build());
        }

        return ProductionSimulation.builder()
            .success(true)
            .message("Production of " + quantity + " unit(s) is possible with current stock")
            .productId(product.getId())
            .productName(product.getName())
            .quantity(quantity)
            .materialChanges(changes)
            .shortages(List.of())
            .productionCost(requirements.getTotalMaterialCost())
            .costPerUnit(requirements.getCostPerUnit())
            .build();
    }

    private int clamp(int available, Integer minQuantity, Integer maxQuantity) {
        if (minQuantity != null && maxQuantity != null && minQuantity > maxQuantity) {
            return 0;
        }
        int maximum = maxQuantity != null ? Math.min(available, maxQuantity) : available;
        if (minQuantity != null && maximum < minQuantity) {
            return 0;
        }
        return Math.max(0, maximum);
    }

    private String recommendation(int maximum, List<OptimalBatchSize.BatchOption> options) {
        if (maximum == 0) {
            return "Cannot produce. Material shortages detected.";
        }
        if (maximum < 10) {
            return "Very limited production capacity. Recommend restocking materials before production.";
        }
        return options.stream()
            .min(Comparator.comparing(OptimalBatchSize.BatchOption::getCostPerUnit)
                .thenComparing(Comparator.comparingInt(OptimalBatchSize.BatchOption::getBatchSize).reversed()))
            .map(o -> "Recommended batch size: " + o.getBatchSize() + " units for optimal cost efficiency.")
            .orElse("Maximum capacity: " + maximum + " units. Plan batch size accordingly.");
    }

    static BigDecimal unitCostOf(Material material) {
        return material != null && material.getUnitCost() != null ? material.getUnitCost() : BigDecimal.ZERO;
    }

    static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
