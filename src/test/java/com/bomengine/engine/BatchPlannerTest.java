package com.bomengine.engine;

import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.dto.BatchRequirements;
import com.bomengine.dto.OptimalBatchSize;
import com.bomengine.dto.ProductionSimulation;
import com.bomengine.exception.NotBomManagedException;
import com.bomengine.exception.PlanningInputException;
import org.junit.jupiter.api.Test;

import static com.bomengine.BomFixtures.component;
import static com.bomengine.BomFixtures.material;
import static com.bomengine.BomFixtures.product;
import static com.bomengine.BomFixtures.productWithoutRecipe;
import static com.bomengine.BomFixtures.simpleProduct;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPlannerTest {

    private final BatchPlanner planner = new BatchPlanner(new AvailabilityCalculator());

    @Test
    void batchRequirements_multipliesEffectiveQuantityByBatch() {
        Material flour = material("Flour", "1000", "100", "0.50");
        Material sugar = material("Sugar", "500", "50", "2.00");
        Product cake = product("Cake", component(flour, "2"), component(sugar, "1"));

        BatchRequirements result = planner.computeBatchRequirements(cake, 10);

        assertThat(result.isCanProduce()).isTrue();
        assertThat(result.getShortages()).isEmpty();
        BatchRequirements.MaterialRequirement flourLine = result.getMaterialRequirements().get(0);
        BatchRequirements.MaterialRequirement sugarLine = result.getMaterialRequirements().get(1);
        assertThat(flourLine.getTotalRequired()).isEqualByComparingTo("20");
        assertThat(flourLine.isSufficient()).isTrue();
        assertThat(flourLine.getRemainingAfterProduction()).isEqualByComparingTo("980");
        assertThat(sugarLine.getTotalRequired()).isEqualByComparingTo("10");
        assertThat(sugarLine.isSufficient()).isTrue();
        assertThat(result.getTotalMaterialCost()).isEqualByComparingTo("30.00");
        assertThat(result.getCostPerUnit()).isEqualByComparingTo("3.00");
    }

    @Test
    void batchRequirements_flagsInsufficientMaterial() {
        Material steel = material("Steel", "10", "5");
        Product frame = product("Frame", component(steel, "2"));

        BatchRequirements result = planner.computeBatchRequirements(frame, 100);

        assertThat(result.isCanProduce()).isFalse();
        BatchRequirements.MaterialRequirement line = result.getMaterialRequirements().get(0);
        assertThat(line.getTotalRequired()).isEqualByComparingTo("200");
        assertThat(line.getCurrentStock()).isEqualByComparingTo("10");
        assertThat(line.isSufficient()).isFalse();
        assertThat(line.getShortage()).isEqualByComparingTo("190");
        assertThat(result.getShortages()).singleElement()
            .satisfies(s -> assertThat(s.getShortage()).isEqualByComparingTo("190"));
    }

    @Test
    void batchRequirements_keepsFractionalQuantities() {
        Material yeast = material("Yeast", "1", "0");
        Product loaf = product("Loaf", component(yeast, "0.015", "10"));

        BatchRequirements result = planner.computeBatchRequirements(loaf, 3);

        assertThat(result.getMaterialRequirements().get(0).getTotalRequired()).isEqualByComparingTo("0.0495");
    }

    @Test
    void batchRequirements_withoutRecipe_cannotProduce() {
        BatchRequirements result = planner.computeBatchRequirements(productWithoutRecipe("Ghost"), 5);

        assertThat(result.isCanProduce()).isFalse();
        assertThat(result.getMaterialRequirements()).isEmpty();
        assertThat(result.getTotalMaterialCost()).isEqualByComparingTo("0");
    }

    @Test
    void batchRequirements_rejectsNonPositiveQuantity() {
        Product cake = product("Cake", component(material("Flour", "10", "1"), "1"));

        assertThatThrownBy(() -> planner.computeBatchRequirements(cake, 0))
            .isInstanceOf(PlanningInputException.class);
    }

    @Test
    void batchRequirements_nonBomProduct_throws() {
        assertThatThrownBy(() -> planner.computeBatchRequirements(simpleProduct("Card"), 1))
            .isInstanceOf(NotBomManagedException.class);
    }

    @Test
    void optimalBatchSize_suggestsCandidatesWithinCapacity() {
        Material a = material("Flour", "100", "10");
        Material b = material("Sugar", "200", "10");
        Product cake = product("Cake", component(a, "2"), component(b, "5"));

        OptimalBatchSize result = planner.computeOptimalBatchSize(cake, null, null);

        assertThat(result.getMaximumProducible()).isEqualTo(40);
        assertThat(result.getSuggestedBatches()).containsExactly(10, 20, 25, 40);
        assertThat(result.getBatchOptions()).hasSize(4);
        assertThat(result.getBatchOptions().get(3).getUtilizationPercentage()).isEqualTo(100.0);
        assertThat(result.getBottleneckMaterial().getMaterialId()).isEqualTo(b.getId());
        assertThat(result.getRecommendation()).isEqualTo("Recommended batch size: 40 units for optimal cost efficiency.");
    }

    @Test
    void optimalBatchSize_clampsToMaximumQuantity() {
        Material a = material("Flour", "100", "10");
        Product cake = product("Cake", component(a, "1"));

        OptimalBatchSize result = planner.computeOptimalBatchSize(cake, null, 15);

        assertThat(result.getMaximumProducible()).isEqualTo(15);
        assertThat(result.getSuggestedBatches()).containsExactly(3, 7, 10, 15);
        assertThat(result.getSuggestedBatches()).allMatch(size -> size <= 15);
    }

    @Test
    void optimalBatchSize_respectsMinimumQuantity() {
        Material a = material("Flour", "100", "10");
        Product cake = product("Cake", component(a, "1"));

        OptimalBatchSize result = planner.computeOptimalBatchSize(cake, 30, null);

        assertThat(result.getMaximumProducible()).isEqualTo(100);
        assertThat(result.getSuggestedBatches()).containsExactly(50, 100);
    }

    @Test
    void optimalBatchSize_emptyRange_cannotProduce() {
        Material a = material("Flour", "10", "10");
        Product cake = product("Cake", component(a, "1"));

        OptimalBatchSize belowMinimum = planner.computeOptimalBatchSize(cake, 20, null);
        OptimalBatchSize inverted = planner.computeOptimalBatchSize(cake, 8, 4);

        assertThat(belowMinimum.getMaximumProducible()).isZero();
        assertThat(belowMinimum.getSuggestedBatches()).isEmpty();
        assertThat(belowMinimum.getRecommendation()).isEqualTo("Cannot produce. Material shortages detected.");
        assertThat(inverted.getMaximumProducible()).isZero();
    }

    @Test
    void optimalBatchSize_smallCapacity_recommendsRestock() {
        Material a = material("Flour", "6", "10");
        Product cake = product("Cake", component(a, "1"));

        OptimalBatchSize result = planner.computeOptimalBatchSize(cake, null, null);

        assertThat(result.getMaximumProducible()).isEqualTo(6);
        assertThat(result.getSuggestedBatches()).containsExactly(1, 3, 6);
        assertThat(result.getRecommendation()).startsWith("Very limited production capacity");
    }

    @Test
    void simulateProduction_reportsStockBeforeAndAfter() {
        Material flour = material("Flour", "100", "90", "1.00");
        Product cake = product("Cake", component(flour, "2"));

        ProductionSimulation result = planner.simulateProduction(cake, 10);

        assertThat(result.isSuccess()).isTrue();
        ProductionSimulation.MaterialChange change = result.getMaterialChanges().get(0);
        assertThat(change.getBeforeProduction()).isEqualByComparingTo("100");
        assertThat(change.getConsumed()).isEqualByComparingTo("20");
        assertThat(change.getAfterProduction()).isEqualByComparingTo("80");
        assertThat(change.isBelowReorderLevel()).isTrue();
        assertThat(result.getProductionCost()).isEqualByComparingTo("20.00");
        assertThat(flour.getStockQuantity()).isEqualByComparingTo("100");
    }

    @Test
    void simulateProduction_withShortage_fails() {
        Material flour = material("Flour", "10", "5");
        Product cake = product("Cake", component(flour, "2"));

        ProductionSimulation result = planner.simulateProduction(cake, 10);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Cannot simulate production due to material shortages");
        assertThat(result.getShortages()).hasSize(1);
        assertThat(result.getMaterialChanges()).isEmpty();
    }
}
