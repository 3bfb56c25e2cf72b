package com.bomengine.service;

import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.dto.AvailabilityResult;
import com.bomengine.dto.BulkAvailabilityResponse;
import com.bomengine.engine.AvailabilityCalculator;
import com.bomengine.exception.BatchSizeExceededException;
import com.bomengine.exception.ProductNotFoundException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.bomengine.BomFixtures.TENANT;
import static com.bomengine.BomFixtures.component;
import static com.bomengine.BomFixtures.material;
import static com.bomengine.BomFixtures.product;
import static com.bomengine.BomFixtures.simpleProduct;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BomCalculationServiceTest {

    @Mock
    BomSnapshotService snapshotService;

    BomCalculationService calculationService;

    @BeforeEach
    void setUp() {
        calculationService = new BomCalculationService(snapshotService, new AvailabilityCalculator());
        ReflectionTestUtils.setField(calculationService, "poolSize", 2);
        ReflectionTestUtils.setField(calculationService, "maxProducts", 3);
        calculationService.init();
    }

    @AfterEach
    void tearDown() {
        calculationService.shutdown();
    }

    @Test
    void availability_loadsSnapshotAndComputes() {
        Material flour = material("Flour", "100", "10");
        Product cake = product("Cake", component(flour, "4"));
        when(snapshotService.loadProduct(TENANT, cake.getId())).thenReturn(cake);

        AvailabilityResult result = calculationService.availability(TENANT, cake.getId());

        assertThat(result.getAvailableQuantity()).isEqualTo(25);
    }

    @Test
    void availability_unknownProduct_propagatesNotFound() {
        UUID missing = UUID.randomUUID();
        when(snapshotService.loadProduct(TENANT, missing)).thenThrow(new ProductNotFoundException(missing));

        assertThatThrownBy(() -> calculationService.availability(TENANT, missing))
            .isInstanceOf(ProductNotFoundException.class);
    }

    @Test
    void bulkAvailability_reportsEveryRequestedIdInOrder() {
        Material flour = material("Flour", "100", "10");
        Product cake = product("Cake", component(flour, "2"));
        Product card = simpleProduct("Card");
        UUID missing = UUID.randomUUID();
        Map<UUID, Product> found = new LinkedHashMap<>();
        found.put(card.getId(), card);
        found.put(cake.getId(), cake);
        when(snapshotService.loadProducts(any(), any())).thenReturn(found);

        BulkAvailabilityResponse response = calculationService.bulkAvailability(
            TENANT, List.of(cake.getId(), missing, cake.getId(), card.getId()));

        assertThat(response.getItemCount()).isEqualTo(3);
        assertThat(response.getFailureCount()).isEqualTo(2);
        assertThat(response.getResults().keySet()).containsExactly(cake.getId(), missing, card.getId());
        assertThat(response.getResults().get(cake.getId()).getAvailableQuantity()).isEqualTo(50);
        assertThat(response.getResults().get(missing).getError()).contains("not found");
        assertThat(response.getResults().get(card.getId()).isFailed()).isTrue();
    }

    @Test
    void bulkAvailability_tooManyProducts_throws() {
        List<UUID> ids = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());

        assertThatThrownBy(() -> calculationService.bulkAvailability(TENANT, ids))
            .isInstanceOf(BatchSizeExceededException.class)
            .hasMessageContaining("4");
        verifyNoInteractions(snapshotService);
    }

    @Test
    void bulkAvailability_duplicatesCountOnce() {
        UUID id = UUID.randomUUID();
        when(snapshotService.loadProducts(TENANT, Set.of(id))).thenReturn(Map.of());

        BulkAvailabilityResponse response = calculationService.bulkAvailability(TENANT, List.of(id, id, id, id));

        assertThat(response.getItemCount()).isEqualTo(1);
        assertThat(response.getFailureCount()).isEqualTo(1);
    }
}
