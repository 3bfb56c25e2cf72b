package com.bomengine.service;

import com.bomengine.domain.InventoryTransaction;
import com.bomengine.domain.Material;
import com.bomengine.domain.Product;
import com.bomengine.domain.Recipe;
import com.bomengine.domain.RecipeComponent;
import com.bomengine.domain.TenantSnapshot;
import com.bomengine.entity.InventoryTransactionRecord;
import com.bomengine.entity.MaterialRecord;
import com.bomengine.entity.ProductRecord;
import com.bomengine.entity.RecipeComponentRecord;
import com.bomengine.entity.RecipeRecord;
import com.bomengine.exception.ProductNotFoundException;
import com.bomengine.repository.InventoryTransactionRepository;
import com.bomengine.repository.MaterialRepository;
import com.bomengine.repository.ProductRepository;
import com.bomengine.repository.RecipeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reads one tenant's products, recipes, materials and transactions and maps them into the
 * immutable snapshots the engine works on. Never writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BomSnapshotService {

    private final ProductRepository              productRepository;
    private final MaterialRepository             materialRepository;
    private final RecipeRepository               recipeRepository;
    private final InventoryTransactionRepository transactionRepository;

    public Product loadProduct(UUID tenantId, UUID productId) {
        ProductRecord record = productRepository.findByIdAndTenantId(productId, tenantId)
            .orElseThrow(() -> new ProductNotFoundException(productId));
        Map<UUID, Recipe> recipes = activeRecipesByProduct(
            recipeRepository.findActiveWithComponentsForProducts(tenantId, Set.of(productId)));
        return toProduct(record, recipes.get(productId));
    }

    /**
     * Products found for the tenant, keyed by id. Unknown ids are simply absent.
     */
    public Map<UUID, Product> loadProducts(UUID tenantId, Collection<UUID> productIds) {
        if (productIds.isEmpty()) {
            return Map.of();
        }
        List<ProductRecord> records = productRepository.findByTenantIdAndIdIn(tenantId, productIds);
        Map<UUID, Recipe> recipes = activeRecipesByProduct(
            recipeRepository.findActiveWithComponentsForProducts(tenantId, productIds));

        Map<UUID, Product> products = new LinkedHashMap<>();
        for (ProductRecord record : records) {
            products.put(record.getId(), toProduct(record, recipes.get(record.getId())));
        }
        return products;
    }

    public TenantSnapshot loadTenantSnapshot(UUID tenantId, int historyWindowDays, Instant asOf) {
        List<RecipeRecord> recipeRecords = recipeRepository.findActiveWithComponents(tenantId);
        Map<UUID, Recipe> recipes = activeRecipesByProduct(recipeRecords);

        List<Product> products = productRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
            .map(record -> toProduct(record, recipes.get(record.getId())))
            .toList();
        List<Material> materials = materialRepository.findByTenantIdOrderByNameAsc(tenantId).stream()
            .map(BomSnapshotService::toMaterial)
            .toList();
        List<InventoryTransaction> history = transactionRepository
            .findByTenantIdAndCreatedAtBetweenOrderByCreatedAtAsc(
                tenantId, asOf.minus(Duration.ofDays(historyWindowDays)), asOf)
            .stream()
            .map(BomSnapshotService::toTransaction)
            .toList();

        log.debug("Snapshot loaded | tenantId={} | products={} | materials={} | transactions={}",
                  tenantId, products.size(), materials.size(), history.size());

        return TenantSnapshot.builder()
            .tenantId(tenantId)
            .products(products)
            .materials(materials)
            .activeRecipes(List.copyOf(recipes.values()))
            .history(history)
            .asOf(asOf)
            .build();
    }

    // newest active recipe wins when a product has more than one
    private Map<UUID, Recipe> activeRecipesByProduct(List<RecipeRecord> records) {
        Map<UUID, Recipe> byProduct = new LinkedHashMap<>();
        for (RecipeRecord record : records) {
            byProduct.putIfAbsent(record.getProductId(), toRecipe(record));
        }
        return byProduct;
    }

    private static Product toProduct(ProductRecord record, Recipe activeRecipe) {
        return Product.builder()
            .id(record.getId())
            .tenantId(record.getTenantId())
            .name(record.getName())
            .sku(record.getSku())
            .inventoryManagementType(record.getInventoryManagementType())
            .activeRecipe(activeRecipe)
            .build();
    }

    private static Recipe toRecipe(RecipeRecord record) {
        Recipe.RecipeBuilder builder = Recipe.builder()
            .id(record.getId())
            .productId(record.getProductId())
            .name(record.getName())
            .active(record.isActive());
        if (record.getYieldQuantity() != null) {
            builder.yieldQuantity(record.getYieldQuantity());
        }
        if (record.getYieldUnit() != null) {
            builder.yieldUnit(record.getYieldUnit());
        }
        for (RecipeComponentRecord component : record.getComponents()) {
            builder.component(toComponent(component));
        }
        return builder.build();
    }

    private static RecipeComponent toComponent(RecipeComponentRecord record) {
        Material material = toMaterial(record.getMaterial());
        return RecipeComponent.builder()
            .materialId(material.getId())
            .material(material)
            .quantityRequired(record.getQuantityRequired())
            .wastePercentage(orZero(record.getWastePercentage()))
            .build();
    }

    static Material toMaterial(MaterialRecord record) {
        return Material.builder()
            .id(record.getId())
            .tenantId(record.getTenantId())
            .name(record.getName())
            .sku(record.getSku())
            .category(record.getCategory())
            .supplier(record.getSupplier())
            .unit(record.getUnit())
            .stockQuantity(orZero(record.getStockQuantity()))
            .reorderLevel(orZero(record.getReorderLevel()))
            .unitCost(orZero(record.getUnitCost()))
            .build();
    }

    private static InventoryTransaction toTransaction(InventoryTransactionRecord record) {
        return InventoryTransaction.builder()
            .id(record.getId())
            .materialId(record.getMaterialId())
            .type(record.getType())
            .quantityChange(record.getQuantityChange())
            .reason(record.getReason())
            .createdAt(record.getCreatedAt())
            .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
