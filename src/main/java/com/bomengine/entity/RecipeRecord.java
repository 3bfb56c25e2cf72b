package com.bomengine.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
    name = "recipes",
    indexes = {
        @Index(name = "idx_recipe_tenant_active", columnList = "tenant_id, is_active"),
        @Index(name = "idx_recipe_product",       columnList = "product_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecipeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(nullable = false)
    private String name;

    @Column(name = "yield_quantity", nullable = false, precision = 15, scale = 4)
    private BigDecimal yieldQuantity;

    @Column(name = "yield_unit", length = 20)
    private String yieldUnit;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Builder.Default
    @OneToMany(mappedBy = "recipe", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<RecipeComponentRecord> components = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public void addComponent(RecipeComponentRecord component) {
        component.setRecipe(this);
        components.add(component);
    }
}
