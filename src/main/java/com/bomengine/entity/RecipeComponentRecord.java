package com.bomengine.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(
    name = "recipe_materials",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_recipe_material", columnNames = {"recipe_id", "material_id"}),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecipeComponentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipe_id", nullable = false)
    private RecipeRecord recipe;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "material_id", nullable = false)
    private MaterialRecord material;

    @Column(name = "quantity_required", nullable = false, precision = 15, scale = 4)
    private BigDecimal quantityRequired;

    @Column(name = "waste_percentage", precision = 5, scale = 2)
    private BigDecimal wastePercentage;
}
