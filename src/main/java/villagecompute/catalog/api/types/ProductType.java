/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.catalog.data.models.Product;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a product and its primary image.
 */
public record ProductType(
        @JsonProperty("product_id") Long productId,
        @JsonProperty("sku") String sku,
        @JsonProperty("name") String name,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("primary_image") ImageVariantType primaryImage,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt) {

    /**
     * Maps an entity. Call inside a transaction so the primary image can be loaded.
     */
    public static ProductType fromEntity(Product product) {
        ImageVariantType image = product.primaryImage == null
                ? null
                : ImageVariantType.fromEntity(product.primaryImage);
        return new ProductType(product.id, product.sku, product.name, product.price, image, product.createdAt,
                product.updatedAt);
    }
}
