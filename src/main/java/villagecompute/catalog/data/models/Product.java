/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.LockModeType;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Catalog product keyed by SKU (case-sensitive, unique).
 *
 * <p>
 * Created on the first CSV appearance of a SKU and overwritten (name, price) on every later one. The primary image is
 * a non-owning reference to one {@link ImageVariant}; it is only reassigned when it resolves to a different variant so
 * repeated imports cause no timestamp churn.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code sku} (VARCHAR(255), UNIQUE)</li>
 * <li>{@code price} (NUMERIC(12,2)) - non-negative</li>
 * <li>{@code primary_image_id} (BIGINT, FK image_variants, nullable)</li>
 * </ul>
 */
@Entity
@Table(
        name = "products")
public class Product extends PanacheEntityBase {

    public static final int MAX_SKU_LENGTH = 255;
    public static final int MAX_NAME_LENGTH = 1024;

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            nullable = false,
            unique = true,
            length = MAX_SKU_LENGTH)
    public String sku;

    @Column(
            nullable = false,
            length = MAX_NAME_LENGTH)
    public String name;

    @Column(
            nullable = false,
            precision = 12,
            scale = 2)
    public BigDecimal price;

    @ManyToOne(
            fetch = FetchType.LAZY)
    @JoinColumn(
            name = "primary_image_id")
    public ImageVariant primaryImage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Find a product by SKU.
     *
     * @param sku
     *            exact SKU
     * @return the product if present
     */
    public static Optional<Product> findBySku(String sku) {
        return find("sku", sku).firstResultOptional();
    }

    /**
     * Loads every existing product among the given SKUs, holding write locks on their rows until the surrounding
     * transaction ends.
     *
     * @param skus
     *            SKUs of one import batch
     * @return existing products, in no particular order
     */
    public static List<Product> findBySkusForUpdate(Collection<String> skus) {
        if (skus == null || skus.isEmpty()) {
            return List.of();
        }
        return find("sku IN ?1", skus).withLock(LockModeType.PESSIMISTIC_WRITE).list();
    }

    /**
     * Creates and persists a new product without a primary image.
     */
    public static Product create(String sku, String name, BigDecimal price) {
        Product product = new Product();
        product.sku = sku;
        product.name = name;
        product.price = price;
        product.createdAt = Instant.now();
        product.updatedAt = product.createdAt;
        product.persist();
        return product;
    }

    /**
     * Overwrites name and price and touches {@code updated_at}.
     */
    public void overwrite(String newName, BigDecimal newPrice) {
        this.name = newName;
        this.price = newPrice;
        this.updatedAt = Instant.now();
    }

    /**
     * Points the product at a new primary image.
     *
     * @param variant
     *            variant to reference
     * @return {@code false} when the product already references that variant (nothing changes)
     */
    public boolean assignPrimaryImage(ImageVariant variant) {
        if (primaryImage != null && primaryImage.id != null && primaryImage.id.equals(variant.id)) {
            return false;
        }
        this.primaryImage = variant;
        this.updatedAt = Instant.now();
        return true;
    }
}
