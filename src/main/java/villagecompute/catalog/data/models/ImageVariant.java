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
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resized derivative of an assembled upload, one row per (upload, width label).
 *
 * Variants are written "create if absent": a retried processing run finds the existing row and leaves it untouched.
 * The original image is never stored as a variant.
 */
@Entity
@Table(
        name = "image_variants",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_image_variants_upload_variant",
                columnNames = {"upload_id", "variant"}))
public class ImageVariant extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @ManyToOne(
            fetch = FetchType.LAZY)
    @JoinColumn(
            name = "upload_id",
            nullable = false)
    public Upload upload;

    @Column(
            nullable = false,
            length = 16)
    public String variant; // "256", "512", "1024"

    @Column(
            nullable = false,
            length = 512)
    public String path;

    @Column(
            nullable = false)
    public int width;

    @Column(
            nullable = false)
    public int height;

    @Column(
            nullable = false,
            length = 64)
    public String checksum;

    @Column(
            name = "size_bytes",
            nullable = false)
    public long sizeBytes;

    @Column(
            name = "content_type",
            nullable = false)
    public String contentType;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    // Static finders (Panache ActiveRecord pattern)

    /**
     * Find a specific variant of an upload.
     *
     * @param uploadId
     *            the upload primary key
     * @param variant
     *            width label
     * @return the variant if it has been generated
     */
    public static Optional<ImageVariant> findByUploadAndVariant(Long uploadId, String variant) {
        return find("upload.id = ?1 AND variant = ?2", uploadId, variant).firstResultOptional();
    }

    /**
     * Find all variants of an upload, narrowest first.
     *
     * @param uploadId
     *            the upload primary key
     * @return variants ordered by width ASC
     */
    public static List<ImageVariant> findByUploadId(Long uploadId) {
        return find("upload.id = ?1 ORDER BY width ASC", uploadId).list();
    }

    /**
     * Picks the widest variant. Ties keep the first one encountered.
     *
     * @param variants
     *            candidate variants, may be empty
     * @return the widest variant, or empty when there are none
     */
    public static Optional<ImageVariant> largest(List<ImageVariant> variants) {
        ImageVariant best = null;
        for (ImageVariant candidate : variants) {
            if (best == null || candidate.width > best.width) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }
}
