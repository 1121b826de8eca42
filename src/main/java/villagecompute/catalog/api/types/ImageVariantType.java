/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.catalog.data.models.ImageVariant;

/**
 * Response DTO for one generated image variant.
 */
public record ImageVariantType(
        @JsonProperty("variant_id") Long variantId,
        @JsonProperty("upload_id") Long uploadId,
        @JsonProperty("variant") String variant,
        @JsonProperty("path") String path,
        @JsonProperty("width") int width,
        @JsonProperty("height") int height,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("size_bytes") long sizeBytes,
        @JsonProperty("content_type") String contentType) {

    /**
     * Maps an entity. Must run while the variant's upload reference is still reachable.
     */
    public static ImageVariantType fromEntity(ImageVariant variant) {
        return new ImageVariantType(variant.id, variant.upload.id, variant.variant, variant.path, variant.width,
                variant.height, variant.checksum, variant.sizeBytes, variant.contentType);
    }
}
