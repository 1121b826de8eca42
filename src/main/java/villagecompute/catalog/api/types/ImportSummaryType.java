/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate outcome of one CSV import run.
 *
 * <p>
 * {@code issues} lists one human-readable message per invalid row, duplicate SKU and unresolved image, in the order
 * they were encountered. A fatal streaming error appears as a single {@code "Fatal error: ..."} entry with
 * {@code success = false}; batches committed before the failure stay committed.
 */
public record ImportSummaryType(
        @JsonProperty("success") boolean success,
        @JsonProperty("total_rows") int totalRows,
        @JsonProperty("imported_count") int importedCount,
        @JsonProperty("updated_count") int updatedCount,
        @JsonProperty("invalid_count") int invalidCount,
        @JsonProperty("duplicate_count") int duplicateCount,
        @JsonProperty("images_linked") int imagesLinked,
        @JsonProperty("images_not_found") int imagesNotFound,
        @JsonProperty("issues") List<String> issues) {
}
