/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one synchronous processing run triggered by an operator.
 *
 * @param status
 *            resulting upload status, or {@code "missing"} if the upload no longer exists
 */
public record ProcessingResultType(
        @JsonProperty("upload_id") Long uploadId,
        @JsonProperty("status") String status) {
}
