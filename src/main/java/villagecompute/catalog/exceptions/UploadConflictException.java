/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.exceptions;

/**
 * Exception thrown when a chunk contradicts the upload already registered for its checksum (e.g., a different
 * {@code total_chunks} than the first chunk declared).
 *
 * <p>
 * Typically mapped to HTTP 409 Conflict in REST resources.
 */
public class UploadConflictException extends RuntimeException {

    public UploadConflictException(String message) {
        super(message);
    }
}
