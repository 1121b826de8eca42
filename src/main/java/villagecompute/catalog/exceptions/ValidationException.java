/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.exceptions;

/**
 * Exception thrown when request input fails validation (e.g., missing chunk field, negative chunk index).
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 400 Bad Request or 422 Unprocessable Entity
 * in REST resources depending on the validation type.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
