/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.exceptions;

/**
 * Exception thrown when the object store rejects or fails an operation (network error, invalid credentials, missing
 * bucket).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
