/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.exceptions;

import java.util.List;

/**
 * Raised before any row is read when a CSV file cannot be imported at all: unreadable or empty file, wrong file type,
 * oversize file, or missing required header columns.
 *
 * <p>
 * Carries every structural problem found so the caller can report them together. Mapped to HTTP 422 by
 * {@link villagecompute.catalog.api.rest.ProductImportResource}.
 */
public class CsvStructureException extends ValidationException {

    private final List<String> errors;

    public CsvStructureException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public CsvStructureException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
