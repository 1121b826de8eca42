/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import villagecompute.catalog.api.types.ImportSummaryType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one import invocation: counters, issues in encounter order, and every SKU seen so far.
 *
 * <p>
 * One instance per run, passed through the batch loop. The seen-SKU set grows with the number of distinct SKUs in the
 * file; row content itself is never retained beyond its batch. Not thread-safe.
 */
public class ImportRun {

    private final boolean imageColumnPresent;
    private final Set<String> seenSkus = new HashSet<>();
    private final List<String> issues = new ArrayList<>();

    private int totalRows;
    private int importedCount;
    private int updatedCount;
    private int invalidCount;
    private int duplicateCount;
    private int imagesLinked;
    private int imagesNotFound;
    private boolean fatal;

    public ImportRun(boolean imageColumnPresent) {
        this.imageColumnPresent = imageColumnPresent;
    }

    public boolean isImageColumnPresent() {
        return imageColumnPresent;
    }

    /**
     * Counts a data row and returns its 1-based number.
     */
    public int nextRow() {
        return ++totalRows;
    }

    public void recordInvalid(String issue) {
        invalidCount++;
        issues.add(issue);
    }

    /**
     * Marks a SKU as seen.
     *
     * @return {@code false} if an earlier row of this run already carried the SKU
     */
    public boolean markSeen(String sku) {
        return seenSkus.add(sku);
    }

    public void recordDuplicate(String sku) {
        duplicateCount++;
        issues.add("Duplicate SKU in CSV: " + sku);
    }

    /**
     * Folds the result of one committed batch into the run.
     */
    public void recordBatch(ProductBatchWriter.BatchResult result) {
        importedCount += result.importedCount();
        updatedCount += result.updatedCount();
        imagesLinked += result.links().linkedCount();
        imagesNotFound += result.links().notFoundCount();
        issues.addAll(result.links().issues());
    }

    /**
     * Records an error that aborted the rest of the file.
     */
    public void recordFatal(String message) {
        fatal = true;
        issues.add("Fatal error: " + message);
    }

    public ImportSummaryType toSummary() {
        return new ImportSummaryType(!fatal, totalRows, importedCount, updatedCount, invalidCount, duplicateCount,
                imagesLinked, imagesNotFound, List.copyOf(issues));
    }
}
