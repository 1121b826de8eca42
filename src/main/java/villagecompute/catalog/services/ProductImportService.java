/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ImportSummaryType;
import villagecompute.catalog.exceptions.CsvStructureException;
import villagecompute.catalog.observability.LoggingConfig;
import villagecompute.catalog.services.ProductRowParser.ParsedRow;
import villagecompute.catalog.services.ProductRowParser.ProductRow;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Bulk product import from CSV: streams the file in fixed-size batches, validates and de-duplicates rows, upserts by
 * SKU and links images by filename.
 *
 * <p>
 * <b>Workflow:</b>
 * <ol>
 * <li>Structural validation ({@link CsvStructureValidator}); failures throw {@link CsvStructureException} before any
 * row is read.</li>
 * <li>Rows are read lazily and grouped into batches of {@code catalog.import.batch-size} (default 1000), so memory is
 * bounded by the batch, not the file.</li>
 * <li>Each row is validated; invalid rows are counted and reported. A SKU already seen earlier in the run is counted
 * as a duplicate and dropped.</li>
 * <li>Surviving rows of a batch go to {@link ProductBatchWriter}, one transaction per batch.</li>
 * </ol>
 *
 * <p>
 * An error that stops the stream (unreadable file, database outage) ends the run with a single
 * {@code "Fatal error: ..."} issue and {@code success = false}. Batches committed before it stay committed.
 */
@ApplicationScoped
public class ProductImportService {

    private static final Logger LOG = Logger.getLogger(ProductImportService.class);

    @Inject
    CsvStructureValidator structureValidator;

    @Inject
    ProductBatchWriter batchWriter;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "catalog.import.batch-size",
            defaultValue = "1000")
    int batchSize;

    /**
     * Imports a CSV file from disk.
     *
     * @param csvPath
     *            file to import
     * @return run summary
     * @throws CsvStructureException
     *             if the file fails structural validation
     */
    public ImportSummaryType importFile(Path csvPath) {
        Path fileName = csvPath.getFileName();
        return importFile(csvPath, fileName == null ? null : fileName.toString());
    }

    /**
     * Imports an uploaded CSV file.
     *
     * @param csvPath
     *            temporary file holding the upload
     * @param originalFileName
     *            client filename used for the type check, or {@code null} to skip it
     * @return run summary
     * @throws CsvStructureException
     *             if the file fails structural validation
     */
    public ImportSummaryType importFile(Path csvPath, String originalFileName) {
        ProductCsvHeader header = structureValidator.validate(csvPath, originalFileName);

        Span span = tracer.spanBuilder("catalog.import").setAttribute("import.file", String.valueOf(originalFileName))
                .setAttribute("import.image_column", header.hasImageColumn()).startSpan();

        ImportRun run = new ImportRun(header.hasImageColumn());
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("ProductImport");
            LOG.infof("Starting product import: file=%s, imageColumn=%s, batchSize=%d", originalFileName,
                    header.hasImageColumn(), batchSize);

            try {
                streamBatches(csvPath, header, run);
            } catch (RuntimeException | IOException e) {
                LOG.errorf(e, "Product import aborted after %d rows", run.toSummary().totalRows());
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, e.getMessage());
                run.recordFatal(describe(e));
            }

            ImportSummaryType summary = run.toSummary();
            recordMetrics(summary);
            span.setAttribute("import.total_rows", summary.totalRows());
            span.setAttribute("import.imported", summary.importedCount());
            span.setAttribute("import.updated", summary.updatedCount());
            LOG.infof("Product import finished: total=%d, imported=%d, updated=%d, invalid=%d, duplicate=%d, "
                    + "linked=%d, notFound=%d, success=%s", summary.totalRows(), summary.importedCount(),
                    summary.updatedCount(), summary.invalidCount(), summary.duplicateCount(), summary.imagesLinked(),
                    summary.imagesNotFound(), summary.success());
            return summary;

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private void streamBatches(Path csvPath, ProductCsvHeader header, ImportRun run) throws IOException {
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(csvPath, StandardCharsets.UTF_8))) {
            readRecord(reader); // header, already validated

            Iterator<List<String[]>> batches = Iterators.partition(records(reader), batchSize);
            while (batches.hasNext()) {
                processBatch(batches.next(), header, run);
            }
        }
    }

    private void processBatch(List<String[]> records, ProductCsvHeader header, ImportRun run) {
        List<ProductRow> survivors = new ArrayList<>(records.size());

        for (String[] fields : records) {
            int rowNumber = run.nextRow();
            ParsedRow parsed = ProductRowParser.parse(fields, header, rowNumber);
            if (!parsed.isValid()) {
                run.recordInvalid(parsed.error());
                continue;
            }
            ProductRow row = parsed.row();
            if (!run.markSeen(row.sku())) {
                run.recordDuplicate(row.sku());
                continue;
            }
            survivors.add(row);
        }

        if (survivors.isEmpty()) {
            return;
        }
        run.recordBatch(batchWriter.write(survivors, run.isImageColumnPresent()));
    }

    /**
     * Lazy view of the remaining CSV records.
     */
    private static Iterator<String[]> records(CSVReader reader) {
        return new AbstractIterator<>() {
            @Override
            protected String[] computeNext() {
                String[] next = readRecord(reader);
                return next == null ? endOfData() : next;
            }
        };
    }

    private static String[] readRecord(CSVReader reader) {
        try {
            return reader.readNext();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Malformed CSV at line " + reader.getLinesRead() + ": " + e.getMessage(),
                    e);
        }
    }

    private static String describe(Exception e) {
        Throwable cause = e instanceof UncheckedIOException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void recordMetrics(ImportSummaryType summary) {
        meterRegistry.counter("catalog.import.rows.total", "outcome", "imported").increment(summary.importedCount());
        meterRegistry.counter("catalog.import.rows.total", "outcome", "updated").increment(summary.updatedCount());
        meterRegistry.counter("catalog.import.rows.total", "outcome", "invalid").increment(summary.invalidCount());
        meterRegistry.counter("catalog.import.rows.total", "outcome", "duplicate")
                .increment(summary.duplicateCount());
        meterRegistry.counter("catalog.import.images.total", "outcome", "linked").increment(summary.imagesLinked());
        meterRegistry.counter("catalog.import.images.total", "outcome", "not_found")
                .increment(summary.imagesNotFound());
    }
}
