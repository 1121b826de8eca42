/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.opencsv.CSVWriter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.Upload;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Generates sample product CSVs for operators and load testing.
 */
@ApplicationScoped
public class SampleCsvService {

    private static final Logger LOG = Logger.getLogger(SampleCsvService.class);

    /**
     * Synthetic CSV without an image column: {@code SKU00001 .. SKU%05d}, deterministic names and prices.
     *
     * @param rows
     *            number of data rows
     * @return CSV text including the header
     */
    public String syntheticCsv(int rows) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(new String[] {"sku", "name", "price"}, false);
            for (int i = 1; i <= rows; i++) {
                writer.writeNext(new String[] {String.format("SKU%05d", i), "Sample Product " + i, samplePrice(i)},
                        false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOG.debugf("Generated synthetic CSV with %d rows", rows);
        return out.toString();
    }

    /**
     * CSV whose image column names the {@code limit} most recent completed uploads, one product per upload.
     *
     * @param limit
     *            max uploads referenced
     * @return CSV text including the header
     */
    @Transactional
    public String csvWithImages(int limit) {
        List<Upload> uploads = Upload.findRecentCompleted(limit);
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(new String[] {"sku", "name", "price", "image"}, false);
            int i = 1;
            for (Upload upload : uploads) {
                writer.writeNext(new String[] {String.format("IMG%05d", i), "Imaged Product " + i, samplePrice(i),
                        upload.originalName}, false);
                i++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        LOG.debugf("Generated image sample CSV referencing %d uploads", uploads.size());
        return out.toString();
    }

    /**
     * Writer that quotes a field only when it contains a separator, quote or line break.
     */
    private static CSVWriter newWriter(StringWriter out) {
        return new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
    }

    private static String samplePrice(int i) {
        return BigDecimal.valueOf(100 + (i % 9900), 2).add(BigDecimal.valueOf(i % 50)).toPlainString();
    }
}
