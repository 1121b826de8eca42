/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.catalog.exceptions.CsvStructureException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pre-flight structural checks on an uploaded product CSV. Runs before any row is processed; a rejected file leaves no
 * state behind.
 *
 * <p>
 * Checks, in order: file type ({@code .csv} or {@code .txt}), size cap ({@code catalog.import.max-file-size}),
 * readable header, required columns.
 */
@ApplicationScoped
public class CsvStructureValidator {

    private static final Logger LOG = Logger.getLogger(CsvStructureValidator.class);

    private static final List<String> ALLOWED_EXTENSIONS = List.of("csv", "txt");

    @ConfigProperty(
            name = "catalog.import.max-file-size",
            defaultValue = "104857600")
    long maxFileSize;

    /**
     * Validates a CSV file and resolves its header.
     *
     * @param file
     *            path of the uploaded file
     * @param fileName
     *            client filename, used for the type check; {@code null} skips it
     * @return resolved column positions
     * @throws CsvStructureException
     *             listing every structural problem found
     */
    public ProductCsvHeader validate(Path file, String fileName) {
        if (fileName != null && !hasAllowedExtension(fileName)) {
            throw new CsvStructureException("The csv field must be a file of type: csv, txt.");
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            LOG.warnf(e, "Cannot determine size of %s", file);
            throw new CsvStructureException("Cannot determine file size");
        }
        if (size > maxFileSize) {
            throw new CsvStructureException("File too large. Maximum size: " + formatBytes(maxFileSize)
                    + ", Actual size: " + formatBytes(size));
        }

        String[] rawHeader;
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            rawHeader = reader.readNext();
        } catch (IOException | CsvValidationException e) {
            LOG.warnf(e, "Cannot read CSV header from %s", file);
            throw new CsvStructureException("CSV file is empty or header row cannot be read");
        }

        List<String> header = rawHeader == null ? List.of() : ProductCsvHeader.normalize(rawHeader);
        if (header.isEmpty() || (header.size() == 1 && header.get(0).isEmpty())) {
            throw new CsvStructureException("CSV file is empty or header row cannot be read");
        }

        List<String> missing = ProductCsvHeader.missingColumns(header);
        if (!missing.isEmpty()) {
            List<String> errors = new ArrayList<>();
            errors.add("Missing required columns: " + String.join(", ", missing));
            errors.add("Found columns: " + String.join(", ", header));
            throw new CsvStructureException(errors);
        }

        return ProductCsvHeader.resolve(header);
    }

    private static boolean hasAllowedExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return ALLOWED_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    static String formatBytes(long bytes) {
        String[] units = {"B", "KB", "MB", "GB"};
        double value = Math.max(bytes, 0);
        int unit = 0;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, units[unit]).replace(".00 ", " ");
    }
}
