/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.hibernate.Hibernate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.catalog.TestFixtures;
import villagecompute.catalog.api.types.ImportSummaryType;
import villagecompute.catalog.data.models.Product;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.exceptions.CsvStructureException;
import villagecompute.catalog.testing.H2TestResource;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the streaming CSV import: upsert, validation, dedupe and image linking.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class ProductImportServiceTest {

    @Inject
    ProductImportService importService;

    private final List<Path> files = new ArrayList<>();

    @BeforeEach
    public void setup() {
        TestFixtures.cleanDatabase();
    }

    @AfterEach
    public void cleanupFiles() throws IOException {
        for (Path file : files) {
            Files.deleteIfExists(file);
        }
        files.clear();
    }

    private ImportSummaryType importLines(String... lines) throws IOException {
        Path csv = TestFixtures.writeCsv(lines);
        files.add(csv);
        return importService.importFile(csv, "products.csv");
    }

    private static Product product(String sku) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Product product = Product.findBySku(sku).orElseThrow();
            Hibernate.initialize(product.primaryImage);
            return product;
        });
    }

    @Test
    public void testImport_duplicateSkuKeepsFirstRow() throws Exception {
        ImportSummaryType summary = importLines("sku,name,price", "SKU001,Widget,19.99", "SKU001,Widget2,29.99",
                "SKU002,Gadget,9.99");

        assertTrue(summary.success());
        assertEquals(3, summary.totalRows());
        assertEquals(2, summary.importedCount());
        assertEquals(0, summary.updatedCount());
        assertEquals(1, summary.duplicateCount());
        assertEquals(0, summary.invalidCount());
        assertEquals(List.of("Duplicate SKU in CSV: SKU001"), summary.issues());

        Product widget = product("SKU001");
        assertEquals("Widget", widget.name);
        assertEquals(new BigDecimal("19.99"), widget.price);
    }

    @Test
    public void testImport_rerunUpdatesInsteadOfInserting() throws Exception {
        String[] lines = {"sku,name,price", "A1,Alpha,1.00", "B2,Beta,2.00", "C3,Gamma,3.00"};

        ImportSummaryType first = importLines(lines);
        ImportSummaryType second = importLines(lines);

        assertEquals(3, first.importedCount());
        assertEquals(0, first.updatedCount());
        assertEquals(0, second.importedCount());
        assertEquals(3, second.updatedCount());
        assertEquals(3L, (long) QuarkusTransaction.requiringNew().call(() -> Product.count()));
    }

    @Test
    public void testImport_existingProductIsOverwritten() throws Exception {
        TestFixtures.createProduct("SKU9", "Old name", "5.00");

        ImportSummaryType summary = importLines("sku,name,price", "SKU9,New name,7.5");

        assertEquals(1, summary.updatedCount());
        Product updated = product("SKU9");
        assertEquals("New name", updated.name);
        assertEquals(new BigDecimal("7.50"), updated.price);
    }

    @Test
    public void testImport_invalidRowsAreSkippedAndReported() throws Exception {
        ImportSummaryType summary = importLines("sku,name,price", "OK1,Fine,1.00", ",Nameless,2.00", "BAD,Bad price,abc",
                "NEG,Negative,-3", "SHORT,Short", "FREE,Free,0");

        assertTrue(summary.success());
        assertEquals(6, summary.totalRows());
        assertEquals(2, summary.importedCount());
        assertEquals(4, summary.invalidCount());
        assertEquals(List.of("Row 2: Required fields (sku, name, price) cannot be empty",
                "Row 3: Price must be a valid non-negative number", "Row 4: Price must be a valid non-negative number",
                "Row 5: Missing required columns. Expected: sku, name, price"), summary.issues());
        assertEquals(summary.totalRows(),
                summary.importedCount() + summary.updatedCount() + summary.invalidCount() + summary.duplicateCount());
    }

    @Test
    public void testImport_hugeExponentPriceIsRowInvalid() throws Exception {
        ImportSummaryType summary = importLines("sku,name,price", "OK1,Fine,1.00", "HUGE,Huge,1E+2147483647",
                "OK2,Fine,2.00", "TINY,Tiny,1E-2147483647");

        assertTrue(summary.success());
        assertEquals(3, summary.importedCount());
        assertEquals(1, summary.invalidCount());
        assertEquals(List.of("Row 2: Price exceeds 9999999999.99"), summary.issues());
        assertEquals(new BigDecimal("0.00"), product("TINY").price);
    }

    @Test
    public void testImport_concurrentRunsOverSameSkusKeepOneRowEach() throws Exception {
        int skus = 50;
        List<String> lines = new ArrayList<>();
        lines.add("sku,name,price");
        for (int i = 1; i <= skus; i++) {
            lines.add(String.format("RACE%03d,Product %d,%d.50", i, i, i));
        }
        List<Path> csvs = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            Path csv = TestFixtures.writeCsv(lines.toArray(String[]::new));
            files.add(csv);
            csvs.add(csv);
        }

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(csvs.size());
        List<ImportSummaryType> summaries = new ArrayList<>();
        try {
            List<Future<ImportSummaryType>> futures = new ArrayList<>();
            for (Path csv : csvs) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return importService.importFile(csv, "products.csv");
                }));
            }
            start.countDown();
            for (Future<ImportSummaryType> future : futures) {
                summaries.add(future.get(60, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        int imported = 0;
        int updated = 0;
        for (ImportSummaryType summary : summaries) {
            assertTrue(summary.success(), () -> String.valueOf(summary.issues()));
            assertEquals(0, summary.invalidCount());
            imported += summary.importedCount();
            updated += summary.updatedCount();
        }
        assertEquals(skus, imported);
        assertEquals(2 * skus, imported + updated);
        assertEquals((long) skus, (long) QuarkusTransaction.requiringNew().call(() -> Product.count()));
        assertEquals(new BigDecimal("7.50"), product("RACE007").price);
    }

    @Test
    public void testImport_duplicatesDetectedAcrossBatches() throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add("sku,name,price");
        for (int i = 1; i <= 1001; i++) {
            lines.add(String.format("SKU%05d,Product %d,%d.99", i, i, i % 100));
        }
        lines.add("SKU00001,Late duplicate,1.00");

        ImportSummaryType summary = importLines(lines.toArray(String[]::new));

        assertEquals(1002, summary.totalRows());
        assertEquals(1001, summary.importedCount());
        assertEquals(1, summary.duplicateCount());
        assertEquals("Product 1", product("SKU00001").name);
    }

    @Test
    public void testImport_linksCaseInsensitiveFilenameOnce() throws Exception {
        Long uploadId = TestFixtures.createCompletedUpload("Photo.png", 256, 512, 1024);
        Long largest = TestFixtures.variantId(uploadId, 1024);

        ImportSummaryType first = importLines("sku,name,price,image", "IMG1,Pictured,10.00,photo.PNG");
        ImportSummaryType second = importLines("sku,name,price,image", "IMG1,Pictured,10.00,photo.PNG");

        assertEquals(1, first.imagesLinked());
        assertEquals(0, first.imagesNotFound());
        assertEquals(largest, product("IMG1").primaryImage.id);

        assertEquals(1, second.updatedCount());
        assertEquals(0, second.imagesLinked());
        assertEquals(largest, product("IMG1").primaryImage.id);
    }

    @Test
    public void testImport_basenameMatchIgnoresExtension() throws Exception {
        Long uploadId = TestFixtures.createCompletedUpload("LOGO.png", 256, 512, 1024);

        ImportSummaryType summary = importLines("sku,name,price,image", "L1,Logo,1.00,logo.jpg");

        assertEquals(1, summary.imagesLinked());
        assertEquals(TestFixtures.variantId(uploadId, 1024), product("L1").primaryImage.id);
    }

    @Test
    public void testImport_newestUploadWinsForSameName() throws Exception {
        TestFixtures.createCompletedUpload("shared.png", 256, 512, 1024);
        Long newer = TestFixtures.createCompletedUpload("shared.png", 256, 512, 1024);

        importLines("sku,name,price,image", "S1,Shared,1.00,shared.png");

        assertEquals(TestFixtures.variantId(newer, 1024), product("S1").primaryImage.id);
    }

    @Test
    public void testImport_unresolvedImagesAreReported() throws Exception {
        TestFixtures.createUpload("pending.png", UploadStatus.PROCESSING);
        TestFixtures.createCompletedUpload("empty.png");

        ImportSummaryType summary = importLines("sku,name,price,image", "M1,Missing,1.00,missing.png",
                "M2,Pending,1.00,pending.png", "M3,No variants,1.00,empty.png", "M4,No image,1.00,");

        assertTrue(summary.success());
        assertEquals(4, summary.importedCount());
        assertEquals(0, summary.imagesLinked());
        assertEquals(3, summary.imagesNotFound());
        assertEquals(List.of("Image not found for SKU 'M1': missing.png (upload not completed or doesn't exist)",
                "Image not found for SKU 'M2': pending.png (upload not completed or doesn't exist)",
                "No image variants found for SKU 'M3': empty.png"), summary.issues());
        assertNull(product("M1").primaryImage);
    }

    @Test
    public void testImport_withoutImageColumnSkipsLinking() throws Exception {
        TestFixtures.createCompletedUpload("photo.png", 256);

        ImportSummaryType summary = importLines("name,sku,price", "Reordered,R1,4.20");

        assertEquals(1, summary.importedCount());
        assertEquals(0, summary.imagesLinked());
        assertEquals(0, summary.imagesNotFound());
        assertEquals(new BigDecimal("4.20"), product("R1").price);
    }

    @Test
    public void testImport_missingColumnsRejectedBeforeProcessing() throws Exception {
        Path csv = TestFixtures.writeCsv("sku,title", "A,B");
        files.add(csv);

        CsvStructureException e = assertThrows(CsvStructureException.class,
                () -> importService.importFile(csv, "products.csv"));

        assertEquals("Missing required columns: name, price", e.getErrors().get(0));
        assertEquals(0L, (long) QuarkusTransaction.requiringNew().call(() -> Product.count()));
    }

    @Test
    public void testImport_malformedCsvIsFatal() throws Exception {
        ImportSummaryType summary = importLines("sku,name,price", "Q1,Fine,1.00", "Q2,\"unterminated,2.00");

        assertFalse(summary.success());
        assertEquals(1, summary.issues().size());
        assertTrue(summary.issues().get(0).startsWith("Fatal error: "), summary.issues().get(0));
    }
}
