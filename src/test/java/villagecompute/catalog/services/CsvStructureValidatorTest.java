/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.catalog.TestFixtures;
import villagecompute.catalog.exceptions.CsvStructureException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the pre-flight CSV checks: file type, size, header presence and required columns.
 */
class CsvStructureValidatorTest {

    private CsvStructureValidator validator;
    private Path csv;

    @BeforeEach
    void setUp() {
        validator = new CsvStructureValidator();
        validator.maxFileSize = 1024;
    }

    @AfterEach
    void tearDown() throws IOException {
        if (csv != null) {
            Files.deleteIfExists(csv);
        }
    }

    @Test
    void testValidHeaderWithImage() throws Exception {
        csv = TestFixtures.writeCsv("sku,name,price,image", "A,B,1,a.png");

        ProductCsvHeader header = validator.validate(csv, "products.csv");

        assertEquals(0, header.skuIndex());
        assertEquals(3, header.imageIndex());
        assertTrue(header.hasImageColumn());
    }

    @Test
    void testTxtExtensionAccepted() throws Exception {
        csv = TestFixtures.writeCsv("sku,name,price");

        assertFalse(validator.validate(csv, "PRODUCTS.TXT").hasImageColumn());
    }

    @Test
    void testWrongFileType() throws Exception {
        csv = TestFixtures.writeCsv("sku,name,price");

        CsvStructureException e = assertThrows(CsvStructureException.class, () -> validator.validate(csv, "products.xlsx"));

        assertEquals(List.of("The csv field must be a file of type: csv, txt."), e.getErrors());
    }

    @Test
    void testFileTooLarge() throws Exception {
        csv = TestFixtures.writeCsv("sku,name,price", "A,".repeat(600) + "B,1");

        CsvStructureException e = assertThrows(CsvStructureException.class, () -> validator.validate(csv, "big.csv"));

        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).startsWith("File too large. Maximum size: 1 KB, Actual size: "),
                e.getErrors().get(0));
    }

    @Test
    void testEmptyFile() throws Exception {
        csv = Files.createTempFile("empty-", ".csv");

        CsvStructureException e = assertThrows(CsvStructureException.class, () -> validator.validate(csv, "empty.csv"));

        assertEquals(List.of("CSV file is empty or header row cannot be read"), e.getErrors());
    }

    @Test
    void testMissingColumns() throws Exception {
        csv = TestFixtures.writeCsv("sku,title,cost", "A,B,1");

        CsvStructureException e = assertThrows(CsvStructureException.class, () -> validator.validate(csv, "p.csv"));

        assertEquals(List.of("Missing required columns: name, price", "Found columns: sku, title, cost"), e.getErrors());
    }

    @Test
    void testNullFileNameSkipsTypeCheck() throws Exception {
        csv = TestFixtures.writeCsv("name,sku,price");

        ProductCsvHeader header = validator.validate(csv, null);

        assertEquals(1, header.skuIndex());
        assertEquals(0, header.nameIndex());
    }

    @Test
    void testFormatBytes() {
        assertEquals("512 B", CsvStructureValidator.formatBytes(512));
        assertEquals("1.50 KB", CsvStructureValidator.formatBytes(1536));
        assertEquals("100 MB", CsvStructureValidator.formatBytes(104857600));
    }
}
