/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import villagecompute.catalog.data.models.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Validates one CSV data row against a resolved {@link ProductCsvHeader}.
 *
 * <p>
 * A row is invalid when it is shorter than the required columns, when sku, name or price is blank after trimming,
 * when the price is not a non-negative number, or when a value does not fit its column. Prices are rounded half up
 * to two decimals.
 */
public final class ProductRowParser {

    /**
     * Largest price NUMERIC(12,2) can hold.
     */
    public static final BigDecimal MAX_PRICE = new BigDecimal("9999999999.99");

    private static final int MAX_INTEGER_DIGITS = 10;

    private static final BigDecimal ZERO_PRICE = BigDecimal.ZERO.setScale(2);

    private ProductRowParser() {
        // Utility class, no instantiation
    }

    /**
     * A surviving row.
     *
     * @param imageName
     *            trimmed image filename, {@code null} when the file has no image column or the cell is blank
     */
    public record ProductRow(String sku, String name, BigDecimal price, String imageName) {
    }

    /**
     * Parse outcome: exactly one of {@code row} and {@code error} is set.
     */
    public record ParsedRow(ProductRow row, String error) {

        public boolean isValid() {
            return row != null;
        }

        static ParsedRow valid(ProductRow row) {
            return new ParsedRow(row, null);
        }

        static ParsedRow invalid(String error) {
            return new ParsedRow(null, error);
        }
    }

    /**
     * Parses one row.
     *
     * @param fields
     *            raw CSV fields
     * @param header
     *            resolved column positions
     * @param rowNumber
     *            1-based data row number (the header is not counted), used in messages
     * @return the valid row or a {@code "Row N: ..."} error
     */
    public static ParsedRow parse(String[] fields, ProductCsvHeader header, int rowNumber) {
        String prefix = "Row " + rowNumber + ": ";

        if (fields == null || fields.length < header.minimumFieldCount()) {
            return ParsedRow.invalid(prefix + "Missing required columns. Expected: "
                    + String.join(", ", ProductCsvHeader.REQUIRED_COLUMNS));
        }

        String sku = trim(fields[header.skuIndex()]);
        String name = trim(fields[header.nameIndex()]);
        String rawPrice = trim(fields[header.priceIndex()]);

        if (sku.isEmpty() || name.isEmpty() || rawPrice.isEmpty()) {
            return ParsedRow.invalid(prefix + "Required fields (sku, name, price) cannot be empty");
        }
        if (sku.length() > Product.MAX_SKU_LENGTH) {
            return ParsedRow.invalid(prefix + "SKU exceeds " + Product.MAX_SKU_LENGTH + " characters");
        }
        if (name.length() > Product.MAX_NAME_LENGTH) {
            return ParsedRow.invalid(prefix + "Name exceeds " + Product.MAX_NAME_LENGTH + " characters");
        }

        BigDecimal price;
        try {
            price = new BigDecimal(rawPrice);
        } catch (NumberFormatException e) {
            return ParsedRow.invalid(prefix + "Price must be a valid non-negative number");
        }
        if (price.signum() < 0) {
            return ParsedRow.invalid(prefix + "Price must be a valid non-negative number");
        }
        // exponent notation can carry a scale near Integer.MIN_VALUE or MAX_VALUE; bound it before rescaling
        long integerDigits = (long) price.precision() - price.scale();
        if (price.signum() > 0 && integerDigits > MAX_INTEGER_DIGITS) {
            return ParsedRow.invalid(prefix + "Price exceeds " + MAX_PRICE.toPlainString());
        }
        if (price.signum() == 0 || integerDigits < -2) {
            price = ZERO_PRICE;
        } else {
            try {
                price = price.setScale(2, RoundingMode.HALF_UP);
            } catch (ArithmeticException e) {
                return ParsedRow.invalid(prefix + "Price must be a valid non-negative number");
            }
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            return ParsedRow.invalid(prefix + "Price exceeds " + MAX_PRICE.toPlainString());
        }

        String imageName = null;
        if (header.hasImageColumn() && fields.length > header.imageIndex()) {
            String cell = trim(fields[header.imageIndex()]);
            imageName = cell.isEmpty() ? null : cell;
        }

        return ParsedRow.valid(new ProductRow(sku, name, price, imageName));
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
