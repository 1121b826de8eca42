/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Column positions resolved from a product CSV header.
 *
 * <p>
 * Required columns ({@code sku}, {@code name}, {@code price}) are matched case-sensitively after trimming; the
 * optional {@code image} column is matched case-insensitively. A UTF-8 byte order mark on the first cell is ignored.
 *
 * @param imageIndex
 *            position of the image column, or {@code -1} when the file has none
 */
public record ProductCsvHeader(int skuIndex, int nameIndex, int priceIndex, int imageIndex) {

    public static final List<String> REQUIRED_COLUMNS = List.of("sku", "name", "price");
    public static final String IMAGE_COLUMN = "image";

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public boolean hasImageColumn() {
        return imageIndex >= 0;
    }

    /**
     * Smallest field count a row needs to carry every required column.
     */
    public int minimumFieldCount() {
        return Math.max(skuIndex, Math.max(nameIndex, priceIndex)) + 1;
    }

    /**
     * Normalizes raw header cells: strips the byte order mark and surrounding whitespace.
     */
    public static List<String> normalize(String[] rawHeader) {
        List<String> cells = new ArrayList<>(rawHeader.length);
        for (int i = 0; i < rawHeader.length; i++) {
            String cell = rawHeader[i] == null ? "" : rawHeader[i];
            if (i == 0 && !cell.isEmpty() && cell.charAt(0) == BYTE_ORDER_MARK) {
                cell = cell.substring(1);
            }
            cells.add(cell.trim());
        }
        return cells;
    }

    /**
     * Required columns absent from the normalized header, in declaration order.
     */
    public static List<String> missingColumns(List<String> header) {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!header.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * Resolves positions from a normalized header that contains every required column.
     *
     * @throws IllegalArgumentException
     *             if a required column is missing
     */
    public static ProductCsvHeader resolve(List<String> header) {
        List<String> missing = missingColumns(header);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required columns: " + String.join(", ", missing));
        }
        int imageIndex = -1;
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).equals(IMAGE_COLUMN)) {
                imageIndex = i;
                break;
            }
        }
        return new ProductCsvHeader(header.indexOf("sku"), header.indexOf("name"), header.indexOf("price"),
                imageIndex);
    }
}
