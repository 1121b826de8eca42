/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.Product;
import villagecompute.catalog.services.ImageLinker.LinkResult;
import villagecompute.catalog.services.ProductRowParser.ProductRow;
import villagecompute.catalog.util.PersistenceErrors;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts one batch of validated, de-duplicated rows by SKU in its own transaction, then links images in that same
 * transaction.
 *
 * <p>
 * Existing rows are loaded with a write lock in one query, which both classifies each row as new or existing before
 * writing and serializes concurrent imports touching the same SKUs. Existing products get name, price and timestamp
 * overwritten; the rest are inserted. If a concurrent import inserts one of the new SKUs first, the unique constraint
 * rejects this batch and it is retried once in a fresh transaction, where that SKU is now seen as existing.
 */
@ApplicationScoped
public class ProductBatchWriter {

    private static final Logger LOG = Logger.getLogger(ProductBatchWriter.class);

    @Inject
    ImageLinker imageLinker;

    /**
     * Result of one committed batch.
     */
    public record BatchResult(int importedCount, int updatedCount, LinkResult links) {
    }

    /**
     * Writes a batch.
     *
     * @param rows
     *            rows with distinct SKUs
     * @param linkImages
     *            whether the file carries an image column
     * @return counts for the committed batch
     */
    public BatchResult write(List<ProductRow> rows, boolean linkImages) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> upsert(rows, linkImages));
        } catch (RuntimeException e) {
            if (!PersistenceErrors.isUniqueViolation(e)) {
                throw e;
            }
            LOG.warnf("Concurrent insert detected for a batch of %d rows, retrying once", rows.size());
            return QuarkusTransaction.requiringNew().call(() -> upsert(rows, linkImages));
        }
    }

    private BatchResult upsert(List<ProductRow> rows, boolean linkImages) {
        Map<String, ProductRow> bySku = new LinkedHashMap<>();
        for (ProductRow row : rows) {
            bySku.put(row.sku(), row);
        }

        Map<String, Product> products = new HashMap<>();
        for (Product existing : Product.findBySkusForUpdate(bySku.keySet())) {
            products.put(existing.sku, existing);
        }
        int updated = products.size();
        int imported = 0;

        for (ProductRow row : bySku.values()) {
            Product product = products.get(row.sku());
            if (product != null) {
                product.overwrite(row.name(), row.price());
            } else {
                products.put(row.sku(), Product.create(row.sku(), row.name(), row.price()));
                imported++;
            }
        }
        Product.flush();

        LinkResult links = LinkResult.empty();
        if (linkImages) {
            Map<String, String> imageNames = new LinkedHashMap<>();
            for (ProductRow row : bySku.values()) {
                if (row.imageName() != null) {
                    imageNames.put(row.sku(), row.imageName());
                }
            }
            links = imageLinker.link(imageNames, products);
        }

        LOG.debugf("Batch committed: %d imported, %d updated, %d images linked", imported, updated,
                links.linkedCount());
        return new BatchResult(imported, updated, links);
    }
}
