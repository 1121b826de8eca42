/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.catalog.data.models.ImageVariant;
import villagecompute.catalog.data.models.Product;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.data.models.Upload.UploadStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves CSV image filenames against completed uploads and points products at the widest variant of the match.
 *
 * <p>
 * Completed uploads and their variants are loaded once per call, newest upload first, so when several uploads share a
 * name the most recent one wins. Matching follows {@link FilenameMatchTier}. Re-linking a product to the variant it
 * already references is a no-op and is not counted.
 *
 * <p>
 * Runs inside the caller's transaction (the import batch).
 */
@ApplicationScoped
public class ImageLinker {

    private static final Logger LOG = Logger.getLogger(ImageLinker.class);

    /**
     * Outcome of linking one batch.
     */
    public record LinkResult(int linkedCount, int notFoundCount, List<String> issues) {

        public static LinkResult empty() {
            return new LinkResult(0, 0, List.of());
        }
    }

    /**
     * Links images for one batch.
     *
     * @param imageNames
     *            SKU to requested filename, in row order; blank filenames are skipped
     * @param productsBySku
     *            managed products of the batch
     * @return counts and one issue per unresolved filename
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public LinkResult link(Map<String, String> imageNames, Map<String, Product> productsBySku) {
        if (imageNames.isEmpty()) {
            return LinkResult.empty();
        }

        List<Upload> completed = Upload.findByStatusWithVariants(UploadStatus.COMPLETED);

        int linked = 0;
        int notFound = 0;
        List<String> issues = new ArrayList<>();

        for (Map.Entry<String, String> entry : imageNames.entrySet()) {
            String sku = entry.getKey();
            String imageName = entry.getValue();
            if (imageName == null || imageName.isBlank()) {
                continue;
            }

            Product product = productsBySku.get(sku);
            if (product == null) {
                LOG.warnf("Product %s missing from its own batch, skipping image %s", sku, imageName);
                continue;
            }

            Optional<Upload> upload = FilenameMatchTier.resolve(imageName, completed, u -> u.originalName);
            if (upload.isEmpty()) {
                notFound++;
                issues.add("Image not found for SKU '" + sku + "': " + imageName
                        + " (upload not completed or doesn't exist)");
                continue;
            }

            Optional<ImageVariant> variant = ImageVariant.largest(upload.get().variants);
            if (variant.isEmpty()) {
                notFound++;
                issues.add("No image variants found for SKU '" + sku + "': " + imageName);
                continue;
            }

            if (product.assignPrimaryImage(variant.get())) {
                linked++;
                LOG.debugf("Linked product %s to variant %d of upload %d", sku, variant.get().id, upload.get().id);
            }
        }

        return new LinkResult(linked, notFound, issues);
    }
}
