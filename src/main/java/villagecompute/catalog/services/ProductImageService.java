/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ProductType;
import villagecompute.catalog.data.models.ImageVariant;
import villagecompute.catalog.data.models.Product;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.exceptions.ResourceNotFoundException;
import villagecompute.catalog.exceptions.ValidationException;

import java.util.Optional;

/**
 * Direct product/image operations outside the CSV flow.
 */
@ApplicationScoped
public class ProductImageService {

    private static final Logger LOG = Logger.getLogger(ProductImageService.class);

    /**
     * Result of an attach call.
     *
     * @param changed
     *            {@code false} when the product already referenced the chosen variant
     */
    public record AttachResult(ProductType product, boolean changed) {
    }

    /**
     * Sets the widest variant of a completed upload as the product's primary image.
     *
     * @param productId
     *            product primary key
     * @param uploadId
     *            upload primary key
     * @return updated product
     * @throws ResourceNotFoundException
     *             if the product or upload does not exist
     * @throws ValidationException
     *             if the upload is not completed or has no variants (nothing is changed)
     */
    @Transactional
    public AttachResult attachImage(Long productId, Long uploadId) {
        Product product = Product.findById(productId);
        if (product == null) {
            throw new ResourceNotFoundException("Product not found: " + productId);
        }
        Upload upload = Upload.findById(uploadId);
        if (upload == null) {
            throw new ResourceNotFoundException("Upload not found: " + uploadId);
        }
        if (upload.status != UploadStatus.COMPLETED) {
            throw new ValidationException("Upload is not yet completed");
        }

        Optional<ImageVariant> largest = ImageVariant.largest(ImageVariant.findByUploadId(uploadId));
        if (largest.isEmpty()) {
            throw new ValidationException("No images found for this upload");
        }

        boolean changed = product.assignPrimaryImage(largest.get());
        if (changed) {
            LOG.infof("Product %s primary image set to variant %d of upload %d", product.sku, largest.get().id,
                    uploadId);
        }
        return new AttachResult(ProductType.fromEntity(product), changed);
    }

    /**
     * Looks up a product by SKU.
     *
     * @throws ResourceNotFoundException
     *             if no product has that SKU
     */
    @Transactional
    public ProductType findBySku(String sku) {
        return Product.findBySku(sku).map(ProductType::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found: " + sku));
    }
}
