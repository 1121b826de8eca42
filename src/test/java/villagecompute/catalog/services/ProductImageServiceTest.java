/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.catalog.TestFixtures;
import villagecompute.catalog.api.types.ProductType;
import villagecompute.catalog.data.models.Product;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.exceptions.ResourceNotFoundException;
import villagecompute.catalog.exceptions.ValidationException;
import villagecompute.catalog.services.ProductImageService.AttachResult;
import villagecompute.catalog.testing.H2TestResource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for direct image attachment and product lookup.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class ProductImageServiceTest {

    @Inject
    ProductImageService productImageService;

    @BeforeEach
    public void setup() {
        TestFixtures.cleanDatabase();
    }

    private static Long primaryImageId(Long productId) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Product product = Product.findById(productId);
            return product.primaryImage == null ? null : product.primaryImage.id;
        });
    }

    @Test
    public void testAttachImage_usesWidestVariant() {
        Long productId = TestFixtures.createProduct("P1", "Product", "1.00");
        Long uploadId = TestFixtures.createCompletedUpload("p1.png", 512, 1024, 256);

        AttachResult result = productImageService.attachImage(productId, uploadId);

        assertTrue(result.changed());
        assertEquals(1024, result.product().primaryImage().width());
        assertEquals(TestFixtures.variantId(uploadId, 1024), primaryImageId(productId));
    }

    @Test
    public void testAttachImage_sameImageTwiceIsUnchanged() {
        Long productId = TestFixtures.createProduct("P1", "Product", "1.00");
        Long uploadId = TestFixtures.createCompletedUpload("p1.png", 256, 1024);

        productImageService.attachImage(productId, uploadId);
        AttachResult again = productImageService.attachImage(productId, uploadId);

        assertFalse(again.changed());
    }

    @Test
    public void testAttachImage_rejectsIncompleteUpload() {
        Long productId = TestFixtures.createProduct("P1", "Product", "1.00");
        Long uploadId = TestFixtures.createUpload("wip.png", UploadStatus.PROCESSING);

        ValidationException e = assertThrows(ValidationException.class,
                () -> productImageService.attachImage(productId, uploadId));

        assertEquals("Upload is not yet completed", e.getMessage());
        assertNull(primaryImageId(productId));
    }

    @Test
    public void testAttachImage_rejectsUploadWithoutVariants() {
        Long productId = TestFixtures.createProduct("P1", "Product", "1.00");
        Long uploadId = TestFixtures.createCompletedUpload("empty.png");

        ValidationException e = assertThrows(ValidationException.class,
                () -> productImageService.attachImage(productId, uploadId));

        assertEquals("No images found for this upload", e.getMessage());
        assertNull(primaryImageId(productId));
    }

    @Test
    public void testAttachImage_unknownIds() {
        Long productId = TestFixtures.createProduct("P1", "Product", "1.00");
        Long uploadId = TestFixtures.createCompletedUpload("p1.png", 256);

        assertThrows(ResourceNotFoundException.class, () -> productImageService.attachImage(999_999L, uploadId));
        assertThrows(ResourceNotFoundException.class, () -> productImageService.attachImage(productId, 999_999L));
    }

    @Test
    public void testFindBySku() {
        TestFixtures.createProduct("LOOKUP", "Lookup", "12.34");

        ProductType product = productImageService.findBySku("LOOKUP");

        assertEquals("Lookup", product.name());
        assertEquals(0, new java.math.BigDecimal("12.34").compareTo(product.price()));
        assertNull(product.primaryImage());
        assertThrows(ResourceNotFoundException.class, () -> productImageService.findBySku("NOPE"));
    }
}
