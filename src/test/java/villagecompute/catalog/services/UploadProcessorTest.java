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
import villagecompute.catalog.api.types.ChunkReceiptType;
import villagecompute.catalog.api.types.ProcessingResultType;
import villagecompute.catalog.data.models.ImageVariant;
import villagecompute.catalog.data.models.Upload;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.services.StorageGateway.BucketType;
import villagecompute.catalog.testing.H2TestResource;
import villagecompute.catalog.testing.InMemoryStorageGateway;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for assembly, checksum verification and variant generation.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class UploadProcessorTest {

    @Inject
    UploadProcessor uploadProcessor;

    @Inject
    UploadLedger uploadLedger;

    @Inject
    InMemoryStorageGateway storage;

    @BeforeEach
    public void setup() {
        TestFixtures.cleanDatabase();
        storage.clear();
    }

    /**
     * Submits every chunk of {@code content} under {@code checksum}, leaving the upload in processing.
     */
    private Long submitAll(byte[] content, String checksum, int chunks, String name) {
        ChunkReceiptType receipt = null;
        List<byte[]> parts = TestFixtures.split(content, chunks);
        for (int i = 0; i < parts.size(); i++) {
            receipt = uploadLedger.submitChunk(checksum, i, chunks, name, parts.get(i));
        }
        assertEquals(ChunkReceiptType.STATUS_COMPLETED, receipt.status());
        return receipt.uploadId();
    }

    private static List<ImageVariant> variants(Long uploadId) {
        return QuarkusTransaction.requiringNew().call(() -> ImageVariant.findByUploadId(uploadId));
    }

    @Test
    public void testProcess_singleChunkProducesThreeVariants() {
        byte[] png = TestFixtures.pngBytes(800, 600);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 1, "photo.png");

        Optional<UploadStatus> status = uploadProcessor.process(uploadId);

        assertEquals(Optional.of(UploadStatus.COMPLETED), status);
        List<ImageVariant> variants = variants(uploadId);
        assertEquals(List.of(256, 512, 1024), variants.stream().map(v -> v.width).sorted().toList());
        for (ImageVariant variant : variants) {
            assertEquals(Math.round(variant.width * 0.75), variant.height);
            assertEquals(String.valueOf(variant.width), variant.variant);
            assertEquals(ChunkStore.variantKey(uploadId, variant.width), variant.path);
            assertEquals("image/jpeg", variant.contentType);

            byte[] stored = storage.download(BucketType.IMAGES, variant.path);
            assertEquals(variant.sizeBytes, stored.length);
            assertEquals(TestFixtures.sha256(stored), variant.checksum);
        }
        assertFalse(storage.exists(BucketType.CHUNKS, ChunkStore.assembledKey(uploadId)));
    }

    @Test
    public void testProcess_assemblesChunksInIndexOrder() {
        byte[] png = TestFixtures.pngBytes(300, 200);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 4, "multi.png");

        assertEquals(Optional.of(UploadStatus.COMPLETED), uploadProcessor.process(uploadId));
        assertEquals(3, variants(uploadId).size());
        assertEquals(341, variants(uploadId).stream().filter(v -> v.width == 512).findFirst()
                .orElseThrow().height);
    }

    @Test
    public void testProcess_isIdempotent() {
        byte[] png = TestFixtures.pngBytes(400, 400);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 1, "square.png");

        assertEquals(Optional.of(UploadStatus.COMPLETED), uploadProcessor.process(uploadId));
        assertEquals(Optional.of(UploadStatus.COMPLETED), uploadProcessor.process(uploadId));

        assertEquals(3, variants(uploadId).size());
        assertEquals(3, storage.keys(BucketType.IMAGES).size());
    }

    @Test
    public void testProcess_concurrentCallsProduceOneVariantSet() throws Exception {
        byte[] png = TestFixtures.pngBytes(640, 480);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 2, "race.png");

        int threads = 3;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<UploadStatus>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return uploadProcessor.process(uploadId);
                }));
            }
            start.countDown();
            for (Future<Optional<UploadStatus>> future : futures) {
                Optional<UploadStatus> result = future.get(60, TimeUnit.SECONDS);
                assertTrue(result.isPresent());
                assertNotEquals(UploadStatus.FAILED, result.get());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(UploadStatus.COMPLETED,
                QuarkusTransaction.requiringNew().call(() -> Upload.<Upload> findById(uploadId).status));
        assertEquals(3, variants(uploadId).size());
        assertEquals(3, storage.keys(BucketType.IMAGES).size());
    }

    @Test
    public void testProcess_checksumMismatchFails() {
        byte[] png = TestFixtures.pngBytes(100, 100);
        Long uploadId = submitAll(png, "0".repeat(64), 2, "tampered.png");

        assertEquals(Optional.of(UploadStatus.FAILED), uploadProcessor.process(uploadId));

        assertTrue(variants(uploadId).isEmpty());
        assertTrue(storage.keys(BucketType.IMAGES).isEmpty());
        assertFalse(storage.exists(BucketType.CHUNKS, ChunkStore.assembledKey(uploadId)));
    }

    @Test
    public void testProcess_missingChunkFails() {
        byte[] png = TestFixtures.pngBytes(100, 100);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 3, "lost.png");
        storage.delete(BucketType.CHUNKS, ChunkStore.chunkKey(uploadId, 1));

        assertEquals(Optional.of(UploadStatus.FAILED), uploadProcessor.process(uploadId));
        assertTrue(variants(uploadId).isEmpty());
    }

    @Test
    public void testProcess_undecodableContentFails() {
        byte[] text = "not an image at all".getBytes(StandardCharsets.UTF_8);
        Long uploadId = submitAll(text, TestFixtures.sha256(text), 1, "notes.png");

        assertEquals(Optional.of(UploadStatus.FAILED), uploadProcessor.process(uploadId));
        assertTrue(variants(uploadId).isEmpty());
    }

    @Test
    public void testProcess_terminalUploadIsUntouched() {
        Long uploadId = TestFixtures.createUpload("old.png", UploadStatus.FAILED);

        assertEquals(Optional.of(UploadStatus.FAILED), uploadProcessor.process(uploadId));
        assertTrue(variants(uploadId).isEmpty());
    }

    @Test
    public void testProcess_uploadingUploadIsSkipped() {
        ChunkReceiptType receipt = uploadLedger.submitChunk("b".repeat(64), 0, 2, "half.png", new byte[] {1, 2});

        assertEquals(Optional.of(UploadStatus.UPLOADING), uploadProcessor.process(receipt.uploadId()));
    }

    @Test
    public void testProcess_missingUpload() {
        assertTrue(uploadProcessor.process(424_242L).isEmpty());
    }

    @Test
    public void testProcess_keepsExistingVariantRows() {
        byte[] png = TestFixtures.pngBytes(512, 256);
        Long uploadId = submitAll(png, TestFixtures.sha256(png), 1, "partial.png");
        QuarkusTransaction.requiringNew().run(() -> {
            ImageVariant existing = new ImageVariant();
            existing.upload = Upload.findById(uploadId);
            existing.variant = "256";
            existing.path = ChunkStore.variantKey(uploadId, 256);
            existing.width = 256;
            existing.height = 128;
            existing.checksum = "earlier-run";
            existing.sizeBytes = 1;
            existing.contentType = "image/jpeg";
            existing.createdAt = Instant.now();
            existing.persist();
        });

        assertEquals(Optional.of(UploadStatus.COMPLETED), uploadProcessor.process(uploadId));

        List<ImageVariant> variants = variants(uploadId);
        assertEquals(3, variants.size());
        assertEquals("earlier-run",
                variants.stream().filter(v -> v.width == 256).findFirst().orElseThrow().checksum);
        assertFalse(storage.exists(BucketType.IMAGES, ChunkStore.variantKey(uploadId, 256)));
    }

    @Test
    public void testProcessPending_runsEveryProcessingUpload() {
        byte[] first = TestFixtures.pngBytes(120, 60);
        byte[] second = TestFixtures.pngBytes(60, 120);
        Long firstId = submitAll(first, TestFixtures.sha256(first), 1, "first.png");
        Long secondId = submitAll(second, TestFixtures.sha256(second), 1, "second.png");

        List<ProcessingResultType> results = uploadProcessor.processPending(10);

        assertEquals(2, results.size());
        assertTrue(results.contains(new ProcessingResultType(firstId, "completed")));
        assertTrue(results.contains(new ProcessingResultType(secondId, "completed")));
        assertTrue(uploadProcessor.processPending(10).isEmpty());
    }
}
