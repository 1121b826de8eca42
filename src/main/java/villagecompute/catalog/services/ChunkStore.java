/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.catalog.services.StorageGateway.BucketType;

/**
 * Path-addressable staging area for upload chunks, assembled files and generated variants.
 *
 * <p>
 * All keys derive deterministically from the upload id (and chunk index or width), never from random values, so a
 * reprocessing run finds exactly the objects a previous run wrote.
 *
 * <p>
 * <b>Key layout:</b>
 * <ul>
 * <li>{@code uploads/chunks/{uploadId}/{index}} in the chunks bucket</li>
 * <li>{@code uploads/assembled/{uploadId}} in the chunks bucket</li>
 * <li>{@code images/{uploadId}_{width}.jpg} in the images bucket</li>
 * </ul>
 */
@ApplicationScoped
public class ChunkStore {

    private static final Logger LOG = Logger.getLogger(ChunkStore.class);

    private static final String OCTET_STREAM = "application/octet-stream";

    @Inject
    StorageGateway storageGateway;

    public static String chunkKey(long uploadId, int index) {
        return "uploads/chunks/" + uploadId + "/" + index;
    }

    public static String assembledKey(long uploadId) {
        return "uploads/assembled/" + uploadId;
    }

    public static String variantKey(long uploadId, int width) {
        return "images/" + uploadId + "_" + width + ".jpg";
    }

    /**
     * Stores chunk bytes unless an object already exists for this (upload, index). The first write wins.
     *
     * @return {@code true} if the bytes were written, {@code false} if an earlier chunk was kept
     */
    public boolean storeChunkIfAbsent(long uploadId, int index, byte[] bytes) {
        String key = chunkKey(uploadId, index);
        if (storageGateway.exists(BucketType.CHUNKS, key)) {
            LOG.debugf("Chunk %s already stored, keeping first write", key);
            return false;
        }
        storageGateway.put(BucketType.CHUNKS, key, bytes, OCTET_STREAM);
        return true;
    }

    public boolean chunkExists(long uploadId, int index) {
        return storageGateway.exists(BucketType.CHUNKS, chunkKey(uploadId, index));
    }

    public byte[] readChunk(long uploadId, int index) {
        return storageGateway.download(BucketType.CHUNKS, chunkKey(uploadId, index));
    }

    public void storeAssembled(long uploadId, byte[] bytes) {
        storageGateway.put(BucketType.CHUNKS, assembledKey(uploadId), bytes, OCTET_STREAM);
    }

    public void discardAssembled(long uploadId) {
        storageGateway.delete(BucketType.CHUNKS, assembledKey(uploadId));
    }

    /**
     * Stores encoded variant bytes at the variant's deterministic key.
     *
     * @return the object key written
     */
    public String storeVariant(long uploadId, int width, byte[] bytes, String contentType) {
        String key = variantKey(uploadId, width);
        storageGateway.put(BucketType.IMAGES, key, bytes, contentType);
        return key;
    }
}
