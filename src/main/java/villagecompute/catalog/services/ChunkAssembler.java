/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.services;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates the stored chunks of an upload strictly in index order and computes the SHA-256 of the result.
 */
@ApplicationScoped
public class ChunkAssembler {

    private static final Logger LOG = Logger.getLogger(ChunkAssembler.class);

    @Inject
    ChunkStore chunkStore;

    /**
     * Assembled file content and its checksum.
     *
     * @param bytes
     *            concatenated chunk bytes
     * @param checksum
     *            lowercase hex SHA-256 of {@code bytes}
     */
    public record AssembledFile(byte[] bytes, String checksum) {

        public boolean matches(String declaredChecksum) {
            return declaredChecksum != null && checksum.equalsIgnoreCase(declaredChecksum.trim());
        }
    }

    /**
     * Lists the chunk indices in {@code [0, totalChunks)} that have no stored object.
     *
     * @param uploadId
     *            upload primary key
     * @param totalChunks
     *            expected chunk count
     * @return missing indices in ascending order, empty when all are present
     */
    public List<Integer> findMissingChunks(long uploadId, int totalChunks) {
        List<Integer> missing = new ArrayList<>();
        for (int index = 0; index < totalChunks; index++) {
            if (!chunkStore.chunkExists(uploadId, index)) {
                missing.add(index);
            }
        }
        return missing;
    }

    /**
     * Reads chunks {@code 0..totalChunks-1} in ascending order into one buffer.
     *
     * @param uploadId
     *            upload primary key
     * @param totalChunks
     *            expected chunk count
     * @return assembled bytes with their SHA-256
     */
    public AssembledFile assemble(long uploadId, int totalChunks) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Hasher hasher = Hashing.sha256().newHasher();
        for (int index = 0; index < totalChunks; index++) {
            byte[] chunk = chunkStore.readChunk(uploadId, index);
            buffer.writeBytes(chunk);
            hasher.putBytes(chunk);
        }
        AssembledFile assembled = new AssembledFile(buffer.toByteArray(), hasher.hash().toString());
        LOG.debugf("Assembled upload %d from %d chunks (%d bytes)", uploadId, totalChunks, assembled.bytes().length);
        return assembled;
    }
}
