/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import org.jboss.resteasy.reactive.PartType;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Multipart form for one chunk of a chunked image upload.
 *
 * <p>
 * The client splits a file into {@code total_chunks} slices and posts each one with the SHA-256 checksum of the whole
 * file. Slices may arrive in any order and may be resent.
 */
public class ChunkUploadForm {

    /**
     * SHA-256 of the complete file, hex encoded (max 64 characters).
     */
    @FormParam("checksum")
    @PartType(MediaType.TEXT_PLAIN)
    public String checksum;

    /**
     * Zero-based index of this chunk.
     */
    @FormParam("chunk_index")
    @PartType(MediaType.TEXT_PLAIN)
    public Integer chunkIndex;

    @FormParam("total_chunks")
    @PartType(MediaType.TEXT_PLAIN)
    public Integer totalChunks;

    @FormParam("original_name")
    @PartType(MediaType.TEXT_PLAIN)
    public String originalName;

    /**
     * Chunk bytes.
     */
    @FormParam("chunk")
    @PartType(MediaType.APPLICATION_OCTET_STREAM)
    public FileUpload chunk;
}
