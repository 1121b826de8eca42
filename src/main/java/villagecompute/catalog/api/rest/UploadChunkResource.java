/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ChunkReceiptType;
import villagecompute.catalog.api.types.ChunkUploadForm;
import villagecompute.catalog.api.types.UploadType;
import villagecompute.catalog.exceptions.ResourceNotFoundException;
import villagecompute.catalog.exceptions.UploadConflictException;
import villagecompute.catalog.exceptions.ValidationException;
import villagecompute.catalog.services.UploadLedger;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

/**
 * REST endpoints for resumable chunked image uploads.
 *
 * <p>
 * Clients split a file into {@code total_chunks} parts and submit each one with the SHA-256 of the whole file. The
 * final missing chunk flips the upload to processing and dispatches variant generation; progress and the processing
 * outcome are read back through {@code GET /api/uploads/{uploadId}}.
 *
 * @see UploadLedger
 */
@Path("/api/uploads")
@Tag(
        name = "Uploads",
        description = "Chunked image upload and upload status")
@Produces(MediaType.APPLICATION_JSON)
public class UploadChunkResource {

    private static final Logger LOG = Logger.getLogger(UploadChunkResource.class);

    @Inject
    UploadLedger uploadLedger;

    /**
     * Submits one chunk of an upload.
     *
     * @param form
     *            multipart form with checksum, chunk_index, total_chunks, original_name and chunk
     * @return chunk receipt
     */
    @POST
    @Path("/chunks")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(
            summary = "Submit an upload chunk",
            description = "Records one chunk. Resubmitting a chunk index is a no-op. The last missing chunk starts variant processing.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Chunk recorded",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ChunkReceiptType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Bad request - missing or invalid fields"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Conflict - total_chunks differs from the existing upload"),
                    @APIResponse(
                            responseCode = "500",
                            description = "Internal server error")})
    public Response submitChunk(ChunkUploadForm form) {
        if (form.chunkIndex == null || form.totalChunks == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "chunk_index and total_chunks are required")).build();
        }
        if (form.chunk == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", "Missing chunk parameter"))
                    .build();
        }

        try {
            byte[] bytes = Files.readAllBytes(form.chunk.uploadedFile());
            ChunkReceiptType receipt = uploadLedger.submitChunk(form.checksum, form.chunkIndex, form.totalChunks,
                    form.originalName, bytes);
            return Response.ok(receipt).build();

        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(Map.of("error", e.getMessage())).build();
        } catch (UploadConflictException e) {
            LOG.warnf("Rejected chunk %d for checksum %s: %s", form.chunkIndex, form.checksum, e.getMessage());
            return Response.status(Response.Status.CONFLICT).entity(Map.of("error", e.getMessage())).build();
        } catch (IOException e) {
            LOG.errorf(e, "Failed to read chunk %d for checksum %s", form.chunkIndex, form.checksum);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("error", "Failed to read chunk: " + e.getMessage())).build();
        }
    }

    /**
     * Returns upload status, received chunk indices and generated variants.
     *
     * @param uploadId
     *            upload primary key
     * @return upload details
     */
    @GET
    @Path("/{uploadId}")
    @Operation(
            summary = "Get upload status",
            description = "Returns status, progress, received chunk indices and variants of an upload")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Upload found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = UploadType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Upload not found")})
    public Response getUpload(@Parameter(
            description = "Upload ID",
            required = true) @PathParam("uploadId") Long uploadId) {
        try {
            return Response.ok(uploadLedger.describe(uploadId)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        }
    }
}
