/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.catalog.api.types.ProcessingResultType;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.services.UploadProcessor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator endpoints that run variant processing synchronously, bypassing the job queue.
 */
@Path("/admin/api/uploads")
@Tag(
        name = "Admin - Uploads",
        description = "Operator tools for re-running variant processing")
@Produces(MediaType.APPLICATION_JSON)
public class UploadAdminResource {

    private static final Logger LOG = Logger.getLogger(UploadAdminResource.class);

    private static final int MAX_PENDING_LIMIT = 500;

    @Inject
    UploadProcessor uploadProcessor;

    /**
     * Re-runs processing for one upload. Terminal uploads are left unchanged.
     *
     * @param uploadId
     *            upload primary key
     * @return resulting status
     */
    @POST
    @Path("/{uploadId}/reprocess")
    @Operation(
            summary = "Reprocess an upload",
            description = "Runs assembly and variant generation now and returns the resulting status")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Processing ran"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Upload not found")})
    public Response reprocess(@Parameter(
            description = "Upload ID",
            required = true) @PathParam("uploadId") Long uploadId) {
        LOG.infof("Operator reprocess requested for upload %d", uploadId);
        Optional<UploadStatus> status = uploadProcessor.process(uploadId);
        if (status.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", "Upload not found: " + uploadId))
                    .build();
        }
        return Response.ok(new ProcessingResultType(uploadId, status.get().wireValue())).build();
    }

    /**
     * Processes uploads waiting in {@code processing}, oldest first.
     *
     * @param limit
     *            max uploads to process (1-500)
     * @return per-upload results
     */
    @POST
    @Path("/process-pending")
    @Operation(
            summary = "Process pending uploads",
            description = "Synchronously processes up to limit uploads in processing status")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Processing ran"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Bad request - limit out of range")})
    public Response processPending(@Parameter(
            description = "Maximum uploads to process") @QueryParam("limit") @DefaultValue("10") int limit) {
        if (limit < 1 || limit > MAX_PENDING_LIMIT) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "limit must be between 1 and " + MAX_PENDING_LIMIT)).build();
        }
        List<ProcessingResultType> results = uploadProcessor.processPending(limit);
        return Response.ok(Map.of("processed", results.size(), "results", results)).build();
    }
}
