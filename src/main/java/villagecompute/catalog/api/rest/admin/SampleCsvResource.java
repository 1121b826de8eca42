/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.rest.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.catalog.services.SampleCsvService;

import java.util.Map;

/**
 * Sample CSV downloads for exercising the product import.
 */
@Path("/admin/api/samples")
@Tag(
        name = "Admin - Samples",
        description = "Sample CSV generation for import testing")
public class SampleCsvResource {

    static final String TEXT_CSV = "text/csv";

    private static final int MAX_ROWS = 100_000;

    @Inject
    SampleCsvService sampleCsvService;

    @GET
    @Path("/products.csv")
    @Produces({TEXT_CSV, MediaType.APPLICATION_JSON})
    @Operation(
            summary = "Download a sample product CSV",
            description = "with_images=true references the most recent completed uploads; otherwise rows synthetic products are generated")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "CSV body"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Bad request - limit or rows out of range")})
    public Response productsCsv(@Parameter(
            description = "Reference completed uploads in an image column") @QueryParam("with_images") @DefaultValue("false") boolean withImages,
            @Parameter(
                    description = "Uploads to reference when with_images=true") @QueryParam("limit") @DefaultValue("10") int limit,
            @Parameter(
                    description = "Synthetic rows when with_images=false") @QueryParam("rows") @DefaultValue("100") int rows) {
        int requested = withImages ? limit : rows;
        if (requested < 1 || requested > MAX_ROWS) {
            return Response.status(Response.Status.BAD_REQUEST).type(MediaType.APPLICATION_JSON)
                    .entity(Map.of("error", (withImages ? "limit" : "rows") + " must be between 1 and " + MAX_ROWS))
                    .build();
        }

        String csv = withImages ? sampleCsvService.csvWithImages(limit) : sampleCsvService.syntheticCsv(rows);
        String fileName = withImages ? "products-with-images.csv" : "products-" + rows + ".csv";
        return Response.ok(csv, TEXT_CSV).header("Content-Disposition", "attachment; filename=\"" + fileName + "\"")
                .build();
    }
}
