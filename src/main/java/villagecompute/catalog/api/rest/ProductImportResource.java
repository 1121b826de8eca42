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
import org.jboss.resteasy.reactive.multipart.FileUpload;
import villagecompute.catalog.api.types.CsvUploadForm;
import villagecompute.catalog.api.types.ImportSummaryType;
import villagecompute.catalog.api.types.ProductType;
import villagecompute.catalog.exceptions.CsvStructureException;
import villagecompute.catalog.exceptions.ResourceNotFoundException;
import villagecompute.catalog.exceptions.ValidationException;
import villagecompute.catalog.services.ProductImageService;
import villagecompute.catalog.services.ProductImageService.AttachResult;
import villagecompute.catalog.services.ProductImportService;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for bulk product import and product image assignment.
 *
 * <p>
 * Workflow:
 * <ol>
 * <li>{@code POST /api/products/import} - Import a CSV file synchronously, returns the run summary</li>
 * <li>{@code POST /api/products/{productId}/attach-image/{uploadId}} - Point a product at an upload's widest
 * variant</li>
 * <li>{@code GET /api/products/{sku}} - Look up a product with its primary image</li>
 * </ol>
 *
 * <p>
 * <b>CSV Format:</b>
 * <ul>
 * <li>sku (required): Unique product key, upserted</li>
 * <li>name (required): Product name</li>
 * <li>price (required): Non-negative decimal</li>
 * <li>image (optional): Original filename of a completed upload</li>
 * </ul>
 *
 * @see ProductImportService
 */
@Path("/api/products")
@Tag(
        name = "Products",
        description = "CSV product import, product lookup and image attachment")
@Produces(MediaType.APPLICATION_JSON)
public class ProductImportResource {

    private static final Logger LOG = Logger.getLogger(ProductImportResource.class);

    @Inject
    ProductImportService importService;

    @Inject
    ProductImageService productImageService;

    /**
     * Imports products from an uploaded CSV file.
     *
     * @param form
     *            multipart form with the {@code csv} file
     * @return {@code {success, data}} with the run summary, or 422 {@code {success:false, errors}} for structural
     *         failures
     */
    @POST
    @Path("/import")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @Operation(
            summary = "Import products from CSV",
            description = "Streams the CSV in batches, upserting by SKU and linking images by filename")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Import ran; see data for counts and issues",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "422",
                            description = "Unprocessable - wrong file type, oversize, empty or missing required columns")})
    public Response importProducts(CsvUploadForm form) {
        FileUpload file = form.csv;
        if (file == null) {
            return Response.status(422).entity(Map.of("success", false, "errors", List.of("The csv field is required.")))
                    .build();
        }

        try {
            ImportSummaryType summary = importService.importFile(file.uploadedFile(), file.fileName());
            return Response.ok(Map.of("success", summary.success(), "data", summary)).build();
        } catch (CsvStructureException e) {
            LOG.infof("Rejected CSV %s: %s", file.fileName(), e.getErrors());
            return Response.status(422).entity(Map.of("success", false, "errors", e.getErrors())).build();
        }
    }

    /**
     * Sets the widest variant of a completed upload as a product's primary image.
     *
     * @param productId
     *            product primary key
     * @param uploadId
     *            upload primary key
     * @return updated product
     */
    @POST
    @Path("/{productId}/attach-image/{uploadId}")
    @Operation(
            summary = "Attach an uploaded image to a product",
            description = "Requires a completed upload with at least one variant; the widest variant is used")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Image attached",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ProductType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Product or upload not found"),
                    @APIResponse(
                            responseCode = "422",
                            description = "Upload not completed or has no variants")})
    public Response attachImage(@Parameter(
            description = "Product ID",
            required = true) @PathParam("productId") Long productId,
            @Parameter(
                    description = "Upload ID",
                    required = true) @PathParam("uploadId") Long uploadId) {
        try {
            AttachResult result = productImageService.attachImage(productId, uploadId);
            return Response.ok(result.product()).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(422).entity(Map.of("error", e.getMessage())).build();
        }
    }

    /**
     * Looks up a product by SKU.
     */
    @GET
    @Path("/{sku}")
    @Operation(
            summary = "Get product by SKU")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Product found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ProductType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Product not found")})
    public Response getProduct(@PathParam("sku") String sku) {
        try {
            return Response.ok(productImageService.findBySku(sku)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(Map.of("error", e.getMessage())).build();
        }
    }
}
