/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.config;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI document metadata and tag groups for the upload, product and operator endpoints.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI Spec</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Catalog Ingest API",
                version = "1.0.0",
                description = """
                        Bulk ingestion of product images and product records.

                        ## Features
                        - **Uploads**: Resumable chunked image uploads keyed by content checksum
                        - **Variants**: Asynchronous assembly, checksum verification and resized JPEG variants
                        - **Products**: Streaming CSV import with upsert by SKU and filename-based image linking

                        ## Errors
                        Field validation failures return 400, checksum conflicts 409, missing resources 404 and
                        structurally invalid CSV files 422 with an `errors` array.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        email = "tcurran@villagecompute.com",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Uploads",
                description = "Chunked image upload and upload status"),
                @Tag(
                        name = "Products",
                        description = "CSV product import, product lookup and image attachment"),
                @Tag(
                        name = "Admin - Uploads",
                        description = "Operator tools for re-running variant processing"),
                @Tag(
                        name = "Admin - Samples",
                        description = "Sample CSV generation for import testing")})
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
