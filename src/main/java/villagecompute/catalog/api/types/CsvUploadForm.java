/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.types;

import org.jboss.resteasy.reactive.PartType;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Multipart form for CSV file uploads to the product import endpoint.
 *
 * <p>
 * Accepts CSV files with header {@code sku,name,price[,image]}. The file size cap is
 * {@code catalog.import.max-file-size}; the HTTP body limit is {@code quarkus.http.limits.max-body-size}.
 */
public class CsvUploadForm {

    /**
     * Uploaded CSV file.
     */
    @FormParam("csv")
    @PartType(MediaType.APPLICATION_OCTET_STREAM)
    public FileUpload csv;
}
