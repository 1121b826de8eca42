/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.rest;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.catalog.TestFixtures;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.testing.H2TestResource;

import java.nio.charset.StandardCharsets;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for ProductImportResource REST endpoints.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class ProductImportResourceTest {

    @BeforeEach
    public void setup() {
        TestFixtures.cleanDatabase();
    }

    private static byte[] csv(String... lines) {
        return (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testImport_returnsSummary() {
        given().multiPart("csv", "products.csv",
                csv("sku,name,price", "SKU001,Widget,19.99", "SKU001,Widget2,29.99", "SKU002,Gadget,9.99"),
                "text/csv").when().post("/api/products/import").then().statusCode(200).contentType(ContentType.JSON)
                .body("success", equalTo(true)).body("data.total_rows", equalTo(3))
                .body("data.imported_count", equalTo(2)).body("data.updated_count", equalTo(0))
                .body("data.duplicate_count", equalTo(1)).body("data.invalid_count", equalTo(0))
                .body("data.issues", contains("Duplicate SKU in CSV: SKU001"));
    }

    @Test
    public void testImport_missingColumnsIsUnprocessable() {
        given().multiPart("csv", "products.csv", csv("sku,title", "A,B"), "text/csv").when()
                .post("/api/products/import").then().statusCode(422).body("success", equalTo(false))
                .body("errors", contains("Missing required columns: name, price", "Found columns: sku, title"));
    }

    @Test
    public void testImport_wrongFileTypeIsUnprocessable() {
        given().multiPart("csv", "products.json", csv("sku,name,price"), "application/json").when()
                .post("/api/products/import").then().statusCode(422)
                .body("errors", contains("The csv field must be a file of type: csv, txt."));
    }

    @Test
    public void testImport_missingFileIsUnprocessable() {
        given().multiPart("other", "value").when().post("/api/products/import").then().statusCode(422)
                .body("success", equalTo(false)).body("errors", hasSize(1));
    }

    @Test
    public void testAttachImage_andLookup() {
        Long productId = TestFixtures.createProduct("ATT1", "Attachable", "3.00");
        Long uploadId = TestFixtures.createCompletedUpload("att.png", 256, 512, 1024);

        given().when().post("/api/products/" + productId + "/attach-image/" + uploadId).then().statusCode(200)
                .body("sku", equalTo("ATT1")).body("primary_image.width", equalTo(1024))
                .body("primary_image.variant", equalTo("1024"));

        given().when().get("/api/products/ATT1").then().statusCode(200).body("name", equalTo("Attachable"))
                .body("primary_image.upload_id", equalTo(uploadId.intValue()));
    }

    @Test
    public void testAttachImage_errors() {
        Long productId = TestFixtures.createProduct("ATT2", "Attachable", "3.00");
        Long pending = TestFixtures.createUpload("pending.png", UploadStatus.PROCESSING);
        Long empty = TestFixtures.createCompletedUpload("empty.png");

        given().when().post("/api/products/" + productId + "/attach-image/" + pending).then().statusCode(422)
                .body("error", equalTo("Upload is not yet completed"));
        given().when().post("/api/products/" + productId + "/attach-image/" + empty).then().statusCode(422)
                .body("error", equalTo("No images found for this upload"));
        given().when().post("/api/products/" + productId + "/attach-image/999999").then().statusCode(404);
        given().when().post("/api/products/999999/attach-image/" + empty).then().statusCode(404);
    }

    @Test
    public void testGetProduct_notFound() {
        given().when().get("/api/products/UNKNOWN").then().statusCode(404).body("error", notNullValue());
    }
}
