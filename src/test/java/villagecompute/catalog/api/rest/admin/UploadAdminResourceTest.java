/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.catalog.api.rest.admin;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.catalog.TestFixtures;
import villagecompute.catalog.data.models.Upload.UploadStatus;
import villagecompute.catalog.testing.H2TestResource;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for UploadAdminResource REST endpoints.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class UploadAdminResourceTest {

    @BeforeEach
    public void setup() {
        TestFixtures.cleanDatabase();
    }

    private static int uploadImage(String name, int width, int height) {
        byte[] png = TestFixtures.pngBytes(width, height);
        return given().multiPart("checksum", TestFixtures.sha256(png)).multiPart("chunk_index", "0")
                .multiPart("total_chunks", "1").multiPart("original_name", name)
                .multiPart("chunk", "blob", png, "application/octet-stream").when().post("/api/uploads/chunks")
                .then().statusCode(200).body("status", equalTo("completed")).extract().path("upload_id");
    }

    @Test
    public void testReprocess_completesUpload() {
        int uploadId = uploadImage("admin.png", 600, 400);

        given().when().post("/admin/api/uploads/" + uploadId + "/reprocess").then().statusCode(200)
                .body("upload_id", equalTo(uploadId)).body("status", equalTo("completed"));

        given().when().get("/api/uploads/" + uploadId).then().statusCode(200).body("status", equalTo("completed"))
                .body("variants.width", contains(256, 512, 1024)).body("variants.height", contains(171, 341, 683));
    }

    @Test
    public void testReprocess_terminalUploadKeepsStatus() {
        Long failed = TestFixtures.createUpload("broken.png", UploadStatus.FAILED);

        given().when().post("/admin/api/uploads/" + failed + "/reprocess").then().statusCode(200)
                .body("status", equalTo("failed"));
    }

    @Test
    public void testReprocess_unknownUpload() {
        given().when().post("/admin/api/uploads/424242/reprocess").then().statusCode(404)
                .body("error", equalTo("Upload not found: 424242"));
    }

    @Test
    public void testProcessPending_drainsProcessingUploads() {
        uploadImage("one.png", 40, 40);
        uploadImage("two.png", 50, 20);

        given().queryParam("limit", 5).when().post("/admin/api/uploads/process-pending").then().statusCode(200)
                .body("processed", equalTo(2)).body("results.status", everyItem(equalTo("completed")));

        given().when().post("/admin/api/uploads/process-pending").then().statusCode(200)
                .body("processed", equalTo(0)).body("results", empty());
    }

    @Test
    public void testProcessPending_limitOutOfRange() {
        given().queryParam("limit", 0).when().post("/admin/api/uploads/process-pending").then().statusCode(400)
                .body("error", containsString("limit"));
        given().queryParam("limit", 501).when().post("/admin/api/uploads/process-pending").then().statusCode(400);
    }
}
