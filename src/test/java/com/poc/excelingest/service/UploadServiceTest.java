package com.poc.excelingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.model.SchemaRegistry;
import com.poc.excelingest.parse.WorkbookParser;
import com.poc.excelingest.schema.SchemaRegistryLoader;
import com.poc.excelingest.support.TestWorkbooks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class UploadServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private UploadService uploadService;

    @BeforeEach
    void setUp() {
        SchemaRegistry registry = new SchemaRegistryLoader(objectMapper)
                .load("classpath*:schemas/*.json", Map.of());
        uploadService = new UploadService(ExcelProcessor.withDefaults(ExcelParseConfig.defaults(), registry),
                new LocalFileStorageService(tempDir.resolve("store").toString()), objectMapper);
    }

    private Path upload(Object incidence) throws Exception {
        return TestWorkbooks.workbook()
                .pairs(WorkbookParser.METADATA_TAB, Map.of("sector", "Landfill"))
                .pairs(WorkbookParser.SCHEMA_TAB, Map.of("Test Form", "test_form_v01"))
                .cell("Test Form", "B5", "Facility Name").cell("Test Form", "C5", "Sunny Acres")
                .cell("Test Form", "B6", "Incidence ID").cell("Test Form", "C6", incidence)
                .write(tempDir.resolve("upload.xlsx"));
    }

    @Test
    @DisplayName("an accepted upload is stored and its content returned")
    @SuppressWarnings("unchecked")
    void acceptedUpload() throws Exception {
        Path source = upload(42);

        Map<String, Object> response;
        try (InputStream in = Files.newInputStream(source)) {
            response = uploadService.processUpload(in, "C:\\Users\\me\\feedback_20240101120000.xlsx");
        }

        assertThat(response).containsEntry("status", "SUCCESS").containsKeys("checksum", "warningCount");
        Path stored = Paths.get((String) response.get("storedPath"));
        assertThat(stored).exists();
        assertThat(stored.getParent().getFileName().toString()).isEqualTo("Inbound_Processing");
        assertThat(stored.getFileName().toString()).matches("feedback_\\d{14}\\.xlsx");
        assertThat((Map<String, Object>) response.get("metadata")).containsEntry("sector", "Landfill");
        Map<String, Object> tabs = (Map<String, Object>) response.get("tabContents");
        assertThat((Map<String, Object>) tabs.get("Test Form"))
                .containsEntry("facility_name", "Sunny Acres")
                .containsEntry("id_incidence", 42L);
    }

    @Test
    @DisplayName("a rejected upload gets a JSON error report")
    void rejectedUpload() throws Exception {
        Path source = upload("forty-two");

        Map<String, Object> response;
        try (InputStream in = Files.newInputStream(source)) {
            response = uploadService.processUpload(in, "feedback.xlsx");
        }

        assertThat(response).containsEntry("status", "FAILED");
        try (Stream<Path> inbound = Files.list(tempDir.resolve("store/Inbound_Processing"))) {
            assertThat(inbound).isEmpty();
        }
        Path rejected = Paths.get((String) response.get("storedPath"));
        assertThat(rejected).exists();
        assertThat(rejected.getParent().getFileName().toString()).isEqualTo("Validation_Failed");
        assertThat(rejected.getFileName().toString()).matches("feedback_\\d{14}\\.xlsx");
        assertThat((Integer) response.get("errorCount")).isPositive();
        Path report = Paths.get((String) response.get("reportPath"));
        assertThat(report.getFileName().toString()).matches("ERROR_feedback_\\d{14}\\.xlsx\\.json");
        assertThat(report.getParent().getFileName().toString()).isEqualTo("Validation_Failed");

        JsonNode json = objectMapper.readTree(report.toFile());
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("errors").toString()).contains("forty-two");
        assertThat(json.get("file_checksum").asText()).isEqualTo(response.get("checksum"));
    }

    @Test
    @DisplayName("clean file names drop old timestamps and directories")
    void cleanFileNames() {
        assertThat(uploadService.generateCleanFileName("report_20231231235959.xlsx", "", "20240102030405"))
                .isEqualTo("report_20240102030405.xlsx");
        assertThat(uploadService.generateCleanFileName("../../etc/report.xls", "ERROR_", "20240102030405"))
                .isEqualTo("ERROR_report_20240102030405.xls");
        assertThat(uploadService.generateCleanFileName("report", "", "20240102030405"))
                .isEqualTo("report_20240102030405.xlsx");
        assertThat(uploadService.generateCleanFileName(null, "", "20240102030405"))
                .isEqualTo("Unknown_File_20240102030405.xlsx");
    }
}
