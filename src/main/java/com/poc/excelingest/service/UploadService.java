package com.poc.excelingest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.excelingest.model.ExcelParseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stores an uploaded workbook under a timestamped name and runs it through the {@link ExcelProcessor}.
 * Rejected uploads are moved to {@value #FAILED_DIR} with a JSON report next to them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadService {

    static final String INBOUND_DIR = "Inbound_Processing/";
    static final String FAILED_DIR = "Validation_Failed/";

    private static final Pattern TIMESTAMP_PATTERN = Pattern.compile("(_\\d{14})$");

    private final ExcelProcessor excelProcessor;
    private final FileStorageService fileStorageService;
    private final ObjectMapper objectMapper;

    public Map<String, Object> processUpload(InputStream fileStream, String originalFilename) throws IOException {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMddHHmmss"));
        String storedName = generateCleanFileName(originalFilename, "", timestamp);
        Path stored = fileStorageService.saveFile(fileStream.readAllBytes(), INBOUND_DIR + storedName);
        log.info("Stored upload '{}' as {}", originalFilename, stored);

        ExcelParseResult result = excelProcessor.processFile(stored);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("checksum", result.getFileChecksum());
        if (!result.isValid()) {
            log.warn("Upload rejected: {} error(s) in {}", result.getErrors().size(), originalFilename);
            // Inbound_Processing only keeps accepted workbooks
            Path rejected = fileStorageService.moveFile(INBOUND_DIR + storedName, FAILED_DIR + storedName);
            String reportName = generateCleanFileName(originalFilename, "ERROR_", timestamp) + ".json";
            byte[] report = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result.toMap());
            Path reportPath = fileStorageService.saveFile(report, FAILED_DIR + reportName);

            response.put("storedPath", rejected.toString());
            response.put("status", "FAILED");
            response.put("message", "Validation errors found.");
            response.put("errorCount", result.getErrors().size());
            response.put("errors", result.getErrors());
            response.put("reportPath", reportPath.toString());
            return response;
        }

        log.info("Upload accepted: {} tab(s) extracted from {}", result.getTabContents().size(), originalFilename);
        response.put("storedPath", stored.toString());
        response.put("status", "SUCCESS");
        response.put("message", "Workbook extracted.");
        response.put("warningCount", result.getWarnings().size());
        response.put("metadata", result.toParsedWorkbook().toMap().get("metadata"));
        response.put("tabContents", result.toParsedWorkbook().toMap().get("tab_contents"));
        return response;
    }

    String generateCleanFileName(String originalFilename, String prefix, String newTimestamp) {
        if (originalFilename == null) {
            originalFilename = "Unknown_File.xlsx";
        }
        // Keep only the last path segment of browser-supplied names
        String name = originalFilename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);

        int dotIndex = name.lastIndexOf('.');
        String baseName = (dotIndex == -1) ? name : name.substring(0, dotIndex);
        String extension = (dotIndex == -1) ? ".xlsx" : name.substring(dotIndex);

        Matcher matcher = TIMESTAMP_PATTERN.matcher(baseName);
        if (matcher.find()) {
            baseName = baseName.substring(0, matcher.start());
        }
        return prefix + baseName + "_" + newTimestamp + extension;
    }
}
