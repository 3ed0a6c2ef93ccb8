package com.poc.excelingest.validation;

import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.exception.ExcelProcessingException;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorkbookLoader;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * File and workbook level checks: existence, extension, size, container structure, sheet names and required tabs.
 */
@Slf4j
public class FileValidator {

    public static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final Set<Character> ILLEGAL_SHEET_NAME_CHARS = Set.of('[', ']', ':', '*', '?', '/', '\\');
    private static final byte[] OLE2_MAGIC = decode("D0CF11E0A1B11AE1");
    private static final Set<String> BASIC_CHECKS = Set.of("file_path", "file_format", "file_size");

    private final ExcelParseConfig config;
    private final WorkbookLoader loader;

    public FileValidator(ExcelParseConfig config, WorkbookLoader loader) {
        this.config = config;
        this.loader = loader;
    }

    private static byte[] decode(String hex) {
        try {
            return Hex.decodeHex(hex);
        } catch (DecoderException e) {
            throw new IllegalStateException("Bad magic constant " + hex, e);
        }
    }

    public ValidationResult validateFilePath(Path path) {
        String location = String.valueOf(path);
        if (path == null) {
            return ValidationResult.error("file_path", "File path is missing", location);
        }
        try {
            if (!Files.exists(path)) {
                return ValidationResult.error("file_path", "File does not exist: " + path, location);
            }
            if (!Files.isRegularFile(path)) {
                return ValidationResult.error("file_path", "Path is not a file: " + path, location);
            }
            if (!Files.isReadable(path)) {
                return ValidationResult.error("file_path", "File is not readable: " + path, location);
            }
        } catch (SecurityException e) {
            return ValidationResult.error("file_path", "File path validation error: " + e.getMessage(), location,
                    Map.of("exception", String.valueOf(e.getMessage())));
        }
        return ValidationResult.passed("file_path", "File path is valid and accessible: " + path, location);
    }

    /**
     * Checks the extension against the allow-list, then the container: .xlsx must be a zip holding
     * {@code xl/workbook.xml} and at least one {@code xl/worksheets/} entry, .xls must start with the OLE2 magic.
     */
    public ValidationResult validateFileFormat(Path path) {
        String location = String.valueOf(path);
        String extension = extensionOf(path);
        if (!config.isExtensionAllowed(extension)) {
            return ValidationResult.error("file_format", "File extension '" + extension + "' not supported. Allowed: "
                    + config.getAllowedExtensions(), location, Map.of(
                    "file_extension", extension,
                    "allowed_extensions", config.getAllowedExtensions()));
        }
        try {
            if (".xlsx".equals(extension)) {
                String missing = missingXlsxStructure(path);
                if (missing != null) {
                    return ValidationResult.error("file_format",
                            "File does not appear to be a valid Excel file: missing " + missing, location,
                            Map.of("missing_structure", missing));
                }
            } else if (".xls".equals(extension) && !hasOle2Header(path)) {
                return ValidationResult.error("file_format",
                        "File does not appear to be a valid Excel .xls file (invalid header)", location);
            }
        } catch (ZipException e) {
            return ValidationResult.error("file_format", "File is not a valid ZIP archive (corrupted Excel file)",
                    location, Map.of("exception", String.valueOf(e.getMessage())));
        } catch (IOException e) {
            return ValidationResult.error("file_format", "File format validation error: " + e.getMessage(), location,
                    Map.of("exception", String.valueOf(e.getMessage())));
        }
        return ValidationResult.passed("file_format", "File format is valid: " + extension, location,
                Map.of("file_extension", extension));
    }

    private static String missingXlsxStructure(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            if (zip.getEntry("xl/workbook.xml") == null) {
                return "xl/workbook.xml";
            }
            boolean hasWorksheet = zip.stream().map(ZipEntry::getName).anyMatch(name -> name.startsWith("xl/worksheets/"));
            return hasWorksheet ? null : "xl/worksheets/";
        }
    }

    private static boolean hasOle2Header(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return Arrays.equals(in.readNBytes(OLE2_MAGIC.length), OLE2_MAGIC);
        }
    }

    public ValidationResult validateFileSize(Path path) {
        return validateFileSize(path, null);
    }

    public ValidationResult validateFileSize(Path path, Integer maxSizeMb) {
        String location = String.valueOf(path);
        int maxSize = maxSizeMb == null ? config.getMaxFileSizeMb() : maxSizeMb;
        if (path == null) {
            return ValidationResult.error("file_size", "File path is missing", location,
                    Map.of("max_size_mb", maxSize));
        }
        long sizeBytes;
        try {
            sizeBytes = Files.size(path);
        } catch (IOException e) {
            return ValidationResult.error("file_size", "File size validation error: " + e.getMessage(), location,
                    Map.of("exception", String.valueOf(e.getMessage())));
        }
        double sizeMb = sizeBytes / (1024.0 * 1024.0);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("file_size_mb", sizeMb);
        context.put("max_size_mb", maxSize);
        context.put("file_size_bytes", sizeBytes);
        if (sizeMb > maxSize) {
            return ValidationResult.error("file_size", String.format(Locale.ROOT,
                    "File size %.2fMB exceeds maximum allowed %dMB", sizeMb, maxSize), location, context);
        }
        return ValidationResult.passed("file_size",
                String.format(Locale.ROOT, "File size %.2fMB is within limits", sizeMb), location, context);
    }

    public ValidationResult validateWorkbookStructure(WorkbookHandle workbook) {
        List<String> names = workbook.sheetNames();
        if (names.isEmpty()) {
            return ValidationResult.error("workbook_structure", "Workbook contains no worksheets", "workbook");
        }
        if (names.size() > config.getMaxTabs()) {
            return ValidationResult.error("workbook_structure", "Workbook has " + names.size()
                    + " worksheets, exceeds limit of " + config.getMaxTabs(), "workbook",
                    Map.of("worksheet_count", names.size(), "max_tabs", config.getMaxTabs()));
        }
        List<String> invalidNames = names.stream()
                .filter(name -> !isValidWorksheetName(name))
                .collect(Collectors.toList());
        if (!invalidNames.isEmpty()) {
            return ValidationResult.error("workbook_structure",
                    "Workbook contains invalid worksheet names: " + invalidNames, "workbook",
                    Map.of("invalid_names", invalidNames));
        }
        try {
            workbook.properties();
        } catch (RuntimeException e) {
            return ValidationResult.error("workbook_structure",
                    "Workbook properties are not accessible: " + e.getMessage(), "workbook",
                    Map.of("exception", String.valueOf(e.getMessage())));
        }
        return ValidationResult.passed("workbook_structure",
                "Workbook structure is valid with " + names.size() + " worksheets", "workbook",
                Map.of("worksheet_count", names.size(), "worksheet_names", names));
    }

    public ValidationResult validateRequiredTabs(WorkbookHandle workbook, List<String> requiredTabs) {
        if (requiredTabs == null || requiredTabs.isEmpty()) {
            return ValidationResult.passed("required_tabs", "No required tabs specified", "workbook");
        }
        List<String> available = workbook.sheetNames();
        List<String> missing = requiredTabs.stream()
                .filter(tab -> !available.contains(tab))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            return ValidationResult.error("required_tabs", "Required tabs missing: " + missing, "workbook", Map.of(
                    "missing_tabs", missing,
                    "required_tabs", requiredTabs,
                    "available_tabs", available));
        }
        return ValidationResult.passed("required_tabs", "All required tabs are present: " + requiredTabs, "workbook",
                Map.of("required_tabs", requiredTabs));
    }

    /**
     * Path, format and size checks as enabled by the config.
     */
    public List<ValidationResult> validateFile(Path path) {
        List<ValidationResult> results = new ArrayList<>();
        if (config.isValidateFileExists()) {
            results.add(validateFilePath(path));
        }
        if (config.isValidateFileFormat()) {
            results.add(validateFileFormat(path));
        }
        results.add(validateFileSize(path));
        return results;
    }

    /**
     * Workbook checks on an open handle.
     */
    public List<ValidationResult> validateWorkbook(WorkbookHandle workbook, List<String> requiredTabs) {
        List<ValidationResult> results = new ArrayList<>();
        results.add(validateWorkbookStructure(workbook));
        if (requiredTabs != null && !requiredTabs.isEmpty()) {
            results.add(validateRequiredTabs(workbook, requiredTabs));
        }
        return results;
    }

    /**
     * Every file check, then the workbook checks when the basic file checks all passed.
     */
    public List<ValidationResult> validateFileComprehensive(Path path, List<String> requiredTabs) {
        List<ValidationResult> results = validateFile(path);
        boolean basicPassed = results.stream()
                .filter(result -> BASIC_CHECKS.contains(result.getFieldName()))
                .allMatch(ValidationResult::isValid);
        if (!basicPassed) {
            return results;
        }
        try (WorkbookHandle workbook = loader.open(path)) {
            results.addAll(validateWorkbook(workbook, requiredTabs));
        } catch (ExcelProcessingException e) {
            log.warn("Failed to load workbook {} for validation: {}", path, e.getMessage());
            results.add(ValidationResult.error("workbook_loading",
                    "Failed to load workbook for validation: " + e.getMessage(), String.valueOf(path), e.toMap()));
        }
        return results;
    }

    public boolean isFileValid(Path path, List<String> requiredTabs) {
        return validateFileComprehensive(path, requiredTabs).stream().allMatch(ValidationResult::isValid);
    }

    public String getValidationSummary(List<ValidationResult> results) {
        if (results == null || results.isEmpty()) {
            return "No validation results to summarize";
        }
        long passed = results.stream().filter(ValidationResult::isValid).count();
        StringBuilder summary = new StringBuilder("Validation Summary: ")
                .append(passed).append('/').append(results.size()).append(" checks passed");
        if (passed < results.size()) {
            summary.append("\nFailed checks:");
            results.stream()
                    .filter(result -> !result.isValid())
                    .forEach(result -> summary.append("\n  - ").append(result.getFieldName())
                            .append(": ").append(result.getMessage()));
        }
        return summary.toString();
    }

    public static boolean isValidWorksheetName(String name) {
        if (name == null || name.isBlank() || name.length() > MAX_SHEET_NAME_LENGTH) {
            return false;
        }
        return name.chars().noneMatch(c -> ILLEGAL_SHEET_NAME_CHARS.contains((char) c));
    }

    static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
