package com.poc.excelingest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code excel.parse.*} settings from application.properties.
 */
@ConfigurationProperties(prefix = "excel.parse")
@Getter
@Setter
public class ExcelParseProperties {

    private boolean validateFileExists = true;
    private boolean validateFileFormat = true;
    private int maxFileSizeMb = 100;
    private List<String> allowedExtensions = new ArrayList<>(ExcelParseConfig.DEFAULT_EXTENSIONS);
    private boolean strictMode = false;
    private boolean skipInvalidTabs = true;
    private int maxTabs = 50;
    private int maxRows = 1000;
    private int maxColumns = 26;
    private boolean trimStrings = true;
    private int maxFieldCount = 1000;
    private MissingValuePolicy missingValuePolicy = MissingValuePolicy.SKIP;

    /**
     * Builds the immutable config; throws ConfigurationException on invalid limits.
     */
    public ExcelParseConfig toConfig() {
        return ExcelParseConfig.builder()
                .validateFileExists(validateFileExists)
                .validateFileFormat(validateFileFormat)
                .maxFileSizeMb(maxFileSizeMb)
                .allowedExtensions(allowedExtensions)
                .strictMode(strictMode)
                .skipInvalidTabs(skipInvalidTabs)
                .maxTabs(maxTabs)
                .maxRows(maxRows)
                .maxColumns(maxColumns)
                .trimStrings(trimStrings)
                .maxFieldCount(maxFieldCount)
                .missingValuePolicy(missingValuePolicy)
                .build();
    }
}
