package com.poc.excelingest.parse;

/**
 * Stages of a workbook parse, in order. {@link #ASSEMBLED} and {@link #FAILED_AT_OPEN} are terminal.
 */
public enum ParseStage {
    OPEN,
    READ_METADATA,
    READ_SCHEMA_MAP,
    EXTRACT_TABS,
    ASSEMBLED,
    FAILED_AT_OPEN
}
