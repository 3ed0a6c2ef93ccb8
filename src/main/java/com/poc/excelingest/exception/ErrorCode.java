package com.poc.excelingest.exception;

/**
 * Error codes shared by exceptions and validation results.
 */
public enum ErrorCode {

    // File
    FILE_NOT_FOUND,
    FILE_ACCESS_DENIED,
    FILE_TOO_LARGE,
    FILE_FORMAT_INVALID,
    FILE_CORRUPTED,

    // Validation
    VALIDATION_FAILED,
    REQUIRED_FIELD_MISSING,
    FIELD_TYPE_MISMATCH,
    FIELD_VALUE_INVALID,
    FIELD_CONSTRAINT_VIOLATION,

    // Processing
    PROCESSING_FAILED,
    TYPE_CONVERSION_FAILED,
    DATA_EXTRACTION_FAILED,
    SCHEMA_PROCESSING_FAILED,

    // Schema
    SCHEMA_INVALID,
    SCHEMA_NOT_FOUND,
    SCHEMA_VERSION_MISMATCH,
    SCHEMA_FIELD_MISSING,

    // Configuration
    CONFIG_INVALID,
    CONFIG_MISSING,
    CONFIG_VALUE_INVALID,

    // Data
    DATA_MALFORMED,
    DATA_TYPE_INVALID,
    DATA_VALUE_INVALID,
    INVALID_CELL_REFERENCE,

    UNKNOWN_ERROR
}
