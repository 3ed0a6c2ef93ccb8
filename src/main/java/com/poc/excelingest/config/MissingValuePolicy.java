package com.poc.excelingest.config;

/**
 * What tab extraction stores when a declared cell is empty.
 */
public enum MissingValuePolicy {
    /** Store the field default ("Please Select" for drop-downs, empty string otherwise). */
    SKIP,
    /** Store null. */
    NULL,
    /** Store the field default and report an error for the field. */
    ERROR
}
