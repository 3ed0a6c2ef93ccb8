package com.poc.excelingest.workbook;

import java.nio.file.Path;

public interface WorkbookLoader {

    /**
     * Opens the workbook read-only with formulas resolved to their cached values.
     *
     * @throws com.poc.excelingest.exception.FileException when the file is missing, unreadable or not a workbook
     */
    WorkbookHandle open(Path path);
}
