package com.poc.excelingest.workbook;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.FileException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Opens .xlsx and .xls files through POI's {@link WorkbookFactory} in read-only mode.
 */
@Slf4j
public class PoiWorkbookLoader implements WorkbookLoader {

    @Override
    public WorkbookHandle open(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new FileException("Workbook file not found: " + path, ErrorCode.FILE_NOT_FOUND,
                    Map.of("file_path", String.valueOf(path)));
        }
        try {
            Workbook workbook = WorkbookFactory.create(path.toFile(), null, true);
            log.debug("Opened workbook {} with {} sheet(s)", path, workbook.getNumberOfSheets());
            return new PoiWorkbookHandle(workbook, path.toString());
        } catch (IOException | RuntimeException e) {
            throw new FileException("Failed to load workbook " + path.getFileName() + ": " + e.getMessage(),
                    ErrorCode.FILE_CORRUPTED, Map.of("file_path", path.toString()), e);
        }
    }
}
