package com.poc.excelingest.workbook;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
class PoiWorkbookHandle implements WorkbookHandle {

    private final Workbook workbook;
    private final String source;

    PoiWorkbookHandle(Workbook workbook, String source) {
        this.workbook = workbook;
        this.source = source;
    }

    @Override
    public List<String> sheetNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public Optional<WorksheetHandle> sheet(String name) {
        Sheet sheet = workbook.getSheet(name);
        return sheet == null ? Optional.empty() : Optional.of(new PoiWorksheetHandle(sheet));
    }

    @Override
    public Map<String, Object> properties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("title", null);
        properties.put("creator", null);
        properties.put("created", null);
        properties.put("modified", null);
        properties.put("last_modified_by", null);

        if (workbook instanceof XSSFWorkbook) {
            POIXMLProperties.CoreProperties core = ((XSSFWorkbook) workbook).getProperties().getCoreProperties();
            properties.put("title", core.getTitle());
            properties.put("creator", core.getCreator());
            properties.put("created", toLocal(core.getCreated()));
            properties.put("modified", toLocal(core.getModified()));
            properties.put("last_modified_by", core.getLastModifiedByUser());
        } else if (workbook instanceof HSSFWorkbook) {
            SummaryInformation summary = ((HSSFWorkbook) workbook).getSummaryInformation();
            if (summary != null) {
                properties.put("title", summary.getTitle());
                properties.put("creator", summary.getAuthor());
                properties.put("created", toLocal(summary.getCreateDateTime()));
                properties.put("modified", toLocal(summary.getLastSaveDateTime()));
                properties.put("last_modified_by", summary.getLastAuthor());
            }
        }
        return properties;
    }

    private static LocalDateTime toLocal(Date date) {
        return date == null ? null : LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
    }

    @Override
    public void close() {
        try {
            workbook.close();
        } catch (IOException e) {
            // Read-only handle, nothing was written; the data already read stays valid
            log.warn("Failed to close workbook {}: {}", source, e.getMessage(), e);
        }
    }
}
