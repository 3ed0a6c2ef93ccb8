package com.poc.excelingest.workbook;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to an open workbook. The ingest core only talks to this interface.
 */
public interface WorkbookHandle extends AutoCloseable {

    List<String> sheetNames();

    Optional<WorksheetHandle> sheet(String name);

    default boolean hasSheet(String name) {
        return sheetNames().contains(name);
    }

    /**
     * Document properties: title, creator, created, modified, last_modified_by. Missing ones are null.
     */
    Map<String, Object> properties();

    @Override
    void close();
}
