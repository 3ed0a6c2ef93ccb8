package com.poc.excelingest.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.SchemaException;
import com.poc.excelingest.model.Schema;
import com.poc.excelingest.model.SchemaRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads schema JSON files into a {@link SchemaRegistry}. The file base name is the schema name.
 * Files may wrap the field map in a {@code {"_metadata_": {...}, "_data_": {...}}} envelope;
 * {@code _metadata_.tab_name} names the target tab and defaults to the schema name.
 */
@Slf4j
public class SchemaRegistryLoader {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resourceResolver;

    public SchemaRegistryLoader(ObjectMapper objectMapper) {
        this(objectMapper, new PathMatchingResourcePatternResolver());
    }

    public SchemaRegistryLoader(ObjectMapper objectMapper, ResourcePatternResolver resourceResolver) {
        this.objectMapper = objectMapper;
        this.resourceResolver = resourceResolver;
    }

    public SchemaRegistry load(String locationPattern, Map<String, String> aliases) {
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(locationPattern);
        } catch (IOException e) {
            throw new SchemaException("Cannot list schema files at " + locationPattern, ErrorCode.SCHEMA_NOT_FOUND,
                    Map.of("location", locationPattern), e);
        }

        Map<String, Schema> schemas = new LinkedHashMap<>();
        for (Resource resource : resources) {
            String fileName = resource.getFilename();
            if (fileName == null || !fileName.endsWith(".json")) {
                continue;
            }
            String schemaName = fileName.substring(0, fileName.length() - ".json".length());
            try (InputStream in = resource.getInputStream()) {
                schemas.put(schemaName, read(schemaName, in));
            } catch (IOException e) {
                throw new SchemaException("Cannot read schema file " + fileName + ": " + e.getMessage(),
                        ErrorCode.SCHEMA_INVALID, Map.of("schema_name", schemaName), e);
            }
        }
        log.info("Loaded {} schema(s) from {}: {}", schemas.size(), locationPattern, schemas.keySet());
        return new SchemaRegistry(schemas, aliases);
    }

    /**
     * Parses one schema document.
     */
    @SuppressWarnings("unchecked")
    public Schema read(String schemaName, InputStream json) throws IOException {
        Map<String, Object> document = objectMapper.readValue(json, JSON_OBJECT);
        Map<String, Object> metadata = Map.of();
        Map<String, Object> fieldMap = document;
        if (document.containsKey("_data_")) {
            Object data = document.get("_data_");
            Object meta = document.get("_metadata_");
            if (!(data instanceof Map)) {
                throw new SchemaException("Schema '" + schemaName + "' has a non-object _data_ section",
                        ErrorCode.SCHEMA_INVALID, Map.of("schema_name", schemaName));
            }
            fieldMap = (Map<String, Object>) data;
            metadata = meta instanceof Map ? (Map<String, Object>) meta : Map.of();
        }
        Object tabName = metadata.get("tab_name");
        return SchemaDefinitions.fromFieldMap(schemaName, tabName == null ? schemaName : tabName.toString(),
                fieldMap, metadata);
    }
}
