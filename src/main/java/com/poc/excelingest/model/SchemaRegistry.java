package com.poc.excelingest.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-wide schema table plus a one-level alias map. Read-only after construction.
 */
@Getter
public final class SchemaRegistry {

    private final Map<String, Schema> schemas;
    private final Map<String, String> aliases;

    public SchemaRegistry(Map<String, Schema> schemas, Map<String, String> aliases) {
        this.schemas = schemas == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        this.aliases = aliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public static SchemaRegistry of(Schema... schemas) {
        Map<String, Schema> byName = new LinkedHashMap<>();
        for (Schema schema : schemas) {
            byName.put(schema.getSchemaName(), schema);
        }
        return new SchemaRegistry(byName, Map.of());
    }

    public SchemaRegistry withAliases(Map<String, String> aliases) {
        return new SchemaRegistry(schemas, aliases);
    }

    /**
     * Direct lookup by canonical name, aliases are not consulted.
     */
    public Optional<Schema> get(String schemaName) {
        return Optional.ofNullable(schemas.get(schemaName));
    }

    public Optional<String> aliasTarget(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public Set<String> getSchemaNames() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }
}
