package com.poc.excelingest.schema;

import com.poc.excelingest.exception.ConfigurationException;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.model.Schema;
import com.poc.excelingest.model.SchemaRegistry;

import java.util.Optional;

/**
 * Finds the schema for a name that may be an alias. Aliases are followed once: an alias that
 * points at another alias resolves to nothing, so alias cycles cannot form.
 */
public class SchemaResolver {

    public Optional<Schema> resolve(String name, SchemaRegistry registry) {
        if (registry == null) {
            throw new ConfigurationException("Schema registry is not configured", ErrorCode.CONFIG_MISSING);
        }
        if (name == null) {
            return Optional.empty();
        }
        String canonical = registry.aliasTarget(name).orElse(name);
        return registry.get(canonical);
    }

    /**
     * The name a lookup would use after alias substitution, whether or not a schema exists under it.
     */
    public String canonicalName(String name, SchemaRegistry registry) {
        if (registry == null) {
            throw new ConfigurationException("Schema registry is not configured", ErrorCode.CONFIG_MISSING);
        }
        return registry.aliasTarget(name).orElse(name);
    }
}
