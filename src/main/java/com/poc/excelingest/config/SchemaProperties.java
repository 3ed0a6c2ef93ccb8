package com.poc.excelingest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code excel.schema.*}: where schema files live and which names alias them.
 */
@ConfigurationProperties(prefix = "excel.schema")
@Getter
@Setter
public class SchemaProperties {

    private String location = "classpath*:schemas/*.json";

    /** alias name -> canonical schema name, one hop only */
    private Map<String, String> aliases = new LinkedHashMap<>();
}
