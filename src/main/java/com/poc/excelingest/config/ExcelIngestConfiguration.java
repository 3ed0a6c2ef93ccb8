package com.poc.excelingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.excelingest.coerce.CellValueCoercer;
import com.poc.excelingest.extract.CompoundFieldSplitter;
import com.poc.excelingest.extract.TabExtractor;
import com.poc.excelingest.model.SchemaRegistry;
import com.poc.excelingest.parse.WorkbookParser;
import com.poc.excelingest.scan.KeyValueRegionScanner;
import com.poc.excelingest.schema.SchemaRegistryLoader;
import com.poc.excelingest.schema.SchemaResolver;
import com.poc.excelingest.validation.DataValidator;
import com.poc.excelingest.validation.FileValidator;
import com.poc.excelingest.validation.SchemaValidator;
import com.poc.excelingest.validation.ValidationAggregator;
import com.poc.excelingest.workbook.PoiWorkbookLoader;
import com.poc.excelingest.workbook.WorkbookLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;

/**
 * Wires the ingest components. The parse config and the schema registry are built once at startup.
 */
@Configuration
@EnableConfigurationProperties({ExcelParseProperties.class, SchemaProperties.class})
public class ExcelIngestConfiguration {

    @Bean
    public ExcelParseConfig excelParseConfig(ExcelParseProperties properties) {
        return properties.toConfig();
    }

    @Bean
    public SchemaRegistry schemaRegistry(SchemaProperties properties, ObjectMapper objectMapper,
                                         ResourceLoader resourceLoader) {
        return new SchemaRegistryLoader(objectMapper, ResourcePatternUtils.getResourcePatternResolver(resourceLoader))
                .load(properties.getLocation(), properties.getAliases());
    }

    @Bean
    public WorkbookLoader workbookLoader() {
        return new PoiWorkbookLoader();
    }

    @Bean
    public SchemaResolver schemaResolver() {
        return new SchemaResolver();
    }

    @Bean
    public CellValueCoercer cellValueCoercer() {
        return new CellValueCoercer();
    }

    @Bean
    public TabExtractor tabExtractor(SchemaResolver schemaResolver, CellValueCoercer cellValueCoercer) {
        return new TabExtractor(schemaResolver, cellValueCoercer, new CompoundFieldSplitter());
    }

    @Bean
    public WorkbookParser workbookParser(WorkbookLoader workbookLoader, TabExtractor tabExtractor,
                                         SchemaResolver schemaResolver) {
        return new WorkbookParser(workbookLoader, new KeyValueRegionScanner(), tabExtractor, schemaResolver);
    }

    @Bean
    public ValidationAggregator validationAggregator(ExcelParseConfig config, WorkbookLoader workbookLoader,
                                                     CellValueCoercer cellValueCoercer) {
        return new ValidationAggregator(new FileValidator(config, workbookLoader), new SchemaValidator(),
                new DataValidator(cellValueCoercer), config);
    }
}
