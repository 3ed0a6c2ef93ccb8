package com.poc.excelingest.extract;

import com.poc.excelingest.model.ValidationResult;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of every tab that could be extracted, the schema each used, and the findings collected on the way.
 */
@Value
public class ExtractionOutcome {

    Map<String, Map<String, Object>> tabContents;
    /** Tab name to canonical schema name, for extracted tabs only. */
    Map<String, String> schemasUsed;
    List<ValidationResult> validationResults;

    public ExtractionOutcome(Map<String, Map<String, Object>> tabContents, Map<String, String> schemasUsed,
                             List<ValidationResult> validationResults) {
        this.tabContents = Collections.unmodifiableMap(new LinkedHashMap<>(tabContents));
        this.schemasUsed = Collections.unmodifiableMap(new LinkedHashMap<>(schemasUsed));
        this.validationResults = List.copyOf(validationResults);
    }
}
