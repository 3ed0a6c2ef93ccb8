package com.poc.excelingest.validation;

import com.poc.excelingest.coerce.FieldConstraints;
import com.poc.excelingest.config.ValidationMessages;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Data checks to run on the extracted content of one tab.
 */
@Value
@Builder
public class DataValidationRules {

    @Singular
    List<String> requiredFields;
    @Singular
    Map<String, FieldConstraints> fieldConstraints;
    @Singular
    Map<String, DataFormat> fieldFormats;
    @Singular
    List<BusinessRule> businessRules;
    @Builder.Default
    ValidationMessages messages = ValidationMessages.defaults();

    public static DataValidationRules none() {
        return builder().build();
    }
}
