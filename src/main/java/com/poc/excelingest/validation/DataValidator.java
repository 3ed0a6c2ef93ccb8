package com.poc.excelingest.validation;

import com.poc.excelingest.coerce.CellValueCoercer;
import com.poc.excelingest.coerce.FieldConstraints;
import com.poc.excelingest.config.ValidationMessages;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.model.ValueType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks on extracted values: types, required fields, constraints, formats and business rules.
 * Message texts come from the {@link ValidationMessages} passed in, defaults otherwise.
 */
@Slf4j
public class DataValidator {

    private final CellValueCoercer coercer;

    public DataValidator(CellValueCoercer coercer) {
        this.coercer = coercer;
    }

    public ValidationResult validateCellValue(Object value, ValueType expectedType, String fieldName) {
        return coercer.coerce(value, expectedType).toValidationResult(fieldName, fieldName);
    }

    public ValidationResult validateRequiredFields(Map<String, ?> data, List<String> requiredFields) {
        return validateRequiredFields(data, requiredFields, ValidationMessages.defaults());
    }

    /**
     * Fields must be present and not null or blank.
     */
    public ValidationResult validateRequiredFields(Map<String, ?> data, List<String> requiredFields,
                                                   ValidationMessages messages) {
        if (requiredFields == null || requiredFields.isEmpty()) {
            return ValidationResult.passed("required_fields", "No required fields specified", "data");
        }
        List<String> missing = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        for (String field : requiredFields) {
            if (!data.containsKey(field)) {
                missing.add(field);
            } else if (isBlank(data.get(field))) {
                empty.add(field);
            }
        }
        if (!missing.isEmpty() || !empty.isEmpty()) {
            List<String> issues = new ArrayList<>();
            if (!missing.isEmpty()) {
                issues.add(missing.size() + " missing fields");
            }
            if (!empty.isEmpty()) {
                issues.add(empty.size() + " empty fields");
            }
            return ValidationResult.error("required_fields",
                    messages.format(ValidationMessages.REQUIRED_MISSING, String.join(", ", issues)), "data", Map.of(
                            "missing_fields", missing,
                            "empty_fields", empty,
                            "required_fields", requiredFields,
                            "available_fields", new ArrayList<>(data.keySet())));
        }
        return ValidationResult.passed("required_fields",
                messages.format(ValidationMessages.REQUIRED_PASSED, requiredFields.size()), "data",
                Map.of("required_fields", requiredFields, "field_count", requiredFields.size()));
    }

    public ValidationResult validateFieldConstraints(Object value, Map<String, ?> constraints) {
        return validateFieldConstraints(value, FieldConstraints.fromMap(constraints), ValidationMessages.defaults());
    }

    /**
     * All violated constraints are collected into one result.
     */
    public ValidationResult validateFieldConstraints(Object value, FieldConstraints constraints,
                                                     ValidationMessages messages) {
        if (constraints == null || constraints.isEmpty()) {
            return ValidationResult.passed("field_constraints", "No constraints specified", "value");
        }
        List<FieldConstraints.Violation> violations = constraints.violations(value);
        if (!violations.isEmpty()) {
            return ValidationResult.error("field_constraints",
                    messages.format(ValidationMessages.CONSTRAINT_FAILED, violations.size()), "value",
                    Map.of("validation_errors", violations, "constraints", constraints));
        }
        return ValidationResult.passed("field_constraints", messages.format(ValidationMessages.CONSTRAINT_PASSED),
                "value", Map.of("constraints", constraints));
    }

    public ValidationResult validateDataFormat(Object value, String formatType) {
        Optional<DataFormat> format = DataFormat.fromKey(formatType);
        if (format.isEmpty()) {
            return ValidationResult.error("data_format", "Unknown format type: " + formatType, "value", Map.of(
                    "format_type", String.valueOf(formatType),
                    "available_formats", Arrays.stream(DataFormat.values()).map(DataFormat::getKey)
                            .collect(Collectors.toList())));
        }
        return validateDataFormat(value, format.get(), ValidationMessages.defaults());
    }

    public ValidationResult validateDataFormat(Object value, DataFormat format, ValidationMessages messages) {
        if (!(value instanceof String)) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("value", value);
            context.put("format_type", format.getKey());
            return ValidationResult.error("data_format", "Format validation requires string value, got "
                    + (value == null ? "null" : value.getClass().getSimpleName()), "value", context);
        }
        if (format.matches((String) value)) {
            return ValidationResult.passed("data_format", messages.format(ValidationMessages.FORMAT_MATCH, format.getKey()),
                    "value", Map.of("format_type", format.getKey(), "pattern", format.getPattern().pattern()));
        }
        return ValidationResult.error("data_format", messages.format(ValidationMessages.FORMAT_MISMATCH, format.getKey()),
                "value", Map.of("format_type", format.getKey(), "pattern", format.getPattern().pattern(), "value", value));
    }

    public List<ValidationResult> validateBusinessRules(Map<String, Object> data, List<BusinessRule> rules) {
        return validateBusinessRules(data, rules, ValidationMessages.defaults());
    }

    /**
     * Each rule is evaluated and reported on its own; a rule that throws becomes an error result
     * and the remaining rules still run.
     */
    public List<ValidationResult> validateBusinessRules(Map<String, Object> data, List<BusinessRule> rules,
                                                        ValidationMessages messages) {
        List<ValidationResult> results = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            BusinessRule rule = rules.get(i);
            String fieldName = "business_rule_" + i;
            String ruleName = rule == null || rule.getName() == null ? "rule_" + i : rule.getName();
            if (rule == null || rule.getCondition() == null) {
                results.add(ValidationResult.error(fieldName, "Invalid business rule: " + ruleName, "business_rules",
                        Map.of("rule_name", ruleName, "issue", "Invalid condition function")));
                continue;
            }
            try {
                boolean passed = rule.getCondition().test(data);
                String message;
                if (passed) {
                    message = messages.format(ValidationMessages.RULE_PASSED, ruleName);
                } else {
                    message = rule.getMessage() != null ? rule.getMessage()
                            : messages.format(ValidationMessages.RULE_FAILED, ruleName);
                }
                results.add(passed
                        ? ValidationResult.passed(fieldName, message, "business_rules",
                        Map.of("rule_name", ruleName, "rule_passed", true))
                        : ValidationResult.error(fieldName, message, "business_rules",
                        Map.of("rule_name", ruleName, "rule_passed", false)));
            } catch (RuntimeException e) {
                log.warn("Business rule '{}' threw {}", ruleName, e.toString());
                results.add(ValidationResult.error(fieldName,
                        messages.format(ValidationMessages.RULE_ERROR, ruleName, e.getMessage()), "business_rules",
                        Map.of("rule_name", ruleName, "exception", String.valueOf(e.getMessage()))));
            }
        }
        return results;
    }

    /**
     * Runs every check configured in {@code rules} against one tab's data.
     */
    public List<ValidationResult> validateTab(String tabName, Map<String, Object> data, DataValidationRules rules) {
        ValidationMessages messages = rules.getMessages();
        List<ValidationResult> results = new ArrayList<>();
        if (!rules.getRequiredFields().isEmpty()) {
            results.add(locate(validateRequiredFields(data, rules.getRequiredFields(), messages), tabName, null));
        }
        rules.getFieldConstraints().forEach((field, constraints) ->
                results.add(locate(validateFieldConstraints(data.get(field), constraints, messages), tabName, field)));
        rules.getFieldFormats().forEach((field, format) -> {
            Object value = data.get(field);
            if (!isBlank(value)) {
                results.add(locate(validateDataFormat(value, format, messages), tabName, field));
            }
        });
        results.addAll(validateBusinessRules(data, rules.getBusinessRules(), messages));
        return results;
    }

    /**
     * Re-labels a value-level result with the field and tab it was produced for.
     */
    private static ValidationResult locate(ValidationResult result, String tabName, String field) {
        Map<String, Object> context = new LinkedHashMap<>(result.getContext());
        context.put("check", result.getFieldName());
        context.put("tab_name", tabName);
        return new ValidationResult(field == null ? result.getFieldName() : field, result.isValid(),
                result.getMessage(), result.getSeverity(), field == null ? tabName : tabName + "." + field, context);
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }
}
