package com.poc.excelingest.validation;

import lombok.Value;

import java.util.Map;
import java.util.function.Predicate;

/**
 * A named predicate over a whole extracted record, with the message reported when it does not hold.
 */
@Value
public class BusinessRule {

    String name;
    Predicate<Map<String, Object>> condition;
    String message;

    public static BusinessRule of(String name, Predicate<Map<String, Object>> condition, String message) {
        return new BusinessRule(name, condition, message);
    }
}
