package com.poc.excelingest.coerce;

import com.poc.excelingest.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldConstraintsTest {

    @Test
    @DisplayName("every violated constraint is reported")
    void collectsAllViolations() {
        FieldConstraints constraints = FieldConstraints.builder()
                .minLength(5)
                .pattern(Pattern.compile("[A-Z]+"))
                .allowedValues(List.of("NORTH", "SOUTH"))
                .build();

        List<FieldConstraints.Violation> violations = constraints.violations("abc");

        assertThat(violations).extracting(FieldConstraints.Violation::getConstraint)
                .containsExactly("min_length", "pattern", "enum");
    }

    @Test
    @DisplayName("numeric bounds compare across number types")
    void numericBounds() {
        FieldConstraints constraints = FieldConstraints.fromMap(Map.of("min_value", 0, "max_value", 100.0));

        assertThat(constraints.violations(50L)).isEmpty();
        assertThat(constraints.violations(-1L)).extracting(FieldConstraints.Violation::getConstraint)
                .containsExactly("min_value");
        assertThat(constraints.violations(100.5)).extracting(FieldConstraints.Violation::getConstraint)
                .containsExactly("max_value");
    }

    @Test
    @DisplayName("bounds are skipped for values they cannot be compared with")
    void incomparableSkipped() {
        assertThat(FieldConstraints.fromMap(Map.of("min_value", 10)).violations("text")).isEmpty();
    }

    @Test
    @DisplayName("patterns only need to match at the start")
    void patternAnchoredAtStart() {
        FieldConstraints constraints = FieldConstraints.fromMap(Map.of("pattern", "CA-\\d+"));

        assertThat(constraints.violations("CA-123 extra")).isEmpty();
        assertThat(constraints.violations("x CA-123")).hasSize(1);
    }

    @Test
    @DisplayName("a custom validator that throws is reported as a violation")
    void throwingCustomValidator() {
        Predicate<Object> exploding = value -> {
            throw new IllegalStateException("boom");
        };
        FieldConstraints constraints = FieldConstraints.builder().customValidator(exploding).build();

        assertThat(constraints.violations("x")).singleElement()
                .satisfies(violation -> assertThat(violation.getMessage()).contains("boom"));
    }

    @Test
    @DisplayName("an invalid pattern is a configuration error")
    void invalidPattern() {
        assertThatThrownBy(() -> FieldConstraints.fromMap(Map.of("pattern", "[unclosed")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("no constraints means nothing to check")
    void empty() {
        assertThat(FieldConstraints.none().isEmpty()).isTrue();
        assertThat(FieldConstraints.fromMap(null).violations("anything")).isEmpty();
    }
}
