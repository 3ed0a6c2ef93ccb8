package com.poc.excelingest.coerce;

import com.poc.excelingest.model.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CellValueCoercerTest {

    private final CellValueCoercer coercer = new CellValueCoercer();

    @Test
    @DisplayName("null and empty text are invalid for every type")
    void emptyIsInvalid() {
        for (ValueType type : ValueType.values()) {
            assertThat(coercer.coerce(null, type).isValid()).isFalse();
            assertThat(coercer.coerce("", type).getMessage()).isEqualTo("Cell value is None/empty");
        }
    }

    @Test
    @DisplayName("integer text with a zero fraction converts to a whole number")
    void integerFromDecimalText() {
        CoercionResult result = coercer.coerce("123.0", ValueType.INTEGER);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getValue()).isEqualTo(123L);
        assertThat(result.getMessage()).isEqualTo("Cell value converted to integer");
    }

    @Test
    @DisplayName("fractions are truncated toward zero")
    void integerTruncates() {
        assertThat(coercer.coerce(123.9, ValueType.INTEGER).getValue()).isEqualTo(123L);
        assertThat(coercer.coerce("-7.5", ValueType.INTEGER).getValue()).isEqualTo(-7L);
    }

    @Test
    @DisplayName("non-numeric text fails with the conversion message")
    void integerFromWordFails() {
        CoercionResult result = coercer.coerce("abc", ValueType.INTEGER);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getValue()).isEqualTo("abc");
        assertThat(result.getMessage()).startsWith("Cannot convert value 'abc' to integer");
        assertThat(result.getContext()).containsEntry("error_code", "TYPE_CONVERSION_FAILED");
    }

    @Test
    @DisplayName("infinite and NaN values are not integers")
    void integerRejectsNonFinite() {
        assertThat(coercer.coerce(Double.NaN, ValueType.INTEGER).isValid()).isFalse();
        assertThat(coercer.coerce(Double.POSITIVE_INFINITY, ValueType.INTEGER).isValid()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({"Yes,true", "TRUE,true", "on,true", "1,true", "No,false", "off,false", "0,false", "False,false"})
    @DisplayName("boolean words convert without regard to case")
    void booleanWords(String word, boolean expected) {
        CoercionResult result = coercer.coerce(word, ValueType.BOOLEAN);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getValue()).isEqualTo(expected);
    }

    @Test
    @DisplayName("an unknown boolean word fails")
    void booleanUnknownWord() {
        CoercionResult result = coercer.coerce("maybe", ValueType.BOOLEAN);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getMessage()).contains("boolean");
    }

    @Test
    @DisplayName("numbers convert to booleans by comparing with zero")
    void booleanFromNumber() {
        assertThat(coercer.coerce(0L, ValueType.BOOLEAN).getValue()).isEqualTo(false);
        assertThat(coercer.coerce(2.5, ValueType.BOOLEAN).getValue()).isEqualTo(true);
    }

    @ParameterizedTest
    @CsvSource({"2025-01-15", "1/15/2025", "15/1/2025", "2025-1-5"})
    @DisplayName("date text in the accepted formats converts to midnight")
    void dateFormats(String text) {
        CoercionResult result = coercer.coerce(text, ValueType.DATETIME);

        assertThat(result.isValid()).isTrue();
        assertThat(((LocalDateTime) result.getValue()).toLocalTime()).isEqualTo(LocalTime.MIDNIGHT);
    }

    @Test
    @DisplayName("month-first is tried before day-first")
    void monthFirstWins() {
        assertThat(coercer.coerce("02/03/2025", ValueType.DATETIME).getValue())
                .isEqualTo(LocalDateTime.of(2025, 2, 3, 0, 0));
    }

    @Test
    @DisplayName("date and time text keeps the time of day")
    void dateTimeText() {
        assertThat(coercer.coerce("2025-01-15 08:30:00", ValueType.DATETIME).getValue())
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 8, 30));
    }

    @Test
    @DisplayName("unparseable date text fails")
    void badDate() {
        assertThat(coercer.coerce("yesterday", ValueType.DATETIME).isValid()).isFalse();
        assertThat(coercer.coerce("2025-02-30", ValueType.DATETIME).isValid()).isFalse();
    }

    @Test
    @DisplayName("values already of the target type pass through unchanged")
    void idempotent() {
        LocalDateTime when = LocalDateTime.of(2025, 5, 1, 12, 0);
        for (Object[] sample : new Object[][]{{"text", ValueType.STRING}, {42L, ValueType.INTEGER},
                {4.2, ValueType.FLOAT}, {true, ValueType.BOOLEAN}, {when, ValueType.DATETIME}}) {
            CoercionResult first = coercer.coerce(sample[0], (ValueType) sample[1]);
            CoercionResult second = coercer.coerce(first.getValue(), (ValueType) sample[1]);

            assertThat(first.getMessage()).startsWith("Cell value is valid");
            assertThat(second.getValue()).isEqualTo(sample[0]);
        }
    }

    static Stream<Arguments> convertedInputs() {
        return Stream.of(
                Arguments.of("Yes", ValueType.BOOLEAN, true),
                Arguments.of("off", ValueType.BOOLEAN, false),
                Arguments.of("123.0", ValueType.INTEGER, 123L),
                Arguments.of(7.0, ValueType.INTEGER, 7L),
                Arguments.of("4.5", ValueType.FLOAT, 4.5),
                Arguments.of(3L, ValueType.FLOAT, 3.0),
                Arguments.of(42L, ValueType.STRING, "42"),
                Arguments.of("03/04/2025", ValueType.DATETIME, LocalDateTime.of(2025, 3, 4, 0, 0)),
                Arguments.of("2025-01-15", ValueType.DATE, LocalDateTime.of(2025, 1, 15, 0, 0)));
    }

    @ParameterizedTest(name = "{0} as {1}")
    @MethodSource("convertedInputs")
    @DisplayName("coercing a converted value again gives the same value")
    void convertedValuesAreStable(Object raw, ValueType type, Object expected) {
        CoercionResult first = coercer.coerce(raw, type);
        CoercionResult second = coercer.coerce(first.getValue(), type);

        assertThat(first.isValid()).isTrue();
        assertThat(first.getValue()).isEqualTo(expected);
        assertThat(second.isValid()).isTrue();
        assertThat(second.getValue()).isEqualTo(first.getValue());
    }

    @Test
    @DisplayName("anything converts to text")
    void stringFromNumber() {
        assertThat(coercer.coerce(42L, ValueType.STRING).getValue()).isEqualTo("42");
    }

    @Test
    @DisplayName("float text converts and garbage fails")
    void floats() {
        assertThat(coercer.coerce(" 3.25 ", ValueType.FLOAT).getValue()).isEqualTo(3.25);
        assertThat(coercer.coerce(7L, ValueType.FLOAT).getValue()).isEqualTo(7.0);
        assertThat(coercer.coerce("3,25", ValueType.FLOAT).isValid()).isFalse();
    }
}
