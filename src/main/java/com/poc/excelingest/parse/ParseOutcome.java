package com.poc.excelingest.parse;

import com.poc.excelingest.model.ParsedWorkbook;
import com.poc.excelingest.model.ValidationResult;
import lombok.Value;

import java.util.List;

@Value
public class ParseOutcome {

    ParseStage stage;
    /** Null when the workbook could not be opened. */
    ParsedWorkbook workbook;
    List<ValidationResult> validationResults;

    public ParseOutcome(ParseStage stage, ParsedWorkbook workbook, List<ValidationResult> validationResults) {
        this.stage = stage;
        this.workbook = workbook;
        this.validationResults = List.copyOf(validationResults);
    }

    public static ParseOutcome failedAtOpen(ValidationResult error) {
        return new ParseOutcome(ParseStage.FAILED_AT_OPEN, null, List.of(error));
    }

    public boolean isAssembled() {
        return stage == ParseStage.ASSEMBLED;
    }
}
