package com.dochelper.rules.integration.models.validation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class FieldValidationResult {
    private final boolean valid;
    private final List<String> violations;

    public static FieldValidationResult ok() {
        return new FieldValidationResult(true, List.of());
    }

    public static FieldValidationResult failed(List<String> violations) {
        return new FieldValidationResult(false, List.copyOf(violations));
    }
}
