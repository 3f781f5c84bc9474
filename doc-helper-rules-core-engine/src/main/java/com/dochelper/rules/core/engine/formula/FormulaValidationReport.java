package com.dochelper.rules.core.engine.formula;

import java.util.List;
import java.util.Set;

/**
 * Authoring time findings for one formula.
 */
public record FormulaValidationReport(String expression, List<String> errors, Set<String> fieldReferences) {

    public boolean isValid() {
        return errors.isEmpty();
    }
}
