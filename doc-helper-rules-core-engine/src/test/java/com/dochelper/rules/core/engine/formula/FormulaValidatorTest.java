package com.dochelper.rules.core.engine.formula;

import com.dochelper.rules.core.engine.formula.functions.FormulaFunctionRegistry;
import com.dochelper.rules.core.engine.formula.parser.FormulaCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaValidatorTest {

    private final FormulaCompiler compiler = new FormulaCompiler();
    private final FormulaValidator validator = new FormulaValidator(compiler, FormulaFunctionRegistry.getInstance());

    @Test
    @DisplayName("a valid formula should report its field references")
    void validFormula() {
        FormulaValidationReport report = validator.validate("{{depth_from}} - {{depth_to}}", Set.of("depth_from", "depth_to"));

        assertTrue(report.isValid());
        assertEquals(Set.of("depth_from", "depth_to"), report.fieldReferences());
    }

    @Test
    @DisplayName("a syntax error should be the only finding")
    void syntaxError() {
        FormulaValidationReport report = validator.validate("{{a}} * (2", Set.of("a"));

        assertFalse(report.isValid());
        assertEquals(1, report.errors().size());
        assertTrue(report.fieldReferences().isEmpty());
    }

    @Test
    @DisplayName("wrong argument counts should be reported per call, including nested calls")
    void argumentCounts() {
        FormulaValidationReport report = validator.validate("round(abs(), 1, 2)", Set.of());

        assertEquals(2, report.errors().size());
    }

    @Test
    @DisplayName("unknown references should be listed in order of appearance")
    void unknownReferences() {
        FormulaValidationReport report = validator.validate("{{b}} + {{a}} + {{c}}", Set.of("c"));

        assertEquals(List.of("Unknown field reference [b]", "Unknown field reference [a]"), report.errors());
    }

    @Test
    @DisplayName("a number literal with an oversized exponent should be reported, not thrown")
    void oversizedNumber() {
        FormulaValidationReport report = validator.validate("{{a}} * 1e99999999999", Set.of("a"));

        assertFalse(report.isValid());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).contains("Malformed number"));
    }

    @Test
    @DisplayName("validating formulas should not grow the compile cache")
    void validationDoesNotCache() {
        validator.validate("{{a}} + 1", Set.of("a"));
        validator.validate("{{a}} + 2", Set.of("a"));

        assertEquals(0, compiler.cacheSize());
    }
}
