package com.dochelper.rules.core.engine.validation;

import com.dochelper.rules.core.RuleSetFixtures;
import com.dochelper.rules.core.exception.context.RuleSetDefinitionException;
import com.dochelper.rules.core.models.DocHelperConstraintViolation;
import com.dochelper.rules.integration.enumerations.ControlEffectType;
import com.dochelper.rules.integration.enumerations.FieldType;
import com.dochelper.rules.integration.models.schema.ControlRuleDefinition;
import com.dochelper.rules.integration.models.schema.FieldConstraintsDefinition;
import com.dochelper.rules.integration.models.schema.FieldDefinition;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dochelper.rules.core.RuleSetFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RuleSetDefinitionValidatorTest {

    private final RuleSetDefinitionValidator validator = new RuleSetDefinitionValidator();

    @Test
    @DisplayName("a complete rule set should pass")
    void shouldAcceptValidRuleSet() {
        assertDoesNotThrow(() -> validator.validate(RuleSetFixtures.soilInvestigation()));
    }

    @Test
    @DisplayName("a missing rule set should be rejected")
    void shouldRejectNull() {
        assertThrows(RuleSetDefinitionException.class, () -> validator.validate(null));
    }

    @Test
    @DisplayName("nested field and rule constraints should be reported with their property paths")
    void shouldReportNestedViolations() {
        // Given
        FieldDefinition untyped = FieldDefinition.builder().id("depth").build();
        ControlRuleDefinition unmapped = ControlRuleDefinition.builder()
                .id("r1")
                .sourceFieldId("depth")
                .targetFieldId("depth")
                .effectType(ControlEffectType.VISIBILITY)
                .build();
        RuleSetDefinition ruleSet = ruleSet(List.of(untyped), List.of(unmapped));

        // When
        RuleSetDefinitionException exception = assertThrows(RuleSetDefinitionException.class,
                () -> validator.validate(ruleSet));

        // Then
        List<String> paths = exception.getViolations().stream()
                .map(DocHelperConstraintViolation::getPropertyPath)
                .toList();
        assertEquals(List.of("controlRules[0].mapping", "fields[0].type"), paths);
        assertEquals("Field type must be set", exception.getViolations().get(1).getMessage());
        assertEquals("Control rule mapping must be set", exception.getViolations().get(0).getMessage());
    }

    @Test
    @DisplayName("a negative length constraint should be rejected")
    void shouldRejectNegativeLength() {
        // Given
        FieldDefinition field = FieldDefinition.builder()
                .id("code")
                .type(FieldType.TEXT)
                .constraints(FieldConstraintsDefinition.builder().minLength(-1).build())
                .build();

        // When
        RuleSetDefinitionException exception = assertThrows(RuleSetDefinitionException.class,
                () -> validator.validate(ruleSet(List.of(field), List.of())));

        // Then
        assertEquals("fields[0].constraints.minLength", exception.getViolations().get(0).getPropertyPath());
    }

    @Test
    @DisplayName("duplicate field ids should be rejected")
    void shouldRejectDuplicateFields() {
        // Given
        RuleSetDefinition ruleSet = ruleSet(List.of(field("a", FieldType.TEXT), field("a", FieldType.TEXT)), List.of());

        // When
        RuleSetDefinitionException exception = assertThrows(RuleSetDefinitionException.class,
                () -> validator.validate(ruleSet));

        // Then
        assertTrue(exception.getMessage().contains("[a]"));
    }
}
