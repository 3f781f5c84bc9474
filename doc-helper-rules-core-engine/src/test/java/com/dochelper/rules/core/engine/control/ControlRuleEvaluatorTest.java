package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.core.RuleSetFixtures;
import com.dochelper.rules.core.engine.DocHelperRulesEngine;
import com.dochelper.rules.core.engine.config.DocHelperRulesEngineConfig;
import com.dochelper.rules.core.engine.formula.parser.FormulaCompiler;
import com.dochelper.rules.core.engine.override.ConflictType;
import com.dochelper.rules.core.engine.override.OverrideAcceptance;
import com.dochelper.rules.core.engine.override.OverrideConflict;
import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.exception.codes.DocHelperRulesErrorCodes;
import com.dochelper.rules.core.exception.context.RuleSetDefinitionException;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import com.dochelper.rules.core.models.EditResult;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.util.CastUtil;
import com.dochelper.rules.integration.enumerations.ControlEffectType;
import com.dochelper.rules.integration.enumerations.FieldType;
import com.dochelper.rules.integration.models.schema.ControlRuleDefinition;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.dochelper.rules.core.RuleSetFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ControlRuleEvaluatorTest {

    private DocHelperRulesEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DocHelperRulesEngine(DocHelperRulesEngineConfig.defaults());
    }

    private EntityRuleContext context(RuleSetDefinition ruleSet, Map<String, Object> values) throws Exception {
        return engine.createContext("entity-1", ruleSet, values);
    }

    @Nested
    @DisplayName("Value setting rules")
    class ValueSetTests {

        @Test
        @DisplayName("exact match should win and an unmatched value should fall back to the default")
        void exactMatchThenDefault() throws Exception {
            // Given
            EntityRuleContext context = context(RuleSetFixtures.soilInvestigation(), Map.of());

            // When
            EditResult clay = engine.applyEdit(context, "soil_type", "clay");

            // Then
            assertEquals("low", context.requireField("permeability_class").getRawValue());
            assertEquals(1, clay.getAppliedEffects().size());
            assertEquals(1, clay.getAppliedEffects().get(0).depth());

            // When
            engine.applyEdit(context, "soil_type", "sand");

            // Then
            assertEquals("medium", context.requireField("permeability_class").getRawValue());
        }

        @Test
        @DisplayName("a rule without exact match or default should have no effect")
        void noMatchNoDefault() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("a", FieldType.TEXT), field("b", FieldType.TEXT)),
                    List.of(rule("r", "a", "b", ControlEffectType.VALUE_SET, mapping(Map.of("x", "y")))));
            EntityRuleContext context = context(ruleSet, Map.of("b", "kept"));

            // When
            EditResult result = engine.applyEdit(context, "a", "other");

            // Then
            assertEquals("kept", context.requireField("b").getRawValue());
            assertTrue(result.getAppliedEffects().isEmpty());
        }

        @Test
        @DisplayName("numeric source values should match mapping keys in canonical form")
        void canonicalKeys() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("grade", FieldType.NUMBER), field("label", FieldType.TEXT)),
                    List.of(rule("r", "grade", "label", ControlEffectType.VALUE_SET, mapping(Map.of("2.5", "mid")))));
            EntityRuleContext context = context(ruleSet, Map.of());

            // When
            engine.applyEdit(context, "grade", new BigDecimal("2.50"));

            // Then
            assertEquals("mid", context.requireField("label").getRawValue());
        }

        @Test
        @DisplayName("a value set on a field should recompute formulas reading it and continue from changed formulas")
        void shouldCascadeThroughFormula() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("mode", FieldType.TEXT),
                            field("factor", FieldType.NUMBER),
                            formulaField("is_high", "{{factor}} > 5"),
                            field("warning", FieldType.TEXT)),
                    List.of(rule("mode-factor", "mode", "factor", ControlEffectType.VALUE_SET,
                                    mapping(Map.of("high", 10), 1)),
                            rule("high-warning", "is_high", "warning", ControlEffectType.VALUE_SET,
                                    mapping(Map.of("true", "check load"), "none"))));
            EntityRuleContext context = context(ruleSet, Map.of("factor", 1));

            // When
            EditResult result = engine.applyEdit(context, "mode", "high");

            // Then
            assertEquals(Boolean.TRUE, context.requireField("is_high").getFormulaValue());
            assertEquals("check load", context.requireField("warning").getRawValue());
            assertEquals(Set.of("mode", "factor", "is_high", "warning"), result.getChangedFieldIds());
            assertEquals(2, result.getAppliedEffects().get(1).depth());
        }

        @Test
        @DisplayName("a rule targeting a formula field should be reported and skipped")
        void shouldNotSetFormulaField() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("a", FieldType.TEXT), field("x", FieldType.NUMBER), formulaField("calc", "{{x}} * 2")),
                    List.of(rule("r", "a", "calc", ControlEffectType.VALUE_SET, mapping(Map.of(), 99))));
            EntityRuleContext context = context(ruleSet, Map.of("x", 2));

            // When
            EditResult result = engine.applyEdit(context, "a", "go");

            // Then
            assertEquals(1, result.getControlErrors().size());
            assertEquals(DocHelperRulesErrorCodes.FORMULA_FIELD_NOT_EDITABLE, result.getControlErrors().get(0).errorCode());
            assertEquals(0, new BigDecimal("4").compareTo((BigDecimal) context.requireField("calc").getFormulaValue()));
        }
    }

    @Nested
    @DisplayName("Chain depth")
    class ChainDepthTests {

        @Test
        @DisplayName("a chain of exactly ten value setting rules should complete")
        void chainOfTenSucceeds() throws Exception {
            // Given
            EntityRuleContext context = context(valueSetChain(10), Map.of());

            // When
            EditResult result = engine.applyEdit(context, "f0", "start");

            // Then
            assertTrue(result.getControlErrors().isEmpty());
            assertEquals(10, result.getAppliedEffects().size());
            assertEquals("v10", context.requireField("f10").getRawValue());
            assertEquals(10, result.getAppliedEffects().get(9).depth());
        }

        @Test
        @DisplayName("the eleventh hop should fail with depth exceeded and keep earlier effects")
        void chainOfElevenFails() throws Exception {
            // Given
            EntityRuleContext context = context(valueSetChain(11), Map.of());

            // When
            EditResult result = engine.applyEdit(context, "f0", "start");

            // Then
            assertEquals(1, result.getControlErrors().size());
            ControlPropagationError error = result.getControlErrors().get(0);
            assertEquals(DocHelperRulesErrorCodes.CHAIN_DEPTH_EXCEEDED, error.errorCode());
            assertEquals("hop-11", error.ruleId());
            assertEquals("f11", error.fieldPath().get(error.fieldPath().size() - 1));
            assertEquals("v10", context.requireField("f10").getRawValue());
            assertNull(context.requireField("f11").getRawValue());
        }

        @Test
        @DisplayName("two rules setting each other in a cycle should stop at the maximum depth")
        void cyclicPairStopsAtMaximumDepth() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("a", FieldType.TEXT), field("b", FieldType.TEXT)),
                    List.of(rule("ab", "a", "b", ControlEffectType.VALUE_SET, mapping(Map.of("x", "p", "y", "q"))),
                            rule("ba", "b", "a", ControlEffectType.VALUE_SET, mapping(Map.of("p", "y", "q", "x")))));
            EntityRuleContext context = context(ruleSet, Map.of());

            // When
            EditResult result = engine.applyEdit(context, "a", "x");

            // Then
            assertTrue(result.isAccepted());
            assertEquals(10, result.getAppliedEffects().size());
            assertEquals(1, result.getControlErrors().size());
            ControlPropagationError error = result.getControlErrors().get(0);
            assertEquals(DocHelperRulesErrorCodes.CHAIN_DEPTH_EXCEEDED, error.errorCode());
            assertEquals("ab", error.ruleId());
            assertEquals(12, error.fieldPath().size());
            assertEquals(List.of("a", "b", "a", "b"), error.fieldPath().subList(0, 4));
            assertEquals("y", context.requireField("a").getRawValue());
            assertEquals("p", context.requireField("b").getRawValue());
        }

        @Test
        @DisplayName("the maximum depth should follow the engine configuration")
        void configurableDepth() throws Exception {
            // Given
            DocHelperRulesEngine shallow = new DocHelperRulesEngine(
                    DocHelperRulesEngineConfig.builder().maxControlChainDepth(3).build());
            EntityRuleContext context = shallow.createContext("entity-2", valueSetChain(4), Map.of());

            // When
            EditResult result = shallow.applyEdit(context, "f0", "start");

            // Then
            assertEquals(3, result.getAppliedEffects().size());
            assertEquals(DocHelperRulesErrorCodes.CHAIN_DEPTH_EXCEEDED, result.getControlErrors().get(0).errorCode());
        }
    }

    @Nested
    @DisplayName("Visibility and enablement")
    class PresentationTests {

        @Test
        @DisplayName("visibility rules should apply at load and on edit")
        void visibilityRule() throws Exception {
            // Given
            EntityRuleContext context = context(RuleSetFixtures.soilInvestigation(), Map.of("groundwater_encountered", false));

            // Then
            assertFalse(context.requireField("groundwater_depth").isVisible());

            // When
            EditResult result = engine.applyEdit(context, "groundwater_encountered", true);

            // Then
            assertTrue(context.requireField("groundwater_depth").isVisible());
            assertTrue(result.getChange("groundwater_depth").isVisibilityChanged());
            assertEquals(ControlEffectType.VISIBILITY, result.getAppliedEffects().get(0).effectType());
        }

        @Test
        @DisplayName("enable rules should toggle enablement without touching values")
        void enableRule() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("locked", FieldType.CHECKBOX), field("notes", FieldType.TEXTAREA)),
                    List.of(rule("lock-notes", "locked", "notes", ControlEffectType.ENABLE,
                            mapping(Map.of("true", false), true))));
            EntityRuleContext context = context(ruleSet, Map.of("notes", "keep me"));

            // When
            engine.applyEdit(context, "locked", true);

            // Then
            assertFalse(context.requireField("notes").isEnabled());
            assertEquals("keep me", context.requireField("notes").getRawValue());
        }
    }

    @Nested
    @DisplayName("Rule conditions")
    class ConditionTests {

        private RuleSetDefinition loadRuleSet(String condition) {
            ControlRuleDefinition overLimit = rule("over-limit", "load", "status", ControlEffectType.VALUE_SET,
                    mapping(Map.of("true", "over", "false", "ok")));
            overLimit.setCondition(condition);
            return ruleSet(
                    List.of(field("load", FieldType.NUMBER), field("limit", FieldType.NUMBER), field("status", FieldType.TEXT)),
                    List.of(overLimit));
        }

        @Test
        @DisplayName("the mapping should be looked up by the condition value and rerun when a referenced field changes")
        void conditionDrivesMapping() throws Exception {
            // Given
            EntityRuleContext context = context(loadRuleSet("{{load}} > {{limit}}"), Map.of("load", 5, "limit", 10));

            // When
            EditResult over = engine.applyEdit(context, "load", 12);

            // Then
            assertEquals("over", context.requireField("status").getRawValue());
            assertEquals(1, over.getAppliedEffects().size());

            // When
            EditResult raised = engine.applyEdit(context, "limit", 20);

            // Then
            assertEquals("ok", context.requireField("status").getRawValue());
            assertEquals("over-limit", raised.getAppliedEffects().get(0).ruleId());
            assertEquals(1, raised.getAppliedEffects().get(0).depth());
        }

        @Test
        @DisplayName("a condition that fails to evaluate should be reported with the formula error code and skipped")
        void failingCondition() throws Exception {
            // Given
            EntityRuleContext context = context(loadRuleSet("{{load}} / {{limit}} > 1"), Map.of("load", 5, "limit", 10));

            // When
            EditResult result = engine.applyEdit(context, "limit", 0);

            // Then
            assertTrue(result.isAccepted());
            assertEquals(1, result.getControlErrors().size());
            ControlPropagationError error = result.getControlErrors().get(0);
            assertEquals(DocHelperRulesErrorCodes.DIVISION_BY_ZERO, error.errorCode());
            assertEquals("over-limit", error.ruleId());
            assertEquals(List.of("limit", "status"), error.fieldPath());
            assertNull(context.requireField("status").getRawValue());
        }

        @Test
        @DisplayName("a condition that does not parse or reads an unknown field should reject the rule set")
        void invalidCondition() {
            // Given
            Set<String> fieldIds = Set.of("load", "limit", "status");

            // When
            FormulaParseException parseError = assertThrows(FormulaParseException.class,
                    () -> ControlRuleTable.from(loadRuleSet("{{load}} >"), fieldIds, new FormulaCompiler()));

            // Then
            assertTrue(parseError.getMessage().startsWith("Condition of control rule [over-limit]"));
            assertThrows(RuleSetDefinitionException.class,
                    () -> ControlRuleTable.from(loadRuleSet("{{missing}} > 1"), fieldIds, new FormulaCompiler()));
        }

        @Test
        @DisplayName("a rule should be triggered by its source and by every field its condition reads")
        void conditionTriggers() throws Exception {
            // When
            ControlRuleTable table = ControlRuleTable.from(
                    loadRuleSet("{{load}} > {{limit}}"), Set.of("load", "limit", "status"), new FormulaCompiler());

            // Then
            assertEquals(1, table.getRulesForSource("load").size());
            assertEquals(1, table.getRulesForSource("limit").size());
            assertTrue(table.getRulesForSource("status").isEmpty());
            assertTrue(table.getCondition("over-limit").isPresent());
        }
    }

    @Nested
    @DisplayName("Override conflicts")
    class OverrideConflictTests {

        @Test
        @DisplayName("a value set over a pending override should record a non blocking control conflict")
        void controlConflict() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("a", FieldType.TEXT), field("b", FieldType.TEXT)),
                    List.of(rule("r", "a", "b", ControlEffectType.VALUE_SET, mapping(Map.of("x", "p")))));
            EntityRuleContext context = context(ruleSet, Map.of());
            OverrideRecord record = engine.recordExternalValue(context, "b", "q").override();

            // When
            EditResult result = engine.applyEdit(context, "a", "x");

            // Then
            assertEquals("p", context.requireField("b").getRawValue());
            assertEquals(1, result.getOverrideConflicts().size());
            OverrideConflict conflict = result.getOverrideConflicts().get(0);
            assertEquals(ConflictType.CONTROL, conflict.getType());
            assertEquals("q", conflict.getOverrideValue());
            assertEquals("p", conflict.getControlValue());
            assertFalse(conflict.isBlocking());

            // When
            OverrideAcceptance acceptance = engine.acceptOverride(context, record.getId());

            // Then
            assertEquals(OverrideAcceptance.Outcome.ACCEPTED, acceptance.outcome());
            assertEquals("q", context.requireField("b").getRawValue());
        }

        @Test
        @DisplayName("a rule targeting an overridden formula field should record a formula and control conflict")
        void formulaControlConflict() throws Exception {
            // Given
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("a", FieldType.TEXT), field("n", FieldType.NUMBER), formulaField("calc", "{{n}} * 2")),
                    List.of(rule("r", "a", "calc", ControlEffectType.VALUE_SET, mapping(Map.of("x", 5)))));
            EntityRuleContext context = context(ruleSet, Map.of("n", 1));
            engine.recordExternalValue(context, "calc", "7");

            // When
            EditResult result = engine.applyEdit(context, "a", "x");

            // Then
            assertEquals(DocHelperRulesErrorCodes.FORMULA_FIELD_NOT_EDITABLE, result.getControlErrors().get(0).errorCode());
            OverrideConflict conflict = context.findConflict("calc").orElseThrow();
            assertEquals(List.of(conflict), result.getOverrideConflicts());
            assertEquals(ConflictType.FORMULA_CONTROL, conflict.getType());
            assertEquals(0, new BigDecimal("2").compareTo((BigDecimal) conflict.getComputedValue()));
            assertEquals("5", CastUtil.canonical(conflict.getControlValue()));
            assertFalse(conflict.isBlocking());
        }
    }

    @Nested
    @DisplayName("Rule table")
    class RuleTableTests {

        @Test
        @DisplayName("rules should be ordered by priority then id and disabled rules skipped")
        void ruleOrdering() throws Exception {
            // Given
            ControlRuleDefinition low = rule("b-low", "s", "t", ControlEffectType.VALUE_SET, mapping(Map.of(), 1));
            ControlRuleDefinition alsoLow = rule("a-low", "s", "t", ControlEffectType.VALUE_SET, mapping(Map.of(), 2));
            ControlRuleDefinition high = rule("z-high", "s", "t", ControlEffectType.VALUE_SET, mapping(Map.of(), 3));
            high.setPriority(5);
            ControlRuleDefinition disabled = rule("disabled", "s", "t", ControlEffectType.VALUE_SET, mapping(Map.of(), 4));
            disabled.setEnabled(false);
            RuleSetDefinition ruleSet = ruleSet(
                    List.of(field("s", FieldType.TEXT), field("t", FieldType.TEXT)),
                    List.of(low, alsoLow, high, disabled));

            // When
            ControlRuleTable table = ControlRuleTable.from(ruleSet, Set.of("s", "t"), new FormulaCompiler());

            // Then
            assertEquals(List.of("z-high", "a-low", "b-low"),
                    table.getRulesForSource("s").stream().map(ControlRuleDefinition::getId).toList());
            assertTrue(table.getRulesForSource("t").isEmpty());
        }

        @Test
        @DisplayName("rules referencing unknown fields or duplicated ids should be rejected")
        void invalidRules() {
            RuleSetDefinition unknown = ruleSet(
                    List.of(field("s", FieldType.TEXT)),
                    List.of(rule("r", "s", "missing", ControlEffectType.VALUE_SET, mapping(Map.of()))));
            assertThrows(RuleSetDefinitionException.class, () -> ControlRuleTable.from(unknown, Set.of("s"), new FormulaCompiler()));

            RuleSetDefinition duplicate = ruleSet(
                    List.of(field("s", FieldType.TEXT)),
                    List.of(rule("r", "s", "s", ControlEffectType.VALUE_SET, mapping(Map.of())),
                            rule("r", "s", "s", ControlEffectType.ENABLE, mapping(Map.of()))));
            assertThrows(RuleSetDefinitionException.class, () -> ControlRuleTable.from(duplicate, Set.of("s"), new FormulaCompiler()));
        }
    }
}
