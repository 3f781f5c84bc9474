package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.RuleSetFixtures;
import com.dochelper.rules.core.engine.DocHelperRulesEngine;
import com.dochelper.rules.core.engine.config.DocHelperRulesEngineConfig;
import com.dochelper.rules.core.engine.validation.ConstraintFieldValidator;
import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import com.dochelper.rules.core.exception.override.OverrideNotFoundException;
import com.dochelper.rules.core.exception.override.OverrideStateTransitionException;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.integration.enumerations.OverrideState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OverrideReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private OverrideReconciler reconciler;
    private ConstraintFieldValidator validator;
    private EntityRuleContext context;

    @BeforeEach
    void setUp() throws Exception {
        reconciler = new OverrideReconciler(Clock.fixed(NOW, ZoneOffset.UTC));
        validator = new ConstraintFieldValidator();
        context = new DocHelperRulesEngine(DocHelperRulesEngineConfig.defaults())
                .createContext("borehole-7", RuleSetFixtures.soilInvestigation(), Map.of("depth_to", 10));
    }

    @Nested
    @DisplayName("Recording external values")
    class RecordTests {

        @Test
        @DisplayName("a value equal to the system value should not create an override")
        void matchingValueIgnored() {
            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "10.0");

            // Then
            assertEquals(ExternalValueObservation.Outcome.MATCHES_SYSTEM, observation.outcome());
            assertTrue(context.getOverrides().isEmpty());
        }

        @Test
        @DisplayName("a divergent value should create a PENDING override")
        void divergentValueCreatesPending() {
            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "15");

            // Then
            assertEquals(ExternalValueObservation.Outcome.CREATED, observation.outcome());
            OverrideRecord record = observation.override();
            assertEquals(OverrideState.PENDING, record.getState());
            assertEquals("15", record.getObservedValue());
            assertEquals(10, record.getSystemValue());
            assertEquals(NOW, record.getCreatedAt());
            assertTrue(record.isUseInGeneration());
            assertEquals("borehole-7-override-1", record.getId());
        }

        @Test
        @DisplayName("the same observed value twice should leave the override unchanged")
        void repeatedValueUnchanged() {
            // Given
            reconciler.recordExternalValue(context, "depth_to", 10, "15");

            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "15.00");

            // Then
            assertEquals(ExternalValueObservation.Outcome.UNCHANGED, observation.outcome());
            assertEquals(1, context.getOverrides().size());
        }

        @Test
        @DisplayName("a second different value should open a conflict listing both candidates")
        void secondValueConflicts() {
            // Given
            reconciler.recordExternalValue(context, "depth_to", 10, "15");

            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "20");

            // Then
            assertEquals(ExternalValueObservation.Outcome.CONFLICT, observation.outcome());
            assertEquals(List.of("15", "20"), observation.conflict().getCandidateValues());
            assertEquals(1, context.getOverrides().size(), "conflicts never create a second override");
            assertEquals(OverrideState.PENDING, observation.override().getState());

            // When a third round trip repeats a known candidate
            reconciler.recordExternalValue(context, "depth_to", 10, "20");

            // Then
            assertEquals(2, context.findConflict("depth_to").orElseThrow().getCandidateValues().size());
        }

        @Test
        @DisplayName("a new value should supersede a synced override")
        void syncedOverrideSuperseded() {
            // Given
            OverrideRecord first = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, first.getId(), validator);
            reconciler.markGenerated(context);

            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "30");

            // Then
            assertEquals(ExternalValueObservation.Outcome.CREATED, observation.outcome());
            assertTrue(context.findOverride(first.getId()).isEmpty());
            assertEquals("30", observation.override().getObservedValue());
        }
    }

    @Nested
    @DisplayName("Validation and rejection")
    class ValidationTests {

        @Test
        @DisplayName("a valid value should move the override to ACCEPTED")
        void validValueAccepted() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();

            // When
            reconciler.validate(context, record.getId(), validator);

            // Then
            assertEquals(OverrideState.ACCEPTED, record.getState());
            assertTrue(record.getValidationErrors().isEmpty());
        }

        @Test
        @DisplayName("an out of range value should move the override to INVALID with reasons")
        void invalidValueRejected() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "900").override();

            // When
            reconciler.validate(context, record.getId(), validator);

            // Then
            assertEquals(OverrideState.INVALID, record.getState());
            assertFalse(record.getValidationErrors().isEmpty());
            assertTrue(context.findActiveOverride("depth_to").isEmpty());
        }

        @Test
        @DisplayName("validating an already accepted override should be an illegal transition")
        void revalidationIllegal() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, record.getId(), validator);

            // Then
            assertThrows(OverrideStateTransitionException.class,
                    () -> reconciler.validate(context, record.getId(), validator));
        }

        @Test
        @DisplayName("only PENDING and INVALID overrides may be rejected")
        void rejectRules() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, record.getId(), validator);

            // Then
            assertThrows(OverrideStateTransitionException.class, () -> reconciler.reject(context, record.getId()));

            // Given
            OverrideRecord pending = reconciler.recordExternalValue(context, "depth_from", 0, "3").override();

            // When
            reconciler.reject(context, pending.getId());

            // Then
            assertTrue(context.findOverride(pending.getId()).isEmpty());
            assertThrows(OverrideNotFoundException.class, () -> reconciler.reject(context, pending.getId()));
        }

        @Test
        @DisplayName("an invalid override should be replaced when a new divergent value arrives")
        void invalidReplaced() {
            // Given
            OverrideRecord invalid = reconciler.recordExternalValue(context, "depth_to", 10, "900").override();
            reconciler.validate(context, invalid.getId(), validator);

            // When
            ExternalValueObservation observation = reconciler.recordExternalValue(context, "depth_to", 10, "12");

            // Then
            assertEquals(ExternalValueObservation.Outcome.CREATED, observation.outcome());
            assertEquals(1, context.getOverrides().size());
            assertTrue(context.findOverride(invalid.getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Conflict resolution")
    class ConflictTests {

        @Test
        @DisplayName("choosing a value should update the pending override and close the conflict")
        void resolvePendingConflict() {
            // Given
            reconciler.recordExternalValue(context, "depth_to", 10, "15");
            reconciler.recordExternalValue(context, "depth_to", 10, "20");

            // When
            OverrideRecord resolved = reconciler.resolveConflict(context, "depth_to", "20");

            // Then
            assertEquals("20", resolved.getObservedValue());
            assertEquals(OverrideState.PENDING, resolved.getState());
            assertTrue(context.findConflict("depth_to").isEmpty());
        }

        @Test
        @DisplayName("choosing a new value for an accepted override should replace it with a pending one")
        void resolveAcceptedConflict() {
            // Given
            OverrideRecord accepted = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, accepted.getId(), validator);
            reconciler.recordExternalValue(context, "depth_to", 10, "20");

            // When
            OverrideRecord resolved = reconciler.resolveConflict(context, "depth_to", "20");

            // Then
            assertNotEquals(accepted.getId(), resolved.getId());
            assertEquals(OverrideState.PENDING, resolved.getState());
            assertTrue(context.findOverride(accepted.getId()).isEmpty());
        }

        @Test
        @DisplayName("an override on a formula field should open a formula conflict that a second value turns blocking")
        void formulaConflictEscalates() {
            // When
            ExternalValueObservation first = reconciler.recordExternalValue(context, "layer_thickness", 10, "12");

            // Then
            assertEquals(ExternalValueObservation.Outcome.CREATED, first.outcome());
            assertEquals(ConflictType.FORMULA, first.conflict().getType());
            assertEquals(10, first.conflict().getComputedValue());
            assertFalse(first.conflict().isBlocking());

            // When
            ExternalValueObservation second = reconciler.recordExternalValue(context, "layer_thickness", 10, "14");

            // Then
            assertSame(first.conflict(), second.conflict());
            assertEquals(ConflictType.VALUE, second.conflict().getType());
            assertTrue(second.conflict().isBlocking());
            assertEquals(List.of("12", "14"), second.conflict().getCandidateValues());
        }

        @Test
        @DisplayName("resolving a field without a conflict should fail")
        void resolveWithoutConflict() {
            assertThrows(DocHelperRulesRuntimeException.class,
                    () -> reconciler.resolveConflict(context, "depth_to", "20"));
        }
    }

    @Nested
    @DisplayName("Generation sync")
    class GenerationTests {

        @Test
        @DisplayName("accepted overrides should sync on generation and be removed after the next one")
        void acceptedLifecycle() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, record.getId(), validator);

            // When
            List<OverrideRecord> synced = reconciler.markGenerated(context);
            int removedFirst = reconciler.cleanupAfterGeneration(context);

            // Then
            assertEquals(List.of(record), synced);
            assertEquals(OverrideState.SYNCED, record.getState());
            assertEquals(1, record.getSyncedAtGeneration());
            assertEquals(0, removedFirst);

            // When
            reconciler.markGenerated(context);
            int removedSecond = reconciler.cleanupAfterGeneration(context);

            // Then
            assertEquals(1, removedSecond);
            assertTrue(context.getOverrides().isEmpty());
            assertEquals(2, context.getGenerationCount());
        }

        @Test
        @DisplayName("overrides excluded from generation should stay accepted")
        void excludedOverrideNotSynced() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();
            reconciler.validate(context, record.getId(), validator);
            reconciler.setUseInGeneration(context, record.getId(), false);

            // When
            List<OverrideRecord> synced = reconciler.markGenerated(context);

            // Then
            assertTrue(synced.isEmpty());
            assertEquals(OverrideState.ACCEPTED, record.getState());
        }

        @Test
        @DisplayName("formula field overrides should move to SYNCED_FORMULA and be kept")
        void formulaOverrideKept() {
            // Given
            OverrideRecord record = reconciler.recordExternalValue(context, "layer_thickness", 10, "12").override();
            reconciler.validate(context, record.getId(), validator);

            // When
            reconciler.markGenerated(context);
            reconciler.cleanupAfterGeneration(context);
            reconciler.markGenerated(context);
            int removed = reconciler.cleanupAfterGeneration(context);

            // Then
            assertTrue(record.isFormulaField());
            assertEquals(OverrideState.SYNCED_FORMULA, record.getState());
            assertEquals(0, removed);
            assertTrue(record.isEffectiveForResolution());
        }
    }

    @Test
    @DisplayName("a pending override should become obsolete once the system value matches it")
    void pendingOverrideObsolete() {
        // Given
        OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();

        // When
        List<OverrideRecord> obsolete = reconciler.observeSystemValues(context, List.of("depth_to"), fieldId -> 15);

        // Then
        assertEquals(List.of(record), obsolete);
        assertTrue(context.getOverrides().isEmpty());
    }

    @Test
    @DisplayName("a pending override should track a changed system value")
    void pendingOverrideTracksSystemValue() {
        // Given
        OverrideRecord record = reconciler.recordExternalValue(context, "depth_to", 10, "15").override();

        // When
        List<OverrideRecord> obsolete = reconciler.observeSystemValues(context, List.of("depth_to"), fieldId -> 12);

        // Then
        assertTrue(obsolete.isEmpty());
        assertEquals(12, record.getSystemValue());
    }
}
