package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import com.dochelper.rules.core.exception.override.OverrideNotFoundException;
import com.dochelper.rules.core.exception.override.OverrideStateTransitionException;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.models.FieldValueState;
import com.dochelper.rules.core.util.CastUtil;
import com.dochelper.rules.integration.contract.IDocHelperFieldValidator;
import com.dochelper.rules.integration.enumerations.OverrideState;
import com.dochelper.rules.integration.models.validation.FieldValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives overrides through the {@link OverrideTransitionTable} and tracks
 * conflicting observed values.
 *
 * <p>Generation bookkeeping: {@link #markGenerated(EntityRuleContext)} counts
 * generations and stamps each override it moves to SYNCED with the generation
 * number. {@link #cleanupAfterGeneration(EntityRuleContext)} only deletes
 * non formula SYNCED overrides stamped by an earlier generation, so an override
 * first used in generation N is deleted after generation N + 1.</p>
 */
@Slf4j
public class OverrideReconciler {

    private final Clock clock;
    private final OverrideConflictDetector conflictDetector;

    public OverrideReconciler(Clock clock, OverrideConflictDetector conflictDetector) {
        this.clock = clock;
        this.conflictDetector = conflictDetector;
    }

    public OverrideReconciler(Clock clock) {
        this(clock, new OverrideConflictDetector(clock));
    }

    public ExternalValueObservation recordExternalValue(EntityRuleContext context,
                                                        String fieldId,
                                                        Object systemValue,
                                                        Object observedValue) {
        FieldValueState field = context.requireField(fieldId);
        Optional<OverrideRecord> active = context.findActiveOverride(fieldId);

        if (active.isPresent()) {
            OverrideRecord existing = active.get();
            if (CastUtil.sameValue(existing.getObservedValue(), observedValue)) {
                return new ExternalValueObservation(ExternalValueObservation.Outcome.UNCHANGED, existing, null);
            }
            if (existing.getState() == OverrideState.PENDING || existing.getState() == OverrideState.ACCEPTED) {
                OverrideConflict conflict = conflictDetector.detectValueConflict(context, existing, observedValue);
                return new ExternalValueObservation(ExternalValueObservation.Outcome.CONFLICT, existing, conflict);
            }
            log.info("Override [{}] in state {} superseded by a new external value for field [{}]",
                    existing.getId(), existing.getState(), fieldId);
            context.removeOverride(existing.getId());
            context.removeConflict(fieldId);
        }

        if (CastUtil.sameValue(systemValue, observedValue)) {
            return new ExternalValueObservation(ExternalValueObservation.Outcome.MATCHES_SYSTEM, null, null);
        }

        removeInvalidOverrides(context, fieldId);
        OverrideRecord record = new OverrideRecord(
                context.nextOverrideId(),
                context.getEntityInstanceId(),
                fieldId,
                field.isFormulaDerived(),
                observedValue,
                systemValue,
                clock.instant());
        context.putOverride(record);
        log.debug("Created override [{}] for field [{}]: system [{}], observed [{}]",
                record.getId(), fieldId, systemValue, observedValue);
        OverrideConflict formulaConflict = field.isFormulaDerived()
                ? conflictDetector.detectFormulaConflict(context, fieldId, systemValue).orElse(null)
                : null;
        return new ExternalValueObservation(ExternalValueObservation.Outcome.CREATED, record, formulaConflict);
    }

    /**
     * Moves a PENDING override to ACCEPTED when its observed value passes the
     * field's validation, otherwise to INVALID.
     */
    public OverrideRecord validate(EntityRuleContext context, String overrideId, IDocHelperFieldValidator validator) {
        OverrideRecord record = requireOverride(context, overrideId);
        FieldValueState field = context.requireField(record.getFieldId());
        FieldValidationResult result = validator.validate(field.getDefinition(), record.getObservedValue());
        if (result.isValid()) {
            OverrideTransitionTable.transition(record, OverrideState.ACCEPTED);
            record.setValidationErrors(List.of());
        } else {
            OverrideTransitionTable.transition(record, OverrideState.INVALID);
            record.setValidationErrors(result.getViolations());
            log.info("Override [{}] for field [{}] failed validation: {}",
                    overrideId, record.getFieldId(), result.getViolations());
        }
        record.setUpdatedAt(clock.instant());
        return record;
    }

    /**
     * Records a successful generation: ACCEPTED overrides used in it become
     * SYNCED, and formula field overrides synced by an earlier generation
     * become SYNCED_FORMULA.
     *
     * @return the overrides whose state changed
     */
    public List<OverrideRecord> markGenerated(EntityRuleContext context) {
        int generation = context.incrementGenerationCount();
        Instant now = clock.instant();
        List<OverrideRecord> transitioned = new ArrayList<>();
        for (OverrideRecord record : context.getOverrides()) {
            if (record.getState() == OverrideState.ACCEPTED && record.isUseInGeneration()) {
                OverrideTransitionTable.transition(record, OverrideState.SYNCED);
                record.setSyncedAtGeneration(generation);
                record.setUpdatedAt(now);
                transitioned.add(record);
            } else if (record.getState() == OverrideState.SYNCED
                    && record.isFormulaField()
                    && record.getSyncedAtGeneration() < generation) {
                OverrideTransitionTable.transition(record, OverrideState.SYNCED_FORMULA);
                record.setUpdatedAt(now);
                transitioned.add(record);
            }
        }
        log.debug("Generation {} of entity [{}] synced {} override(s)",
                generation, context.getEntityInstanceId(), transitioned.size());
        return transitioned;
    }

    /**
     * Deletes non formula SYNCED overrides already written by an earlier
     * generation and clears conflicts on their fields. SYNCED_FORMULA overrides
     * are kept.
     *
     * @return number of deleted overrides
     */
    public int cleanupAfterGeneration(EntityRuleContext context) {
        int generation = context.getGenerationCount();
        List<OverrideRecord> removable = context.getOverrides().stream()
                .filter(record -> record.getState() == OverrideState.SYNCED)
                .filter(record -> !record.isFormulaField())
                .filter(record -> record.getSyncedAtGeneration() < generation)
                .toList();
        for (OverrideRecord record : removable) {
            context.removeOverride(record.getId());
            context.removeConflict(record.getFieldId());
        }
        if (!removable.isEmpty()) {
            log.info("Removed {} synced override(s) of entity [{}] after generation {}",
                    removable.size(), context.getEntityInstanceId(), generation);
        }
        return removable.size();
    }

    /**
     * Settles a conflict with an explicitly chosen value. A PENDING override
     * takes the chosen value; an override past PENDING is replaced by a new
     * PENDING one unless it already holds the chosen value.
     */
    public OverrideRecord resolveConflict(EntityRuleContext context, String fieldId, Object chosenValue) {
        OverrideConflict conflict = context.findConflict(fieldId)
                .orElseThrow(() -> new DocHelperRulesRuntimeException(
                        "No open override conflict for field [" + fieldId + "] of entity [" + context.getEntityInstanceId() + "]"));
        OverrideRecord existing = context.findActiveOverride(fieldId)
                .orElseThrow(() -> new DocHelperRulesRuntimeException(
                        "Override conflict for field [" + fieldId + "] has no active override"));
        if (!conflict.hasCandidate(chosenValue)) {
            log.info("Conflict on field [{}] resolved with a value outside its candidates: [{}]", fieldId, chosenValue);
        }

        OverrideRecord resolved = existing;
        if (existing.getState() == OverrideState.PENDING) {
            existing.setObservedValue(chosenValue);
            existing.setUpdatedAt(clock.instant());
        } else if (!CastUtil.sameValue(existing.getObservedValue(), chosenValue)) {
            context.removeOverride(existing.getId());
            resolved = new OverrideRecord(
                    context.nextOverrideId(),
                    context.getEntityInstanceId(),
                    fieldId,
                    existing.isFormulaField(),
                    chosenValue,
                    existing.getSystemValue(),
                    clock.instant());
            context.putOverride(resolved);
        }
        context.removeConflict(fieldId);
        FieldValueState field = context.requireField(fieldId);
        if (field.isFormulaDerived()) {
            conflictDetector.detectFormulaConflict(context, fieldId, field.getFormulaValue());
        }
        return resolved;
    }

    /**
     * Deletes a PENDING or INVALID override.
     */
    public void reject(EntityRuleContext context, String overrideId) {
        OverrideRecord record = requireOverride(context, overrideId);
        if (record.getState() != OverrideState.PENDING && record.getState() != OverrideState.INVALID) {
            throw OverrideStateTransitionException.illegalOperation(overrideId, record.getState(), "reject");
        }
        context.removeOverride(overrideId);
        context.removeConflict(record.getFieldId());
        log.debug("Rejected override [{}] for field [{}]", overrideId, record.getFieldId());
    }

    public OverrideRecord setUseInGeneration(EntityRuleContext context, String overrideId, boolean useInGeneration) {
        OverrideRecord record = requireOverride(context, overrideId);
        record.setUseInGeneration(useInGeneration);
        record.setUpdatedAt(clock.instant());
        return record;
    }

    /**
     * Refreshes the system value of PENDING overrides on changed fields. An
     * override whose observed value the system value has caught up with is
     * obsolete and removed. Overrides of formula fields have their formula
     * conflict checked against the new value in every active state.
     *
     * @return the removed overrides
     */
    public List<OverrideRecord> observeSystemValues(EntityRuleContext context,
                                                    Collection<String> changedFieldIds,
                                                    Function<String, Object> systemValueOf) {
        List<OverrideRecord> obsolete = new ArrayList<>();
        for (String fieldId : changedFieldIds) {
            Optional<OverrideRecord> active = context.findActiveOverride(fieldId);
            if (active.isEmpty()) {
                continue;
            }
            OverrideRecord record = active.get();
            Object systemValue = systemValueOf.apply(fieldId);
            if (record.getState() == OverrideState.PENDING) {
                if (CastUtil.sameValue(systemValue, record.getObservedValue())) {
                    context.removeOverride(record.getId());
                    context.removeConflict(fieldId);
                    obsolete.add(record);
                    log.info("Override [{}] for field [{}] is obsolete, system value now matches", record.getId(), fieldId);
                    continue;
                }
                record.setSystemValue(systemValue);
                record.setUpdatedAt(clock.instant());
            }
            if (record.isFormulaField()) {
                conflictDetector.detectFormulaConflict(context, fieldId, context.requireField(fieldId).getFormulaValue());
            }
        }
        return obsolete;
    }

    private OverrideRecord requireOverride(EntityRuleContext context, String overrideId) {
        return context.findOverride(overrideId)
                .orElseThrow(() -> new OverrideNotFoundException(overrideId));
    }

    private void removeInvalidOverrides(EntityRuleContext context, String fieldId) {
        context.getOverrides().stream()
                .filter(record -> record.getFieldId().equals(fieldId) && record.getState() == OverrideState.INVALID)
                .map(OverrideRecord::getId)
                .toList()
                .forEach(context::removeOverride);
    }
}
