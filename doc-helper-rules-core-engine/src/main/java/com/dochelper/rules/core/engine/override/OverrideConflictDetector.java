package com.dochelper.rules.core.engine.override;

import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.util.CastUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Compares a field's active override against the other sources that want to
 * set the field: further observed values, the field's formula and control
 * rules. A field carries at most one {@link OverrideConflict}; each check adds
 * its side to it or clears its side again when the values agree, and a
 * conflict with nothing left to disagree about is dropped.
 */
@Slf4j
public class OverrideConflictDetector {

    private final Clock clock;

    public OverrideConflictDetector(Clock clock) {
        this.clock = clock;
    }

    public OverrideConflict detectValueConflict(EntityRuleContext context, OverrideRecord existing, Object observedValue) {
        OverrideConflict conflict = open(context, existing.getFieldId(), existing.getObservedValue());
        conflict.addCandidate(observedValue);
        log.warn("Conflicting external values for field [{}] of entity [{}]: {}",
                existing.getFieldId(), context.getEntityInstanceId(), conflict.getCandidateValues());
        return conflict;
    }

    /**
     * @param computedValue the value the field's formula currently computes
     */
    public Optional<OverrideConflict> detectFormulaConflict(EntityRuleContext context, String fieldId, Object computedValue) {
        Optional<OverrideRecord> active = context.findActiveOverride(fieldId);
        if (active.isEmpty()) {
            return context.findConflict(fieldId);
        }
        if (CastUtil.sameValue(active.get().getObservedValue(), computedValue)) {
            return settle(context, fieldId, OverrideConflict::clearComputedValue);
        }
        OverrideConflict conflict = open(context, fieldId, active.get().getObservedValue());
        conflict.recordComputedValue(computedValue);
        log.info("Override of field [{}] of entity [{}] differs from its formula value: [{}] vs [{}]",
                fieldId, context.getEntityInstanceId(), active.get().getObservedValue(), computedValue);
        return Optional.of(conflict);
    }

    /**
     * @param controlValue the value a control rule set on the field
     */
    public Optional<OverrideConflict> detectControlConflict(EntityRuleContext context, String fieldId, Object controlValue) {
        Optional<OverrideRecord> active = context.findActiveOverride(fieldId);
        if (active.isEmpty()) {
            return context.findConflict(fieldId);
        }
        if (CastUtil.sameValue(active.get().getObservedValue(), controlValue)) {
            return settle(context, fieldId, OverrideConflict::clearControlValue);
        }
        OverrideConflict conflict = open(context, fieldId, active.get().getObservedValue());
        conflict.recordControlValue(controlValue);
        log.warn("Override of field [{}] of entity [{}] differs from a control rule value: [{}] vs [{}]",
                fieldId, context.getEntityInstanceId(), active.get().getObservedValue(), controlValue);
        return Optional.of(conflict);
    }

    /**
     * A control rule tried to set a formula field. Only an override that
     * differs from both values is a conflict.
     */
    public Optional<OverrideConflict> detectFormulaControlConflict(EntityRuleContext context,
                                                                   String fieldId,
                                                                   Object computedValue,
                                                                   Object controlValue) {
        Optional<OverrideRecord> active = context.findActiveOverride(fieldId);
        if (active.isEmpty()) {
            return context.findConflict(fieldId);
        }
        Object overrideValue = active.get().getObservedValue();
        if (CastUtil.sameValue(overrideValue, computedValue) || CastUtil.sameValue(overrideValue, controlValue)) {
            return context.findConflict(fieldId);
        }
        OverrideConflict conflict = open(context, fieldId, overrideValue);
        conflict.recordComputedValue(computedValue);
        conflict.recordControlValue(controlValue);
        log.warn("Override of field [{}] of entity [{}] differs from formula value [{}] and control value [{}]: [{}]",
                fieldId, context.getEntityInstanceId(), computedValue, controlValue, overrideValue);
        return Optional.of(conflict);
    }

    private OverrideConflict open(EntityRuleContext context, String fieldId, Object overrideValue) {
        OverrideConflict conflict = context.findConflict(fieldId)
                .orElseGet(() -> new OverrideConflict(fieldId, clock.instant(), Collections.singletonList(overrideValue)));
        context.putConflict(conflict);
        return conflict;
    }

    private Optional<OverrideConflict> settle(EntityRuleContext context, String fieldId, Consumer<OverrideConflict> clearSide) {
        Optional<OverrideConflict> conflict = context.findConflict(fieldId);
        if (conflict.isEmpty()) {
            return conflict;
        }
        clearSide.accept(conflict.get());
        if (conflict.get().isSettled()) {
            context.removeConflict(fieldId);
            return Optional.empty();
        }
        return conflict;
    }
}
