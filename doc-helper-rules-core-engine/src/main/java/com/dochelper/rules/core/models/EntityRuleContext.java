package com.dochelper.rules.core.models;

import com.dochelper.rules.core.engine.control.ControlRuleTable;
import com.dochelper.rules.core.engine.formula.dependency.FormulaDependencyGraph;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaFieldOutcome;
import com.dochelper.rules.core.engine.formula.scheduler.FormulaRecomputeResult;
import com.dochelper.rules.core.engine.override.OverrideConflict;
import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.exception.context.UnknownFieldException;
import com.dochelper.rules.integration.models.schema.RuleSetDefinition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rule evaluation state of one entity instance: field values, visibility and
 * enablement, overrides and conflicts.
 *
 * <p>A context is owned by a single caller. Edits against it must be applied
 * one at a time, in order; the context does no locking of its own.</p>
 */
@Slf4j
@Getter
public class EntityRuleContext {
    private final String entityInstanceId;
    private final RuleSetDefinition ruleSet;
    private final FormulaDependencyGraph dependencyGraph;
    private final ControlRuleTable controlRuleTable;
    private final Map<String, FieldValueState> fields;
    private final Map<String, OverrideRecord> overrides;
    private final Map<String, OverrideConflict> conflicts;
    private int generationCount;
    private long overrideSequence;

    public EntityRuleContext(String entityInstanceId,
                             RuleSetDefinition ruleSet,
                             FormulaDependencyGraph dependencyGraph,
                             ControlRuleTable controlRuleTable,
                             List<FieldValueState> fieldStates) {
        this.entityInstanceId = entityInstanceId;
        this.ruleSet = ruleSet;
        this.dependencyGraph = dependencyGraph;
        this.controlRuleTable = controlRuleTable;
        this.fields = new LinkedHashMap<>();
        fieldStates.forEach(state -> fields.put(state.getFieldId(), state));
        this.overrides = new LinkedHashMap<>();
        this.conflicts = new LinkedHashMap<>();
        this.generationCount = 0;
        this.overrideSequence = 0;
    }

    public boolean hasField(String fieldId) {
        return fields.containsKey(fieldId);
    }

    public FieldValueState requireField(String fieldId) {
        FieldValueState state = fields.get(fieldId);
        if (state == null) {
            throw new UnknownFieldException(entityInstanceId, fieldId);
        }
        return state;
    }

    public Map<String, FieldValueState> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Effective value of every field, the input formulas evaluate against.
     */
    public Map<String, Object> getValueSnapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        fields.forEach((fieldId, state) -> snapshot.put(fieldId, state.getEffectiveValue()));
        return snapshot;
    }

    public Map<String, FieldValueState> captureFieldStates() {
        Map<String, FieldValueState> copies = new LinkedHashMap<>();
        fields.forEach((fieldId, state) -> copies.put(fieldId, state.copy()));
        return copies;
    }

    /**
     * Writes recomputed formula values back into the field states.
     *
     * @return ids of the formula fields whose value changed
     */
    public Set<String> applyFormulaResults(FormulaRecomputeResult result) {
        Set<String> changed = new LinkedHashSet<>();
        for (FormulaFieldOutcome outcome : result.getOutcomes().values()) {
            FieldValueState state = fields.get(outcome.fieldId());
            if (state == null) {
                continue;
            }
            if (outcome.isFailure()) {
                state.setFormulaError(outcome.error());
            } else {
                state.setFormulaError(null);
                state.setFormulaValue(outcome.value());
                if (outcome.changed()) {
                    changed.add(outcome.fieldId());
                }
            }
        }
        return changed;
    }

    public Collection<OverrideRecord> getOverrides() {
        return Collections.unmodifiableCollection(overrides.values());
    }

    public Optional<OverrideRecord> findOverride(String overrideId) {
        return Optional.ofNullable(overrides.get(overrideId));
    }

    /**
     * The single non invalid override of a field, if any.
     */
    public Optional<OverrideRecord> findActiveOverride(String fieldId) {
        return overrides.values().stream()
                .filter(record -> record.getFieldId().equals(fieldId) && record.isActive())
                .findFirst();
    }

    public void putOverride(OverrideRecord record) {
        overrides.put(record.getId(), record);
    }

    public void removeOverride(String overrideId) {
        overrides.remove(overrideId);
    }

    public String nextOverrideId() {
        overrideSequence++;
        return entityInstanceId + "-override-" + overrideSequence;
    }

    public Optional<OverrideConflict> findConflict(String fieldId) {
        return Optional.ofNullable(conflicts.get(fieldId));
    }

    public Collection<OverrideConflict> getConflicts() {
        return Collections.unmodifiableCollection(conflicts.values());
    }

    public void putConflict(OverrideConflict conflict) {
        conflicts.put(conflict.getFieldId(), conflict);
    }

    public void removeConflict(String fieldId) {
        conflicts.remove(fieldId);
    }

    public int incrementGenerationCount() {
        generationCount++;
        return generationCount;
    }
}
