package com.dochelper.rules.core.models;

import com.dochelper.rules.core.engine.formula.evaluator.FormulaEvaluationError;
import com.dochelper.rules.integration.models.schema.FieldDefinition;
import lombok.Data;

/**
 * Runtime state of one field of an entity instance.
 *
 * <p>{@code rawValue} holds what a user or control rule entered and is ignored
 * for formula derived fields, whose value lives in {@code formulaValue}. A
 * formula field whose last evaluation failed keeps its last valid value and
 * records the error.</p>
 */
@Data
public class FieldValueState {
    private final String fieldId;
    private final FieldDefinition definition;
    private final boolean formulaDerived;
    private Object rawValue;
    private Object formulaValue;
    private FormulaEvaluationError formulaError;
    private boolean visible;
    private boolean enabled;

    public FieldValueState(FieldDefinition definition, Object rawValue) {
        this.fieldId = definition.getId();
        this.definition = definition;
        this.formulaDerived = definition.isFormulaField();
        this.rawValue = rawValue;
        this.visible = true;
        this.enabled = true;
    }

    /**
     * Value other formulas and control rules see for this field.
     */
    public Object getEffectiveValue() {
        return formulaDerived ? formulaValue : rawValue;
    }

    public boolean isFormulaFailed() {
        return formulaError != null;
    }

    public FieldValueState copy() {
        FieldValueState copy = new FieldValueState(definition, rawValue);
        copy.setFormulaValue(formulaValue);
        copy.setFormulaError(formulaError);
        copy.setVisible(visible);
        copy.setEnabled(enabled);
        return copy;
    }
}
