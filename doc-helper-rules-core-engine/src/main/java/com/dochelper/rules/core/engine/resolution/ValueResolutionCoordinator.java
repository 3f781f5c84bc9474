package com.dochelper.rules.core.engine.resolution;

import com.dochelper.rules.core.engine.override.OverrideRecord;
import com.dochelper.rules.core.models.EntityRuleContext;
import com.dochelper.rules.core.models.FieldValueState;
import com.dochelper.rules.integration.enumerations.FieldValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Picks the single authoritative value of a field.
 *
 * <p>Priority, highest first:</p>
 * <ol>
 *   <li>an ACCEPTED, SYNCED or SYNCED_FORMULA override marked for use in generation</li>
 *   <li>the formula value, when the field is formula derived</li>
 *   <li>the raw value</li>
 * </ol>
 *
 * <p>{@link #resolve(FieldValueState, OverrideRecord)} depends only on its
 * arguments.</p>
 */
public class ValueResolutionCoordinator {

    public ResolvedFieldValue resolve(FieldValueState field, OverrideRecord override) {
        if (override != null && override.getFieldId().equals(field.getFieldId()) && override.isEffectiveForResolution()) {
            return new ResolvedFieldValue(field.getFieldId(), override.getObservedValue(), FieldValueSource.OVERRIDE, override.getId());
        }
        return resolveSystemValue(field);
    }

    /**
     * Resolution ignoring any override: the value the system itself holds.
     */
    public ResolvedFieldValue resolveSystemValue(FieldValueState field) {
        if (field.isFormulaDerived()) {
            return new ResolvedFieldValue(field.getFieldId(), field.getFormulaValue(), FieldValueSource.FORMULA, null);
        }
        return new ResolvedFieldValue(field.getFieldId(), field.getRawValue(), FieldValueSource.RAW, null);
    }

    public ResolvedFieldValue resolve(EntityRuleContext context, String fieldId) {
        FieldValueState field = context.requireField(fieldId);
        return resolve(field, context.findActiveOverride(fieldId).orElse(null));
    }

    public Map<String, ResolvedFieldValue> resolveAll(EntityRuleContext context) {
        Map<String, ResolvedFieldValue> resolved = new LinkedHashMap<>();
        context.getFields().keySet().forEach(fieldId -> resolved.put(fieldId, resolve(context, fieldId)));
        return resolved;
    }
}
