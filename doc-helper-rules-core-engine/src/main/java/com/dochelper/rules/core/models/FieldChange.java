package com.dochelper.rules.core.models;

import com.dochelper.rules.core.util.CastUtil;

/**
 * Before and after state of a field touched by one edit pass.
 */
public record FieldChange(String fieldId,
                          Object previousValue,
                          Object value,
                          boolean previousVisible,
                          boolean visible,
                          boolean previousEnabled,
                          boolean enabled) {

    public boolean isValueChanged() {
        return !CastUtil.sameValue(previousValue, value);
    }

    public boolean isVisibilityChanged() {
        return previousVisible != visible;
    }

    public boolean isEnabledChanged() {
        return previousEnabled != enabled;
    }

    static FieldChange between(FieldValueState before, FieldValueState after) {
        return new FieldChange(
                after.getFieldId(),
                before.getEffectiveValue(),
                after.getEffectiveValue(),
                before.isVisible(),
                after.isVisible(),
                before.isEnabled(),
                after.isEnabled());
    }
}
