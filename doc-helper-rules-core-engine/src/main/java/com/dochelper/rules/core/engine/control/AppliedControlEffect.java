package com.dochelper.rules.core.engine.control;

import com.dochelper.rules.integration.enumerations.ControlEffectType;

/**
 * A control rule effect that changed its target. {@code depth} is the number
 * of rule hops from the originating edit.
 */
public record AppliedControlEffect(String ruleId,
                                   String sourceFieldId,
                                   String targetFieldId,
                                   ControlEffectType effectType,
                                   Object previousValue,
                                   Object newValue,
                                   int depth) {
}
