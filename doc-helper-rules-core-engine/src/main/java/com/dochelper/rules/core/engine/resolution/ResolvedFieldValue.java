package com.dochelper.rules.core.engine.resolution;

import com.dochelper.rules.integration.enumerations.FieldValueSource;

/**
 * The authoritative value of a field and where it came from. {@code overrideId}
 * is set only when the source is {@link FieldValueSource#OVERRIDE}.
 */
public record ResolvedFieldValue(String fieldId, Object value, FieldValueSource source, String overrideId) {
}
