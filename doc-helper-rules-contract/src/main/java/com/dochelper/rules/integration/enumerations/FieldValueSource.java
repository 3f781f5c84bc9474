package com.dochelper.rules.integration.enumerations;

/**
 * Where a resolved field value came from, in descending priority.
 */
public enum FieldValueSource {
    OVERRIDE,
    FORMULA,
    RAW
}
