package com.dochelper.rules.integration.enumerations;

public enum FieldType {
    TEXT,
    TEXTAREA,
    NUMBER,
    DATE,
    DROPDOWN,
    CHECKBOX,
    RADIO,
    CALCULATED
}
