package com.dochelper.rules.integration.enumerations;

public enum ControlEffectType {
    VALUE_SET,
    VISIBILITY,
    ENABLE
}
