package com.dochelper.rules.core.exception.context;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import lombok.Getter;

@Getter
public class UnknownFieldException extends DocHelperRulesRuntimeException {
    private final String entityInstanceId;
    private final String fieldId;

    public UnknownFieldException(String entityInstanceId, String fieldId) {
        super("Field Not Found. Entity: [" + entityInstanceId + "], Field: [" + fieldId + "]");
        this.entityInstanceId = entityInstanceId;
        this.fieldId = fieldId;
    }
}
