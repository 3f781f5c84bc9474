package com.dochelper.rules.core.exception.override;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import lombok.Getter;

@Getter
public class OverrideNotFoundException extends DocHelperRulesRuntimeException {
    private final String overrideId;

    public OverrideNotFoundException(String overrideId) {
        super("Override Not Found. Identifier: [" + overrideId + "]");
        this.overrideId = overrideId;
    }
}
