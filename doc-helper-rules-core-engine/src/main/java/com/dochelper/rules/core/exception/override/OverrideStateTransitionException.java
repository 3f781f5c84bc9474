package com.dochelper.rules.core.exception.override;

import com.dochelper.rules.core.exception.DocHelperRulesRuntimeException;
import com.dochelper.rules.integration.enumerations.OverrideState;
import lombok.Getter;

@Getter
public class OverrideStateTransitionException extends DocHelperRulesRuntimeException {

    private final String overrideId;
    private final OverrideState from;
    private final OverrideState to;

    public OverrideStateTransitionException(String overrideId, OverrideState from, OverrideState to) {
        this(String.format("Illegal override transition %s -> %s for override [%s]", from, to, overrideId),
                overrideId, from, to);
    }

    private OverrideStateTransitionException(String message, String overrideId, OverrideState from, OverrideState to) {
        super(message);
        this.overrideId = overrideId;
        this.from = from;
        this.to = to;
    }

    public static OverrideStateTransitionException illegalOperation(String overrideId, OverrideState state, String operation) {
        return new OverrideStateTransitionException(
                String.format("Cannot %s override [%s] in state %s", operation, overrideId, state),
                overrideId, state, null);
    }
}
