package com.dochelper.rules.core.exception;

public class DocHelperRulesRuntimeException extends RuntimeException {
    public DocHelperRulesRuntimeException(String message) {
        super(message);
    }
    public DocHelperRulesRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public DocHelperRulesRuntimeException(Throwable cause) {
        super(cause);
    }
}
