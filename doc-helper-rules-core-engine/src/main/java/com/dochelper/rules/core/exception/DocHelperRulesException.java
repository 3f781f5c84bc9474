package com.dochelper.rules.core.exception;

public class DocHelperRulesException extends Exception {
    public DocHelperRulesException(String message) {
        super(message);
    }
    public DocHelperRulesException(String message, Throwable cause) {
        super(message, cause);
    }
    public DocHelperRulesException(Throwable cause) {
        super(cause);
    }
}
