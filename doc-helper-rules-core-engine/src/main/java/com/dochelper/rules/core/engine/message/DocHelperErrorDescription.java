package com.dochelper.rules.core.engine.message;

import com.dochelper.rules.integration.contract.IDocHelperErrorInfo;

import java.util.Locale;
import java.util.Map;

/**
 * Error code with its rendered message and resolution hint, ready for display.
 */
public record DocHelperErrorDescription(String errorCode, String message, String resolution) {

    public static DocHelperErrorDescription of(IDocHelperErrorInfo errorInfo,
                                               IDocHelperMessageSource messageSource,
                                               Locale locale,
                                               Map<String, String> templateVariables) {
        return new DocHelperErrorDescription(
                errorInfo.getErrorCode(),
                messageSource.getMessage(errorInfo.getErrorTemplate(), locale, templateVariables),
                messageSource.getMessage(errorInfo.getResolutionTemplate(), locale, templateVariables));
    }
}
