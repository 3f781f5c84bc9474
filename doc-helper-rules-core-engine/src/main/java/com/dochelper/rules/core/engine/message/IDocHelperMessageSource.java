package com.dochelper.rules.core.engine.message;

import java.util.Locale;
import java.util.Map;

public interface IDocHelperMessageSource {

    default String getMessage(String messageTemplate, Locale locale) {
        return getMessage(messageTemplate, locale, Map.of());
    }

    String getMessage(String messageTemplate, Locale locale, Map<String, String> arguments);
}
