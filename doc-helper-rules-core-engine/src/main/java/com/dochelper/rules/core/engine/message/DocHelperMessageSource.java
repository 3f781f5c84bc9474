package com.dochelper.rules.core.engine.message;

import com.dochelper.rules.core.util.CommonUtil;
import com.ibm.icu.text.MessageFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves error and resolution templates from a resource bundle. Templates use
 * ICU named arguments such as {@code {fieldId}}; an unknown key is returned as is.
 */
@Slf4j
public final class DocHelperMessageSource implements IDocHelperMessageSource {

    public static final String DEFAULT_BASENAME = "i18n/doc-helper-rules-messages";

    private final MessageSource messageSource;

    public DocHelperMessageSource() {
        this(DEFAULT_BASENAME);
    }

    public DocHelperMessageSource(String baseName) {
        ResourceBundleMessageSource bundleMessageSource = new ResourceBundleMessageSource();
        bundleMessageSource.setDefaultEncoding(StandardCharsets.UTF_8.name());
        bundleMessageSource.setBasename(baseName);
        bundleMessageSource.setFallbackToSystemLocale(false);
        this.messageSource = bundleMessageSource;
    }

    @Override
    public String getMessage(String messageTemplate, Locale locale, Map<String, String> arguments) {
        if (CommonUtil.isNullOrBlank(messageTemplate)) {
            return messageTemplate;
        }
        Locale effectiveLocale = locale != null ? locale : Locale.getDefault();
        String message;
        try {
            // null args: formatting happens below with ICU so named arguments work
            message = messageSource.getMessage(messageTemplate, null, effectiveLocale);
        } catch (NoSuchMessageException e) {
            log.trace("No message for key [{}]", messageTemplate, e);
            return messageTemplate;
        }
        Map<String, String> templateVariables = CommonUtil.nonNullMap(arguments);
        if (templateVariables.isEmpty()) {
            return message;
        }
        Map<String, Object> formatArguments = new LinkedHashMap<>(templateVariables);
        return new MessageFormat(message, effectiveLocale).format(formatArguments);
    }
}
