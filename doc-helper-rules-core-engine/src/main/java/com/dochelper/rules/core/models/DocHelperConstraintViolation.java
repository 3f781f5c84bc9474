package com.dochelper.rules.core.models;

import lombok.Data;

import java.io.Serializable;
import java.util.Map;

@Data
public class DocHelperConstraintViolation implements Serializable {
    private final Class<?> clazz;
    private final String propertyPath;
    private final String message;
    private final Map<String, String> templateVariables;
}
