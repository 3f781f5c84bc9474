package com.dochelper.rules.core.exception.formula;

import com.dochelper.rules.core.exception.DocHelperRulesException;
import lombok.Getter;

import java.util.List;

@Getter
public class FormulaCycleException extends DocHelperRulesException {

    private final List<String> cyclePath;

    public FormulaCycleException(List<String> cyclePath) {
        super("Circular formula dependency detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }
}
