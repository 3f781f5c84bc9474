package com.dochelper.rules.core.engine.formula.ast;

import java.util.List;

public record FunctionCallNode(String functionName, List<FormulaNode> arguments) implements FormulaNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(IFormulaNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
