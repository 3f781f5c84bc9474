package com.dochelper.rules.core.engine.formula.ast;

public record BinaryOperationNode(BinaryOperator operator, FormulaNode left, FormulaNode right) implements FormulaNode {
    @Override
    public <R> R accept(IFormulaNodeVisitor<R> visitor) {
        return visitor.visitBinaryOperation(this);
    }
}
