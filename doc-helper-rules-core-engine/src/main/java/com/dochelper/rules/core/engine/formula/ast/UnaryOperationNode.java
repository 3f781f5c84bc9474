package com.dochelper.rules.core.engine.formula.ast;

public record UnaryOperationNode(UnaryOperator operator, FormulaNode operand) implements FormulaNode {
    @Override
    public <R> R accept(IFormulaNodeVisitor<R> visitor) {
        return visitor.visitUnaryOperation(this);
    }
}
