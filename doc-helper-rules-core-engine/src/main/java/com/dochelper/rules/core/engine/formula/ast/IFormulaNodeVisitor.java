package com.dochelper.rules.core.engine.formula.ast;

public interface IFormulaNodeVisitor<R> {
    R visitLiteral(LiteralNode node);
    R visitFieldReference(FieldReferenceNode node);
    R visitBinaryOperation(BinaryOperationNode node);
    R visitUnaryOperation(UnaryOperationNode node);
    R visitFunctionCall(FunctionCallNode node);
}
