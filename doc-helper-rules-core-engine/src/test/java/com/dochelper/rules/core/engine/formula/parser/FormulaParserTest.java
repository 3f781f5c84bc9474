package com.dochelper.rules.core.engine.formula.parser;

import com.dochelper.rules.core.engine.formula.ast.BinaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.BinaryOperator;
import com.dochelper.rules.core.engine.formula.ast.FieldReferenceNode;
import com.dochelper.rules.core.engine.formula.ast.FormulaNode;
import com.dochelper.rules.core.engine.formula.ast.FunctionCallNode;
import com.dochelper.rules.core.engine.formula.ast.LiteralNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperationNode;
import com.dochelper.rules.core.engine.formula.ast.UnaryOperator;
import com.dochelper.rules.core.exception.formula.FormulaParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private static FormulaNode parse(String expression) throws FormulaParseException {
        return new FormulaParser(expression).parse();
    }

    @Nested
    @DisplayName("Precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("multiplication should bind tighter than addition")
        void multiplicationBindsTighter() throws FormulaParseException {
            // When
            FormulaNode root = parse("a + b * c");

            // Then
            BinaryOperationNode add = assertInstanceOf(BinaryOperationNode.class, root);
            assertEquals(BinaryOperator.ADD, add.operator());
            BinaryOperationNode multiply = assertInstanceOf(BinaryOperationNode.class, add.right());
            assertEquals(BinaryOperator.MULTIPLY, multiply.operator());
        }

        @Test
        @DisplayName("power should be right associative")
        void powerIsRightAssociative() throws FormulaParseException {
            // When
            BinaryOperationNode root = (BinaryOperationNode) parse("2 ** 3 ** 2");

            // Then
            assertEquals(BinaryOperator.POWER, root.operator());
            assertInstanceOf(LiteralNode.class, root.left());
            BinaryOperationNode right = assertInstanceOf(BinaryOperationNode.class, root.right());
            assertEquals(BinaryOperator.POWER, right.operator());
        }

        @Test
        @DisplayName("unary minus should apply to the base of a power")
        void unaryMinusBindsBeforePower() throws FormulaParseException {
            // When
            BinaryOperationNode root = (BinaryOperationNode) parse("-2 ** 2");

            // Then
            assertEquals(BinaryOperator.POWER, root.operator());
            UnaryOperationNode base = assertInstanceOf(UnaryOperationNode.class, root.left());
            assertEquals(UnaryOperator.NEGATE, base.operator());
        }

        @Test
        @DisplayName("and should bind tighter than or, comparison tighter than not")
        void logicalPrecedence() throws FormulaParseException {
            // When
            BinaryOperationNode root = (BinaryOperationNode) parse("not a > 1 or b and c");

            // Then
            assertEquals(BinaryOperator.OR, root.operator());
            UnaryOperationNode not = assertInstanceOf(UnaryOperationNode.class, root.left());
            assertEquals(UnaryOperator.NOT, not.operator());
            assertEquals(BinaryOperator.GREATER_THAN, ((BinaryOperationNode) not.operand()).operator());
            assertEquals(BinaryOperator.AND, ((BinaryOperationNode) root.right()).operator());
        }

        @Test
        @DisplayName("parentheses should override precedence")
        void parenthesesOverride() throws FormulaParseException {
            // When
            BinaryOperationNode root = (BinaryOperationNode) parse("(a + b) * c");

            // Then
            assertEquals(BinaryOperator.MULTIPLY, root.operator());
            assertEquals(BinaryOperator.ADD, ((BinaryOperationNode) root.left()).operator());
        }
    }

    @Nested
    @DisplayName("Primaries")
    class PrimaryTests {

        @Test
        @DisplayName("identifier followed by parenthesis should be a function call")
        void shouldParseFunctionCall() throws FormulaParseException {
            // When
            FunctionCallNode call = assertInstanceOf(FunctionCallNode.class, parse("round({{area}}, 2)"));

            // Then
            assertEquals("round", call.functionName());
            assertEquals(2, call.arguments().size());
            assertEquals(new FieldReferenceNode("area"), call.arguments().get(0));
        }

        @Test
        @DisplayName("function call may take no arguments")
        void shouldParseEmptyArgumentList() throws FormulaParseException {
            // When
            FunctionCallNode call = assertInstanceOf(FunctionCallNode.class, parse("sum()"));

            // Then
            assertTrue(call.arguments().isEmpty());
        }

        @Test
        @DisplayName("bare identifier should be a field reference")
        void shouldParseBareIdentifier() throws FormulaParseException {
            assertEquals(new FieldReferenceNode("soil_type"), parse("soil_type"));
        }

        @Test
        @DisplayName("compiler should report references in order of first appearance")
        void compilerShouldCollectReferences() throws FormulaParseException {
            // When
            CompiledFormula compiled = new FormulaCompiler().compile("{{b}} + a * {{b}} + coalesce(c, a)");

            // Then
            assertEquals(List.of("b", "a", "c"), List.copyOf(compiled.fieldReferences()));
            assertEquals(Set.of("a", "b", "c"), compiled.fieldReferences());
        }

        @Test
        @DisplayName("compiler should cache by expression text")
        void compilerShouldCache() throws FormulaParseException {
            // Given
            FormulaCompiler compiler = new FormulaCompiler();

            // When
            CompiledFormula first = compiler.compile("a + 1");
            CompiledFormula second = compiler.compile("a + 1");

            // Then
            assertSame(first, second);
            assertEquals(1, compiler.cacheSize());
        }

        @Test
        @DisplayName("uncached parse should leave the compiler cache untouched")
        void parseShouldNotCache() throws FormulaParseException {
            // Given
            FormulaCompiler compiler = new FormulaCompiler();

            // When
            CompiledFormula parsed = compiler.parse("a + 1");

            // Then
            assertEquals(Set.of("a"), parsed.fieldReferences());
            assertEquals(0, compiler.cacheSize());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class SyntaxErrorTests {

        @ParameterizedTest(name = "[{0}] should not parse")
        @ValueSource(strings = {"", "   ", "a +", "(a + b", "a b", "round(a,", "* 2", "a == == b"})
        void shouldRejectMalformedFormula(String expression) {
            assertThrows(FormulaParseException.class, () -> parse(expression));
        }

        @Test
        @DisplayName("error should carry the position of the offending token")
        void shouldReportPosition() {
            // When
            FormulaParseException exception = assertThrows(FormulaParseException.class, () -> parse("a + b c"));

            // Then
            assertEquals(6, exception.getPosition());
            assertEquals("a + b c", exception.getExpression());
            assertTrue(exception.getMessage().contains("Unexpected token 'c'"));
        }

        @Test
        @DisplayName("deeply nested parentheses should fail as a parse error")
        void shouldRejectDeepNesting() {
            // Given
            String expression = "(".repeat(300) + "1" + ")".repeat(300);

            // When
            FormulaParseException exception = assertThrows(FormulaParseException.class, () -> parse(expression));

            // Then
            assertTrue(exception.getMessage().contains("nesting exceeds " + FormulaParser.MAX_NESTING_DEPTH));
        }

        @Test
        @DisplayName("nesting within the limit should still parse")
        void shouldAcceptNestingWithinLimit() throws FormulaParseException {
            String expression = "-".repeat(100) + "(".repeat(100) + "1" + ")".repeat(100);
            assertNotNull(parse(expression));
        }

        @Test
        @DisplayName("very long formulas should fail as a parse error instead of overflowing the stack")
        void shouldRejectOversizedFormula() {
            // Given
            String nested = "(".repeat(20000) + "1" + ")".repeat(20000);
            String chained = "1" + " + 1".repeat(20000);

            // Then
            assertTrue(assertThrows(FormulaParseException.class, () -> parse(nested)).getMessage()
                    .contains("exceeds " + FormulaParser.MAX_TOKENS + " tokens"));
            assertThrows(FormulaParseException.class, () -> parse(chained));
        }

        @Test
        @DisplayName("field scoped error should name the field")
        void shouldScopeErrorToField() {
            // When
            FormulaParseException exception = assertThrows(FormulaParseException.class, () -> parse("a +"));
            FormulaParseException scoped = exception.forField("depth_range");

            // Then
            assertTrue(scoped.getMessage().startsWith("Field [depth_range]: "));
            assertEquals(exception.getPosition(), scoped.getPosition());
        }
    }
}
