package com.jcas.parser;

import com.jcas.error.CasException;
import com.jcas.error.InvalidVariableNameException;
import com.jcas.error.OperatorException;
import com.jcas.error.OutOfFunctionDomainException;
import com.jcas.error.OutOfRangeException;
import com.jcas.error.ParityException;
import com.jcas.error.ParseException;
import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private final Session session = new Session();

    // ============================================================
    // Grammar
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'2x', '2*x'",
        "'2(x+1)', '2*(x+1)'",
        "'(x+1)(x-1)', '(x+1)*(x-1)'",
        "'x y', 'x*y'",
        "'-x^2', '-(x^2)'",
        "'2^3^2', '512'",
        "'10-4-3', '3'",
        "'12/2/3', '2'",
        "'3!', '6'",
        "'50%', '1/2'",
        "'1.5e2', '150'",
        "'.5', '1/2'",
        "'ln(e)', '1'",
        "'sin(pi)', '0'",
        "'cos(pi)', '-1'",
        "'exp(x)', 'e^x'",
        "'sqrt(x)', 'x^(1/2)'",
        "'foo(x)', 'foo*x'"
    })
    public void testEquivalentInput(String input, String expected) {
        assertEquals(session.parse(expected), session.parse(input));
    }

    @Test
    public void testVectorLiteral() {
        ExprNode vector = session.parse("[1, x, 2+3]");
        assertTrue(vector.isFunction("vector"));
        assertEquals(3, vector.args().size());
        assertEquals(ExprNode.constant(5), vector.arg(2));
        assertEquals("[1,x,5]", session.format(vector));
    }

    @Test
    public void testFunctionsMapOverVectors() {
        ExprNode result = session.parse("diff([x^2, x^3], x)");
        assertEquals(session.parse("[2*x, 3*x^2]"), result);
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    public void testErrors() {
        assertThrows(ParityException.class, () -> session.parse("(x+1"));
        assertThrows(OperatorException.class, () -> session.parse("x+"));
        assertThrows(ParseException.class, () -> session.parse(""));
        assertThrows(OutOfRangeException.class, () -> session.parse("sin(x, y)"));
        assertThrows(OutOfFunctionDomainException.class, () -> session.parse("log(0)"));
        assertThrows(OutOfFunctionDomainException.class, () -> session.parse("(-3)!"));
    }

    @Test
    public void testErrorsShareOneRoot() {
        assertInstanceOf(CasException.class,
                assertThrows(ParseException.class, () -> session.parse("(x")));
    }

    // ============================================================
    // Bindings and variables
    // ============================================================

    @Test
    public void testBindingsTakePrecedence() {
        session.setVariable("k", ExprNode.constant(5));
        assertEquals(ExprNode.constant(10), session.parse("2k"));
        assertEquals(ExprNode.one(), session.evaluate("k", Maps.mutable.with("k", ExprNode.one())));
        assertTrue(session.clearVariable("k"));
        assertEquals(ExprNode.variable("k"), session.parse("k"));
    }

    @Test
    public void testInvalidVariableNames() {
        assertThrows(InvalidVariableNameException.class, () -> session.setVariable("sin", ExprNode.one()));
        assertThrows(InvalidVariableNameException.class, () -> session.setVariable("2x", ExprNode.one()));
    }

    @Test
    public void testConstantsAreShared() {
        session.setConstant("g", ExprNode.constant(Rational.valueOf(981, 100)));
        assertTrue(session.isConstantName("g"));
        assertEquals(session.parse("981/50"), session.parse("2g"));
    }

    // ============================================================
    // Extension points
    // ============================================================

    @Test
    public void testDefineFunction() {
        session.defineFunction("f", List.of("x"), "x^2+1");
        assertEquals(ExprNode.constant(10), session.parse("f(3)"));
        assertEquals(session.parse("(a+1)^2+1"), session.parse("f(a+1)"));
        assertTrue(session.removeFunction("f"));
    }

    @Test
    public void testDefineFunctionOfTwoParameters() {
        session.defineFunction("g", List.of("a", "b"), "a-b");
        assertEquals(ExprNode.constant(-1), session.parse("g(2, 3)"));
        assertEquals(session.parse("y-x"), session.parse("g(y, x)"));
    }

    @Test
    public void testRegisterFunction() {
        session.registerFunction("twice", 1, 1,
                (s, args) -> s.arithmetic().multiply(ExprNode.constant(2), args.get(0)));
        assertEquals(session.parse("2*x"), session.parse("twice(x)"));
    }

    @Test
    public void testRegisterOperator() {
        session.registerOperator(new Operator("&", "average", 1, Operator.Associativity.LEFT, Operator.Fixity.INFIX,
                (s, o) -> s.arithmetic().divide(s.arithmetic().add(o.get(0), o.get(1)), ExprNode.constant(2))));
        assertEquals(ExprNode.constant(3), session.parse("2&4"));
    }

    @Test
    public void testPreprocessor() {
        Preprocessor half = (text, tables) -> text.replace("half", "(1/2)");
        session.addPreprocessor(half);
        assertEquals(session.parse("x/2"), session.parse("half*x"));
        assertTrue(session.removePreprocessor(half));
    }

    @Test
    public void testAlias() {
        session.alias("arctan", "atan");
        assertEquals(session.parse("atan(x)"), session.parse("arctan(x)"));
    }

    @Test
    public void testPeekersSeeCopies() {
        MutableList<String> seen = Lists.mutable.empty();
        Peeker peeker = (operation, operands) -> seen.add(operation + ":" + operands.makeString(","));
        session.addPeeker("add", peeker);
        session.parse("x+2");
        assertEquals(Lists.mutable.with("add:x,2"), seen);
        assertTrue(session.removePeeker("add", peeker));
        session.parse("x+3");
        assertEquals(1, seen.size());
    }
}
