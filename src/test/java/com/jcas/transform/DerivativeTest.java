package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class DerivativeTest {

    private final Session session = new Session();

    @ParameterizedTest
    @CsvSource({
        "'x^3', '3*x^2'",
        "'5', '0'",
        "'y^2', '0'",
        "'sin(x)', 'cos(x)'",
        "'cos(2*x)', '-2*sin(2*x)'",
        "'e^(2*x)', '2*e^(2*x)'",
        "'2^x', '2^x*log(2)'",
        "'log(x)', '1/x'",
        "'x*sin(x)', 'sin(x)+x*cos(x)'",
        "'(x^2+1)^3', '6*x*(x^2+1)^2'",
        "'sqrt(x)', '1/(2*sqrt(x))'",
        "'atan(x)', '1/(1+x^2)'",
        "'a*x^2+b*x+c', '2*a*x+b'"
    })
    public void testDiff(String f, String expected) {
        assertEquals(session.parse(expected), session.diff(session.parse(f), "x"));
    }

    @Test
    public void testCanonicalText() {
        assertEquals("3*x^2", session.format(session.diff(session.parse("x^3"), "x")));
    }

    @Test
    public void testHigherOrder() {
        assertEquals(session.parse("6*x"), session.diff(session.parse("x^3"), "x", 2));
        assertEquals(session.parse("x^3"), session.diff(session.parse("x^3"), "x", 0));
        assertEquals(ExprNode.constant(6), session.parse("diff(x^3, x, 3)"));
    }

    @Test
    public void testQuotient() {
        ExprNode f = session.parse("x/(x+1)");
        NumericAssertions.assertSameFunction(session, session.parse("1/(x+1)^2"), session.diff(f, "x"), "x", 0.5, 2, 7);
    }

    @Test
    public void testUnknownFunctionStaysInert() {
        ExprNode call = ExprNode.function("g", ExprNode.variable("x"));
        ExprNode result = session.diff(call, "x");
        assertTrue(result.isFunction("diff"), result.toString());
    }

    @Test
    public void testImplicitVariable() {
        assertEquals(session.parse("2*t"), session.parse("diff(t^2)"));
    }
}
