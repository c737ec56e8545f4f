package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class IntegratorTest {

    private final Session session = new Session();

    private ExprNode integrate(String f) {
        return session.integrate(session.parse(f), "x");
    }

    // ============================================================
    // Exact forms
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'x^2', 'x^3/3'",
        "'3', '3*x'",
        "'cos(x)', 'sin(x)'",
        "'1/x', 'log(x)'",
        "'sqrt(x)', '2/3*x^(3/2)'",
        "'e^(2*x)', 'e^(2*x)/2'",
        "'sin(3*x+1)', '-cos(3*x+1)/3'",
        "'(2*x+1)^3', '(2*x+1)^4/8'",
        "'1/(x^2+1)', 'atan(x)'",
        "'sec(x)^2', 'tan(x)'",
        "'x*e^(x^2)', 'e^(x^2)/2'",
        "'y', 'x*y'"
    })
    public void testExactAntiderivative(String f, String expected) {
        assertEquals(session.parse(expected), integrate(f));
    }

    // ============================================================
    // Checked by differentiating back
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'x^3 - 2*x + 7'",
        "'x*cos(x)'",
        "'log(x)'",
        "'x*log(x)'",
        "'1/(x^2-1)'",
        "'(x+3)/(x^2+3*x+2)'",
        "'cos(x)^2'",
        "'sin(x)*cos(x)'",
        "'2*x/(x^2+1)'",
        "'x^2*e^x'",
        "'atan(x)'",
        "'1/(2*x+3)'",
        "'1/(x^2+4*x+5)'"
    })
    public void testDifferentiatesBack(String f) {
        ExprNode integrand = session.parse(f);
        ExprNode result = session.integrate(integrand, "x");
        NumericAssertions.assertAntiderivative(session, integrand, result, "x", 1.5, 2.5, 4);
    }

    @Test
    public void testUnknownIntegralStaysInert() {
        ExprNode result = integrate("e^(x^2)");
        assertTrue(result.isFunction("integrate"), result.toString());
        assertEquals(session.parse("e^(x^2)"), result.arg(0));
        assertTrue(result.arg(1).isVariable("x"));
    }

    @Test
    public void testIntegrateFunctionInParser() {
        assertEquals(session.parse("t^2/2"), session.parse("integrate(t)"));
        assertEquals(session.parse("x*t"), session.parse("integrate(t, x)"));
    }

    // ============================================================
    // Definite integrals
    // ============================================================

    @Test
    public void testDefiniteIntegralIsExact() {
        ExprNode result = session.definiteIntegral(session.parse("x^2"), ExprNode.zero(), ExprNode.one(), "x");
        assertEquals(session.parse("1/3"), result);
        assertEquals(ExprNode.constant(2), session.parse("defint(sin(x), 0, pi)"));
    }

    @Test
    public void testDefiniteIntegralFallsBackToQuadrature() {
        ExprNode result = session.definiteIntegral(session.parse("e^(-x^2)"), ExprNode.zero(), ExprNode.one(), "x");
        assertTrue(result.isConstant(), result.toString());
        assertEquals(0.746824132812427, result.multiplier().doubleValue(), 1e-10);
    }

    @Test
    public void testDefiniteIntegralOfSymbolicBoundsStaysInert() {
        ExprNode result = session.definiteIntegral(session.parse("e^(-x^2)"), ExprNode.zero(), session.parse("a"), "x");
        assertTrue(result.isFunction("defint"), result.toString());
    }

    @Test
    public void testDefiniteIntegralThroughEndpointLimit() {
        assertEquals(ExprNode.constant(-1), session.parse("defint(log(x), 0, 1)"));
        assertEquals(ExprNode.one(), session.parse("defint(e^(-x), 0, Infinity)"));
    }

    @ParameterizedTest
    @CsvSource({
        "'1/x^2', '-1', '1'",
        "'1/x', '-1', '2'",
        "'1/(x^2-1)', '0', '2'"
    })
    public void testDefiniteIntegralAcrossPoleStaysInert(String f, String from, String to) {
        ExprNode result = session.parse("defint(" + f + ", " + from + ", " + to + ", x)");
        assertTrue(result.isFunction("defint"), result.toString());
    }
}
