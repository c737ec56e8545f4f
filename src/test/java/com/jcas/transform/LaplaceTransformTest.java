package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class LaplaceTransformTest {

    private final Session session = new Session();

    private ExprNode laplace(String f) {
        return session.laplace(session.parse(f), "t", "s");
    }

    private ExprNode ilt(String transform) {
        return session.inverseLaplace(session.parse(transform), "s", "t");
    }

    // ============================================================
    // Forward
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'1', '1/s'",
        "'t^2', '2/s^3'",
        "'t^(1/2)', 'sqrt(pi)/(2*s^(3/2))'",
        "'e^(3*t)', '1/(s-3)'",
        "'sin(2*t)', '2/(s^2+4)'",
        "'cos(3*t)', 's/(s^2+9)'",
        "'sinh(t)', '1/(s^2-1)'",
        "'t*e^(2*t)', '1/(s-2)^2'",
        "'3*sin(t) + t', '3/(s^2+1) + 1/s^2'"
    })
    public void testForward(String f, String expected) {
        assertEquals(session.parse(expected), laplace(f));
    }

    @Test
    public void testCanonicalText() {
        assertEquals("2/s^3", session.format(session.parse("laplace(t^2, t, s)")));
    }

    @Test
    public void testLinearity() {
        ExprNode sum = laplace("t^2 + 4*e^(3*t)");
        assertEquals(session.arithmetic().add(laplace("t^2"), laplace("4*e^(3*t)")), sum);
    }

    @Test
    public void testUnknownTransformStaysInert() {
        ExprNode result = laplace("e^(t^2)");
        assertTrue(result.isFunction("laplace"), result.toString());
        assertEquals(3, result.args().size());
    }

    // ============================================================
    // Inverse
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'1/s^3', 't^2/2'",
        "'1/(s-2)', 'e^(2*t)'",
        "'1/(s+1)^2', 't*e^(-t)'",
        "'s/(s^2+4)', 'cos(2*t)'",
        "'1/(s^2+1)', 'sin(t)'",
        "'5/s', '5'"
    })
    public void testInverse(String transform, String expected) {
        assertEquals(session.parse(expected), ilt(transform));
    }

    @Test
    public void testInverseCanonicalText() {
        assertEquals("t^2/2", session.format(ilt("1/s^3")));
        assertEquals("cos(2*t)", session.format(ilt("s/(s^2+4)")));
    }

    @Test
    public void testInverseByPartialFractions() {
        ExprNode result = ilt("1/(s^2-4)");
        NumericAssertions.assertSameFunction(session, session.parse("(e^(2*t)-e^(-2*t))/4"), result, "t", 0, 0.5, 1.5);
    }

    @Test
    public void testInverseOfDampedOscillation() {
        // (s+1)/((s+1)^2+4)
        ExprNode result = ilt("(s+1)/(s^2+2*s+5)");
        NumericAssertions.assertSameFunction(session, session.parse("e^(-t)*cos(2*t)"), result, "t", 0, 0.5, 1.5);
    }

    @Test
    public void testRoundTrip() {
        ExprNode f = session.parse("sin(3*t)");
        ExprNode back = session.inverseLaplace(session.laplace(f, "t", "s"), "s", "t");
        assertEquals(f, back);
    }

    @Test
    public void testConstantHasNoInverse() {
        ExprNode result = ilt("5");
        assertTrue(result.isFunction("ilt"), result.toString());
    }
}
