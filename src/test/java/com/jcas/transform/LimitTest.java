package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class LimitTest {

    private final Session session = new Session();

    private ExprNode limit(String f, String point) {
        return session.limit(session.parse(f), "x", session.parse(point));
    }

    // ============================================================
    // Finite points
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'x^2+1', '2', '5'",
        "'sin(x)/x', '0', '1'",
        "'(x^2-1)/(x-1)', '1', '2'",
        "'(1-cos(x))/x^2', '0', '1/2'",
        "'x*log(x)', '0', '0'",
        "'(e^x-1)/x', '0', '1'",
        "'y', '3', 'y'"
    })
    public void testFiniteLimit(String f, String point, String expected) {
        assertEquals(session.parse(expected), limit(f, point));
    }

    @ParameterizedTest
    @CsvSource({
        "'log(x)', '0', '-Infinity'",
        "'1/x^2', '0', 'Infinity'",
        "'-1/x^2', '0', '-Infinity'",
        "'1/x', '0', 'Infinity'",
        "'-5/x', '0', '-Infinity'",
        "'x/(x+1)^2', '-1', '-Infinity'",
        "'(cos(x)-2)/x', '0', '-Infinity'"
    })
    public void testInfiniteLimit(String f, String point, String expected) {
        assertEquals(session.parse(expected), limit(f, point));
    }

    // ============================================================
    // Points at infinity
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'(3*x^2+1)/(x^2-5)', 'Infinity', '3'",
        "'(x+1)/(x^2+1)', 'Infinity', '0'",
        "'x^3/(x+1)', '-Infinity', 'Infinity'",
        "'x^2-x', '-Infinity', 'Infinity'",
        "'1-x^3', 'Infinity', '-Infinity'",
        "'e^(-x)+2', 'Infinity', '2'",
        "'atan(x)', 'Infinity', 'pi/2'",
        "'atan(x)', '-Infinity', '-pi/2'",
        "'log(x)', 'Infinity', 'Infinity'"
    })
    public void testLimitAtInfinity(String f, String point, String expected) {
        assertEquals(session.parse(expected), limit(f, point));
    }

    // ============================================================
    // Unresolved and entry points
    // ============================================================

    @Test
    public void testOscillatingLimitStaysInert() {
        ExprNode result = limit("sin(x)", "Infinity");
        assertTrue(result.isFunction("limit"), result.toString());
    }

    @Test
    public void testParserEntryPoint() {
        assertEquals("1", session.format(session.parse("limit(sin(x)/x, x, 0)")));
        assertEquals("-Infinity", session.format(session.parse("limit(log(x), x, 0)")));
    }

    @Test
    public void testFiniteLimitHelper() {
        Limit limits = session.limits();
        assertEquals(ExprNode.zero(), limits.finiteLimit(session.parse("x*log(x)"), "x", ExprNode.zero()));
        assertNull(limits.finiteLimit(session.parse("1/x^2"), "x", ExprNode.zero()));
    }
}
