package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.numeric.CompiledFunction;
import com.jcas.session.Session;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compares expressions by value at sample points, for results whose exact shape is not the
 * point of the test.
 */
final class NumericAssertions {
    private static final double TOLERANCE = 1e-9;

    private NumericAssertions() {
    }

    static void assertSameFunction(Session session, ExprNode expected, ExprNode actual, String variable,
                                   double... points) {
        CompiledFunction e = session.compile(expected, variable);
        CompiledFunction a = session.compile(actual, variable);
        for (double point : points) {
            double want = e.apply(point);
            double got = a.apply(point);
            assertEquals(want, got, TOLERANCE * Math.max(1, Math.abs(want)),
                    "at " + variable + "=" + point + ": expected " + expected + " but got " + actual);
        }
    }

    /**
     * Checks that {@code antiderivative} differentiates back to {@code integrand}.
     */
    static void assertAntiderivative(Session session, ExprNode integrand, ExprNode antiderivative, String variable,
                                     double... points) {
        assertFalse(antiderivative.containsFunction("integrate"), "no antiderivative found for " + integrand);
        assertSameFunction(session, integrand, session.diff(antiderivative, variable), variable, points);
    }
}
