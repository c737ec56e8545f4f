package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FactorizerTest {

    private final Session session = new Session();

    private ExprNode factor(String f) {
        return session.factor(session.parse(f));
    }

    @Test
    public void testDifferenceOfSquares() {
        assertEquals("(x+2)*(x-2)", session.format(factor("x^2-4")));
    }

    @Test
    public void testContentIsPulledOut() {
        ExprNode result = factor("2*x^2-2");
        assertEquals(Shape.PRODUCT, result.shape());
        assertEquals(Rational.TWO, result.multiplier());
        assertEquals(session.parse("2*(x+1)*(x-1)"), result);
    }

    @Test
    public void testRepeatedRoot() {
        assertEquals(session.parse("(x-1)^3"), factor("x^3-3*x^2+3*x-1"));
    }

    @Test
    public void testRationalRoot() {
        ExprNode result = factor("2*x^2-x-1");
        assertEquals(session.parse("(2*x+1)*(x-1)"), result);
    }

    @Test
    public void testIrreducibleIsUnchanged() {
        assertEquals(session.parse("x^2+1"), factor("x^2+1"));
    }

    @Test
    public void testMultivariateIsUnchanged() {
        assertEquals(session.parse("x*y+x"), factor("x*y+x"));
    }

    @Test
    public void testRationalFunction() {
        assertEquals(session.parse("(x-1)/(x+1)"), factor("(x^2-1)/(x^2+2*x+1)"));
    }

    @Test
    public void testMixedFactors() {
        ExprNode f = session.parse("x^3-x^2+x-1");
        ExprNode result = session.factor(f);
        assertEquals(Shape.PRODUCT, result.shape());
        assertEquals(session.expand(f), session.expand(result));
    }
}
