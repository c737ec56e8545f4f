package com.jcas.expr;

import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExprNodeTest {

    private final Session session = new Session();

    @Test
    public void testVariablesAreSortedAndDistinct() {
        ExprNode node = session.parse("y*sin(x) + x^2 + 2^(1/2)*z");
        assertEquals(Lists.mutable.with("x", "y", "z"), node.variables());
    }

    @Test
    public void testContains() {
        ExprNode node = session.parse("a*cos(t) + e^(b*t)");
        assertTrue(node.contains("t"));
        assertTrue(node.contains("b"));
        assertFalse(node.contains("s"));
        assertTrue(node.containsFunction("cos"));
        assertFalse(node.containsFunction("sin"));
    }

    @Test
    public void testTermsDistributeTheMultiplier() {
        ExprNode scaled = session.arithmetic().multiply(ExprNode.constant(2), session.parse("x+1"));
        MutableList<ExprNode> terms = scaled.terms();
        assertEquals(2, terms.size());
        assertEquals(session.parse("2*x"), terms.get(0));
        assertEquals(session.parse("2"), terms.get(1));
    }

    @Test
    public void testTermsOfANonSum() {
        ExprNode node = session.parse("3*x^2");
        assertEquals(Lists.mutable.with(node), node.terms());
    }

    @Test
    public void testFactors() {
        assertTrue(ExprNode.constant(5).factors().isEmpty());
        assertEquals(Lists.mutable.with(session.parse("x^2")), session.parse("4*x^2").factors());
        MutableList<ExprNode> factors = session.parse("3*x*sin(y)").factors();
        assertEquals(2, factors.size());
        assertTrue(factors.allSatisfy(f -> f.multiplier().isOne()));
    }

    @Test
    public void testCopyIsIndependent() {
        ExprNode node = session.parse("x^2+1");
        ExprNode copy = node.copy();
        assertEquals(node, copy);
        assertNotSame(node, copy);
        ExprNode scaled = copy.withMultiplier(Rational.valueOf(3));
        assertEquals(session.parse("x^2+1"), node);
        assertNotEquals(node, scaled);
    }

    @Test
    public void testWithZeroMultiplierIsZero() {
        assertTrue(session.parse("x").withMultiplier(Rational.ZERO).isZero());
    }

    @Test
    public void testPredicates() {
        assertTrue(ExprNode.variable("x").isVariable("x"));
        assertFalse(session.parse("2*x").isVariable("x"));
        assertTrue(ExprNode.function("sin", ExprNode.variable("x")).isFunction("sin"));
        assertTrue(ExprNode.one().isOne());
        assertTrue(ExprNode.zero().isZero());
    }

    @Test
    public void testEqualityFollowsCanonicalText() {
        ExprNode a = session.parse("x+y");
        ExprNode b = session.parse("y+x");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    public void testWithZeroPowerCollapsesToTheMultiplier() {
        ExprNode collapsed = session.parse("3*x^2").withPower(Rational.ZERO);
        assertTrue(collapsed.isConstant());
        assertEquals(ExprNode.constant(3), collapsed);
        assertEquals(ExprNode.one(), session.parse("sin(x)").withPower(Rational.ZERO));
        assertEquals(ExprNode.constant(-2), session.parse("-2*(x+1)^3").withPower(Rational.ZERO));
    }
}
