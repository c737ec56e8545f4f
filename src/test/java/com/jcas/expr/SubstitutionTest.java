package com.jcas.expr;

import com.jcas.error.DivisionByZeroException;
import com.jcas.session.Session;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SubstitutionTest {

    private final Session session = new Session();

    @Test
    public void testSubstituteConstant() {
        ExprNode result = session.substitute(session.parse("x^2+y"), "x", ExprNode.constant(3));
        assertEquals(session.parse("9+y"), result);
    }

    @Test
    public void testSubstituteExpression() {
        ExprNode result = session.substitute(session.parse("x^2"), "x", session.parse("a+1"));
        assertEquals(session.parse("(a+1)^2"), result);
    }

    @Test
    public void testFunctionsAreReapplied() {
        assertEquals(ExprNode.zero(), session.substitute(session.parse("sin(x)"), "x", ExprNode.zero()));
        assertEquals(ExprNode.one(), session.substitute(session.parse("cos(2*x)"), "x", ExprNode.zero()));
    }

    @Test
    public void testSubstituteAllIsSimultaneous() {
        MutableMap<String, ExprNode> swap = Maps.mutable.with("x", ExprNode.variable("y"), "y", ExprNode.variable("x"));
        ExprNode result = session.substituteAll(session.parse("x - 2*y"), swap);
        assertEquals(session.parse("y - 2*x"), result);
    }

    @Test
    public void testExponentSubstitution() {
        ExprNode result = session.substitute(session.parse("2^x"), "x", ExprNode.constant(5));
        assertEquals(ExprNode.constant(32), result);
    }

    @Test
    public void testZeroToANegativePower() {
        assertThrows(DivisionByZeroException.class,
                () -> session.substitute(session.parse("1/x"), "x", ExprNode.zero()));
    }

    @Test
    public void testUnrelatedVariableIsUntouched() {
        ExprNode node = session.parse("a*b");
        assertEquals(node, session.substitute(node, "x", ExprNode.constant(7)));
    }

    @Test
    public void testCanonicalize() {
        ExprNode node = session.parse("x+1");
        assertEquals(node, session.canonicalize(node));
    }
}
