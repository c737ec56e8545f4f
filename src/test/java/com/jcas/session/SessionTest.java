package com.jcas.session;

import com.jcas.error.UndefinedException;
import com.jcas.expr.ExprNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SessionTest {

    private final Session session = new Session();

    @Test
    public void testEvaluateNumeric() {
        ExprNode one = session.evaluateNumeric("sin(pi/2)", Maps.immutable.empty());
        assertTrue(one.isConstant());
        assertEquals(1.0, one.multiplier().doubleValue(), 1e-12);
        assertFalse(session.settings().isNumeric());
    }

    @Test
    public void testEvaluateNumericKeepsVariables() {
        ExprNode result = session.evaluateNumeric("x + 1/2", Maps.immutable.empty());
        assertTrue(result.contains("x"));
    }

    @Test
    public void testBindingsTakePrecedenceOverVariables() {
        session.setVariable("x", ExprNode.constant(3));
        assertEquals(ExprNode.constant(9), session.parse("x^2"));
        assertEquals(ExprNode.constant(4),
                session.evaluate("x^2", Maps.immutable.with("x", ExprNode.constant(2))));
        assertTrue(session.clearVariable("x"));
        assertEquals(session.parse("x^2"), session.parse("x*x"));
    }

    @Test
    public void testFormatDecimal() {
        assertEquals("0.5", session.formatDecimal(session.parse("1/2")));
    }

    @Test
    public void testCompile() {
        assertEquals(5.0, session.compile(session.parse("x^2+1"), "x").apply(2.0), 1e-12);
        assertThrows(UndefinedException.class, () -> session.compile(session.parse("x+y"), "x"));
    }

    @Test
    public void testPeekerSeesTransformCalls() {
        MutableList<String> seen = Lists.mutable.empty();
        session.addPeeker("diff", (operation, operands) -> seen.add(operation + ":" + operands.size()));
        session.parse("diff(x^2, x)");
        assertEquals(Lists.mutable.with("diff:2"), seen);
    }

    @Test
    public void testVariableReturnsACopy() {
        Session fast = new Session(Settings.defaults().setImmutable(false));
        fast.setVariable("k", fast.parse("x+1"));
        ExprNode value = fast.variable("k");
        fast.arithmetic().add(value, fast.parse("x"));
        fast.arithmetic().multiply(fast.variable("k"), ExprNode.constant(5));

        assertEquals(fast.parse("x+1"), fast.variable("k"));
        assertEquals(fast.parse("x+2"), fast.parse("k+1"));
        assertNull(fast.variable("unbound"));
    }
}
