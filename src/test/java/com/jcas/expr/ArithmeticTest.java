package com.jcas.expr;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.UndefinedException;
import com.jcas.session.Session;
import com.jcas.session.Settings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ArithmeticTest {

    private final Session session = new Session();

    private String eval(String text) {
        return session.format(session.parse(text));
    }

    // ============================================================
    // Canonical text
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'2*x+3*x', 5*x",
        "'x*x', x^2",
        "'x*x*x*3', 3*x^3",
        "'2/4', 1/2",
        "'x-x', 0",
        "'2^10', 1024",
        "'x^2/x^2', 1",
        "'1/2+1/3', 5/6"
    })
    public void testCanonicalText(String input, String expected) {
        assertEquals(expected, eval(input));
    }

    // ============================================================
    // Equal values have equal trees
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "'x*y', 'y*x'",
        "'a+b+c', 'c+a+b'",
        "'x/x', '1'",
        "'(x*y)^2', 'x^2*y^2'",
        "'sqrt(8)', '2*sqrt(2)'",
        "'4^(1/2)', '2'",
        "'27^(2/3)', '9'",
        "'x^(1/2)*x^(1/2)', 'x'",
        "'e^x*e^x', 'e^(2*x)'",
        "'2*x-(x+1)', 'x-1'",
        "'(2*x)^3', '8*x^3'"
    })
    public void testEquivalentForms(String left, String right) {
        assertEquals(session.parse(right), session.parse(left));
    }

    @Test
    public void testSumMergesLikeTerms() {
        ExprNode sum = session.parse("x^2 + 2*x + x^2 - 2*x + 1");
        assertEquals(Shape.SUM, sum.shape());
        assertEquals(2, sum.childCount());
        assertEquals(session.parse("2*x^2+1"), sum);
    }

    @Test
    public void testDivisionByZero() {
        assertThrows(DivisionByZeroException.class, () -> session.parse("1/0"));
        assertThrows(DivisionByZeroException.class, () -> session.parse("x/(x-x)"));
    }

    @Test
    public void testZeroToTheZeroIsUndefined() {
        assertThrows(UndefinedException.class, () -> session.parse("0^0"));
    }

    @Test
    public void testNegativeBaseWithOddRoot() {
        assertEquals(session.parse("-2"), session.parse("(-8)^(1/3)"));
    }

    // ============================================================
    // Operand ownership
    // ============================================================

    @Test
    public void testImmutableModeLeavesOperandsAlone() {
        Arithmetic arithmetic = new Arithmetic(new Settings());
        ExprNode a = session.parse("x+1");
        ExprNode b = session.parse("2*x");
        String before = a.toString();
        ExprNode sum = arithmetic.add(a, b);
        arithmetic.multiply(a, b);
        arithmetic.pow(a, ExprNode.constant(3));
        assertEquals(before, a.toString());
        assertEquals("2*x", b.toString());
        assertEquals(session.parse("3*x+1"), sum);
    }

    @Test
    public void testFastModeComputesTheSameValues() {
        Arithmetic arithmetic = new Arithmetic(new Settings().setImmutable(false));
        ExprNode sum = arithmetic.add(session.parse("x+1"), session.parse("2*x"));
        assertEquals(session.parse("3*x+1"), sum);
        ExprNode product = arithmetic.multiply(session.parse("x^2"), session.parse("3*x"));
        assertEquals(session.parse("3*x^3"), product);
    }

    @ParameterizedTest
    @CsvSource({"'x^2+1', 'sin(x)'", "'2*y', '3*x*y'", "'1/2', 'e^x'"})
    public void testIdentities(String left, String right) {
        Arithmetic arithmetic = session.arithmetic();
        ExprNode a = session.parse(left);
        ExprNode b = session.parse(right);
        assertEquals(arithmetic.add(a, b), arithmetic.add(b, a));
        assertEquals(arithmetic.multiply(a, b), arithmetic.multiply(b, a));
        assertEquals(a, arithmetic.multiply(a, ExprNode.one()));
        assertEquals(a, arithmetic.add(a, ExprNode.zero()));
        assertEquals(ExprNode.zero(), arithmetic.multiply(a, ExprNode.zero()));
    }

    @Test
    public void testLargeButBoundedPowersStayExact() {
        assertEquals("1267650600228229401496703205376", session.format(session.parse("2^100")));
        assertEquals(session.parse("1/1024"), session.parse("2^(-10)"));
        assertEquals(session.parse("2*2^(1/2)"), session.parse("8^(1/2)"));
    }
}
