package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.session.Session;
import com.jcas.session.Settings;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SolverTest {

    private final Session session = new Session();

    private MutableList<String> solve(String f) {
        return session.solve(session.parse(f), "x").collect(session::format);
    }

    @Test
    public void testQuadraticRootsInOrder() {
        assertEquals(Lists.mutable.with("2", "-2"), solve("x^2-4"));
        assertEquals("[2,-2]", session.format(session.parse("solve(x^2-4)")));
    }

    @ParameterizedTest
    @CsvSource({
        "'2*x+3', '-3/2'",
        "'x^3-8', '2'",
        "'x^2-2*x+1', '1'",
        "'log(x)', '1'",
        "'sin(x)', '0'",
        "'x^(1/2)-3', '9'"
    })
    public void testSingleRoot(String f, String root) {
        assertEquals(Lists.mutable.with(root), solve(f));
    }

    @Test
    public void testRationalRoots() {
        MutableList<String> roots = solve("x^3-6*x^2+11*x-6");
        assertEquals(3, roots.size());
        assertTrue(roots.containsAll(Lists.mutable.with("1", "2", "3")), roots.toString());
    }

    @Test
    public void testEvenBinomial() {
        MutableList<String> roots = solve("x^4-16");
        assertEquals(2, roots.size());
        assertTrue(roots.containsAll(Lists.mutable.with("2", "-2")), roots.toString());
    }

    @Test
    public void testIrrationalQuadratic() {
        MutableList<ExprNode> roots = session.solve(session.parse("x^2-2"), "x");
        assertEquals(2, roots.size());
        assertTrue(roots.contains(session.parse("sqrt(2)")), roots.toString());
        assertTrue(roots.contains(session.parse("-sqrt(2)")), roots.toString());
    }

    @Test
    public void testZeroProduct() {
        MutableList<String> roots = solve("(x-1)^2*(x+2)");
        assertEquals(2, roots.size());
        assertTrue(roots.containsAll(Lists.mutable.with("1", "-2")), roots.toString());
    }

    @Test
    public void testNoRealRoots() {
        assertTrue(solve("x^2+1").isEmpty());
        assertTrue(solve("e^x").isEmpty());
        assertTrue(solve("5").isEmpty());
    }

    @Test
    public void testPolesAreExcluded() {
        assertEquals(Lists.mutable.with("-1"), solve("(x^2-1)/(x-1)"));
        assertTrue(solve("1/x").isEmpty());
    }

    @Test
    public void testSymbolicCoefficients() {
        MutableList<ExprNode> roots = session.solve(session.parse("a*x+b"), "x");
        assertEquals(Lists.mutable.with(session.parse("-b/a")), roots);
    }

    @Test
    public void testSolveForAnotherVariable() {
        MutableList<ExprNode> roots = session.solve(session.parse("x^2-y"), "y");
        assertEquals(Lists.mutable.with(session.parse("x^2")), roots);
    }

    @Test
    public void testInverseFunction() {
        MutableList<ExprNode> roots = session.solve(session.parse("sin(x)-1/2"), "x");
        assertEquals(Lists.mutable.with(session.parse("asin(1/2)")), roots);
    }

    @Test
    public void testNumericFallback() {
        Session unbounded = new Session(Settings.defaults().setTimeoutMillis(0));
        // x^5+x+1 = (x^2+x+1)(x^3-x^2+1), one real root
        MutableList<ExprNode> roots = unbounded.solve(unbounded.parse("x^5+x+1"), "x");
        assertEquals(1, roots.size(), roots.toString());
        assertTrue(roots.getFirst().isConstant());
        assertEquals(-0.7548776662466927, roots.getFirst().multiplier().doubleValue(), 1e-9);
    }

    // ============================================================
    // Linear systems
    // ============================================================

    @Test
    public void testLinearSystem() {
        MutableList<ExprNode> values = session.solveEquations(
                Lists.mutable.with(session.parse("x+y-3"), session.parse("x-y-1")), Lists.mutable.with("x", "y"));
        assertEquals(Lists.mutable.with(ExprNode.constant(2), ExprNode.constant(1)), values);
    }

    @Test
    public void testLinearSystemThroughParser() {
        assertEquals(session.parse("vector(vector(x, 2), vector(y, 1))"),
                session.parse("solveEquations(vector(x+y-3, x-y-1), vector(x, y))"));
        assertEquals(session.parse("vector(vector(a, 1/2), vector(b, -1))"),
                session.parse("solveEquations(vector(2*a+b, 2*a-b-2))"));
    }

    @ParameterizedTest
    @CsvSource({
        "'vector(x+y-3, 2*x+2*y-6)'",
        "'vector(x*y-3, x-y-1)'",
        "'vector(x^2+y, x-y-1)'"
    })
    public void testSingularOrNonlinearSystemStaysInert(String system) {
        ExprNode result = session.parse("solveEquations(" + system + ", vector(x, y))");
        assertTrue(result.isFunction("solveEquations"), result.toString());
    }
}
