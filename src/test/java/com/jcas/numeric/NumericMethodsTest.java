package com.jcas.numeric;

import com.jcas.error.MaximumIterationsException;
import com.jcas.session.DeadlineGuard;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumericMethodsTest {

    private final DeadlineGuard deadline = new DeadlineGuard();

    // ========== Quadrature ==========

    @Test
    public void testSimpson() {
        assertEquals(2.0, NumericMethods.simpson(Math::sin, 0, Math.PI, 1e-12, 40, deadline), 1e-10);
        assertEquals(1.0 / 3, NumericMethods.simpson(x -> x * x, 0, 1, 1e-12, 40, deadline), 1e-12);
    }

    @Test
    public void testSimpsonOnUndefinedValues() {
        assertThrows(MaximumIterationsException.class,
                () -> NumericMethods.simpson(x -> Math.log(x - 0.5), 0, 1, 1e-12, 40, deadline));
    }

    // ========== Root Finding ==========

    @Test
    public void testBisection() {
        double root = NumericMethods.bisection(x -> x * x - 2, 0, 2, 2000, 1e-14, deadline);
        assertEquals(Math.sqrt(2), root, 1e-12);
    }

    @Test
    public void testBisectionEndpointRoot() {
        assertEquals(1.0, NumericMethods.bisection(x -> x - 1, 1, 3, 100, 1e-14, deadline));
    }

    @Test
    public void testBisectionNeedsBracket() {
        assertThrows(IllegalArgumentException.class,
                () -> NumericMethods.bisection(x -> x * x + 1, -1, 1, 100, 1e-14, deadline));
    }

    @Test
    public void testNewton() {
        double root = NumericMethods.newton(Math::cos, x -> -Math.sin(x), 1, 200, 1e-14, deadline);
        assertEquals(Math.PI / 2, root, 1e-12);
    }

    @Test
    public void testNewtonFlatSlope() {
        assertThrows(MaximumIterationsException.class,
                () -> NumericMethods.newton(x -> x * x + 1, x -> 2 * x, 0, 200, 1e-14, deadline));
    }
}
