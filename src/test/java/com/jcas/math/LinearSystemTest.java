package com.jcas.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LinearSystemTest {

    private static Rational r(long n) {
        return Rational.valueOf(n);
    }

    @Test
    public void testSolvesSquareSystem() {
        // 2x + y = 3, x - y = 0
        Rational[][] a = {{r(2), r(1)}, {r(1), r(-1)}};
        Rational[] b = {r(3), r(0)};
        Rational[] x = LinearSystem.solve(a, b);
        assertNotNull(x);
        assertEquals(Rational.ONE, x[0]);
        assertEquals(Rational.ONE, x[1]);
    }

    @Test
    public void testNeedsPivoting() {
        Rational[][] a = {{r(0), r(1)}, {r(2), r(0)}};
        Rational[] x = LinearSystem.solve(a, new Rational[]{r(5), r(1)});
        assertEquals(Rational.HALF, x[0]);
        assertEquals(r(5), x[1]);
    }

    @Test
    public void testSingularReturnsNull() {
        Rational[][] a = {{r(1), r(2)}, {r(2), r(4)}};
        assertNull(LinearSystem.solve(a, new Rational[]{r(1), r(2)}));
    }

    @Test
    public void testInputsAreNotModified() {
        Rational[][] a = {{r(2), r(1)}, {r(1), r(-1)}};
        Rational[] b = {r(3), r(0)};
        LinearSystem.solve(a, b);
        assertEquals(r(2), a[0][0]);
        assertEquals(r(3), b[0]);
    }

    @Test
    public void testShapeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> LinearSystem.solve(new Rational[][]{{r(1)}}, new Rational[]{r(1), r(2)}));
    }
}
