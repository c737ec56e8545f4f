package com.jcas.math;

import com.jcas.error.DivisionByZeroException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.jcas.error.OutOfRangeException;
import java.math.BigDecimal;
import java.math.BigInteger;
import static org.junit.jupiter.api.Assertions.*;

public class RationalTest {

    @Test
    public void testReducesAndNormalizesSign() {
        Rational r = Rational.valueOf(6, -8);
        assertEquals("-3", r.numerator().toString());
        assertEquals("4", r.denominator().toString());
        assertEquals(Rational.valueOf(-3, 4), r);
        assertEquals(Rational.ZERO, Rational.valueOf(0, -5));
    }

    @Test
    public void testZeroDenominatorThrows() {
        assertThrows(DivisionByZeroException.class, () -> Rational.valueOf(1, 0));
        assertThrows(DivisionByZeroException.class, () -> Rational.ONE.divide(Rational.ZERO));
    }

    @ParameterizedTest
    @CsvSource({
        "12, 12",
        "-1.25, -5/4",
        ".5, 1/2",
        "1.234e+1, 617/50",
        "3/4, 3/4",
        "6/-4, -3/2"
    })
    public void testParse(String text, String expected) {
        assertEquals(expected, Rational.parse(text).toString());
    }

    @Test
    public void testParseRejectsGarbage() {
        assertThrows(NumberFormatException.class, () -> Rational.parse("abc"));
    }

    @Test
    public void testArithmetic() {
        Rational a = Rational.valueOf(1, 3);
        Rational b = Rational.valueOf(1, 6);
        assertEquals(Rational.HALF, a.add(b));
        assertEquals(b, a.subtract(b));
        assertEquals(Rational.valueOf(1, 18), a.multiply(b));
        assertEquals(Rational.TWO, a.divide(b));
        assertEquals(Rational.valueOf(-1, 3), a.negate());
        assertEquals(Rational.valueOf(3), a.invert());
        assertEquals(Rational.valueOf(1, 27), a.pow(3));
    }

    @Test
    public void testComparison() {
        assertTrue(Rational.valueOf(1, 3).compareTo(Rational.valueOf(1, 2)) < 0);
        assertEquals(Rational.valueOf(1, 3), Rational.valueOf(1, 2).min(Rational.valueOf(1, 3)));
        assertEquals(Rational.HALF, Rational.valueOf(1, 2).max(Rational.valueOf(1, 3)));
        assertEquals(Rational.valueOf(2, 4).hashCode(), Rational.HALF.hashCode());
    }

    @Test
    public void testFloor() {
        assertEquals("1", Rational.valueOf(7, 4).floor().toString());
        assertEquals("-2", Rational.valueOf(-7, 4).floor().toString());
    }

    @ParameterizedTest
    @CsvSource({
        "1, 3, 5, 0.33333",
        "1, 4, 5, 0.25",
        "-2, 3, 3, -0.666",
        "5, 1, 4, 5",
        "1, 3, 0, 0"
    })
    public void testToDecimalTruncates(long numerator, long denominator, int precision, String expected) {
        assertEquals(expected, Rational.valueOf(numerator, denominator).toDecimal(precision));
    }

    @Test
    public void testFromDouble() {
        assertEquals(Rational.valueOf(1, 4), Rational.fromDouble(0.25));
        assertThrows(ArithmeticException.class, () -> Rational.fromDouble(Double.NaN));
    }

    @Test
    public void testPowStaysWithinExactRange() {
        assertEquals(BigInteger.TWO.pow(100), Rational.TWO.pow(100).numerator());
        assertEquals(Rational.MINUS_ONE, Rational.MINUS_ONE.pow(BigInteger.valueOf(Long.MAX_VALUE)));
        assertEquals(Rational.ZERO, Rational.ZERO.pow(BigInteger.TEN.pow(30)));
        assertThrows(OutOfRangeException.class, () -> Rational.valueOf(3).pow(30_000_000));
        assertThrows(OutOfRangeException.class, () -> Rational.TWO.pow(BigInteger.TWO.pow(40)));
        assertThrows(OutOfRangeException.class, () -> Rational.valueOf(1, 10).pow(-1_000_000));
    }

    @Test
    public void testHugeDecimalExponentIsRejected() {
        assertThrows(OutOfRangeException.class, () -> Rational.parse("1e20000000"));
        assertThrows(OutOfRangeException.class, () -> Rational.valueOf(new BigDecimal("1e-20000000")));
        assertEquals(BigInteger.TEN.pow(300), Rational.parse("1e300").numerator());
    }
}
