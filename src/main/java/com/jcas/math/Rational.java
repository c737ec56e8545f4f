package com.jcas.math;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.OutOfRangeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Immutable arbitrary-precision rational. The denominator is always positive and the pair is
 * always gcd-reduced, so two equal values share one representation.
 */
public final class Rational implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational TWO = new Rational(BigInteger.TWO, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);
    public static final Rational HALF = new Rational(BigInteger.ONE, BigInteger.TWO);

    /**
     * Largest bit length an exact power or decimal literal may produce.
     */
    public static final int MAX_EXACT_BITS = 1 << 20;

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== factories ==========

    public static Rational valueOf(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational valueOf(BigInteger value) {
        return new Rational(Objects.requireNonNull(value, "value"), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw new DivisionByZeroException("division by zero: " + numerator + "/0");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        return new Rational(numerator, denominator);
    }

    public static Rational valueOf(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        int scale = stripped.scale();
        // 10^n needs a little over 3.32 * n bits
        if (Math.abs((long) scale) * 10 / 3 > MAX_EXACT_BITS) {
            throw new OutOfRangeException("number exceeds the exact range: " + value);
        }
        if (scale <= 0) {
            return valueOf(stripped.toBigIntegerExact());
        }
        return valueOf(stripped.unscaledValue(), BigInteger.TEN.pow(scale));
    }

    /**
     * Converts a double through its shortest decimal representation. Only numeric fallbacks use
     * this; everything symbolic stays exact.
     */
    public static Rational fromDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("not a finite number: " + value);
        }
        return valueOf(BigDecimal.valueOf(value));
    }

    /**
     * Parses {@code "12"}, {@code "-1.25"}, {@code "1.234e+1"}, {@code ".5"} or {@code "3/4"}.
     */
    public static Rational parse(String text) {
        String t = text.trim();
        int slash = t.indexOf('/');
        if (slash >= 0) {
            return valueOf(new BigInteger(t.substring(0, slash).trim()), new BigInteger(t.substring(slash + 1).trim()));
        }
        try {
            return valueOf(new BigDecimal(t));
        } catch (NumberFormatException e) {
            throw new NumberFormatException("not a number: " + text);
        }
    }

    // ========== accessors ==========

    public BigInteger numerator() {
        return numerator;
    }

    public BigInteger denominator() {
        return denominator;
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
    }

    public boolean isNegative() {
        return numerator.signum() < 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    // ========== arithmetic ==========

    public Rational add(Rational other) {
        if (isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        if (denominator.equals(other.denominator)) {
            return valueOf(numerator.add(other.numerator), denominator);
        }
        return valueOf(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new DivisionByZeroException("division by zero: " + this + "/0");
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /**
     * Floored modulo: the result has the sign of the divisor.
     */
    public Rational mod(Rational other) {
        if (other.isZero()) {
            throw new DivisionByZeroException("modulo by zero: " + this + " mod 0");
        }
        Rational quotient = divide(other);
        return subtract(other.multiply(valueOf(quotient.floor())));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    public Rational invert() {
        if (isZero()) {
            throw new DivisionByZeroException("division by zero: 1/0");
        }
        return valueOf(denominator, numerator);
    }

    public Rational abs() {
        return numerator.signum() < 0 ? negate() : this;
    }

    /**
     * Integer power by repeated squaring. Throws {@link OutOfRangeException} when the result
     * would exceed {@link #MAX_EXACT_BITS}.
     */
    public Rational pow(int exponent) {
        return pow(BigInteger.valueOf(exponent));
    }

    public Rational pow(BigInteger exponent) {
        if (exponent.signum() < 0) {
            return invert().pow(exponent.negate());
        }
        if (exponent.signum() == 0) {
            return ONE;
        }
        if (isZero()) {
            return ZERO;
        }
        if (denominator.equals(BigInteger.ONE) && numerator.abs().equals(BigInteger.ONE)) {
            return numerator.signum() > 0 || !exponent.testBit(0) ? ONE : MINUS_ONE;
        }
        long bits = Math.max(numerator.bitLength(), denominator.bitLength());
        if (exponent.bitLength() > 31 || bits * exponent.longValue() > MAX_EXACT_BITS) {
            throw new OutOfRangeException("(" + this + ")^" + exponent + " exceeds the exact range");
        }
        Rational result = ONE;
        Rational base = this;
        int e = exponent.intValueExact();
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    public BigInteger floor() {
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        if (qr[1].signum() < 0) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    public Rational min(Rational other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Rational max(Rational other) {
        return compareTo(other) >= 0 ? this : other;
    }

    // ========== conversions ==========

    public double doubleValue() {
        if (isInteger()) {
            return numerator.doubleValue();
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
    }

    public int intValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException("not an integer: " + this);
        }
        return numerator.intValueExact();
    }

    /**
     * Long division to {@code precision} digits after the point, trailing zeros removed. The
     * last digit is truncated, not rounded.
     */
    public String toDecimal(int precision) {
        StringBuilder sb = new StringBuilder();
        if (numerator.signum() < 0) {
            sb.append('-');
        }
        BigInteger[] qr = numerator.abs().divideAndRemainder(denominator);
        sb.append(qr[0]);
        BigInteger remainder = qr[1];
        if (remainder.signum() == 0 || precision <= 0) {
            return sb.toString();
        }
        sb.append('.');
        int lastNonZero = sb.length();
        for (int i = 0; i < precision && remainder.signum() != 0; i++) {
            BigInteger[] step = remainder.multiply(BigInteger.TEN).divideAndRemainder(denominator);
            sb.append(step[0]);
            if (step[0].signum() != 0) {
                lastNonZero = sb.length();
            }
            remainder = step[1];
        }
        sb.setLength(lastNonZero);
        if (sb.charAt(sb.length() - 1) == '.') {
            sb.setLength(sb.length() - 1);
        }
        if (sb.length() == 2 && sb.charAt(0) == '-' && sb.charAt(1) == '0') {
            return "0";
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational)) {
            return false;
        }
        Rational other = (Rational) o;
        return numerator.equals(other.numerator) && denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * numerator.hashCode() + denominator.hashCode();
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
