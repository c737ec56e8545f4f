package com.jcas.math;

import com.jcas.error.DivisionByZeroException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Dense univariate polynomial with rational coefficients, lowest degree first. Immutable.
 */
public final class Polynomial {
    private static final BigInteger DIVISOR_SEARCH_LIMIT = BigInteger.valueOf(1_000_000_000_000L);

    public static final Polynomial ZERO = new Polynomial(new Rational[0]);
    public static final Polynomial ONE = new Polynomial(new Rational[]{Rational.ONE});

    private final Rational[] coefficients;

    private Polynomial(Rational[] coefficients) {
        int length = coefficients.length;
        while (length > 0 && coefficients[length - 1].isZero()) {
            length--;
        }
        this.coefficients = length == coefficients.length ? coefficients : Arrays.copyOf(coefficients, length);
    }

    public static Polynomial of(Rational... coefficients) {
        return new Polynomial(coefficients.clone());
    }

    public static Polynomial constant(Rational value) {
        return new Polynomial(new Rational[]{value});
    }

    /**
     * {@code x - root}.
     */
    public static Polynomial linear(Rational root) {
        return new Polynomial(new Rational[]{root.negate(), Rational.ONE});
    }

    public static Polynomial monomial(Rational coefficient, int degree) {
        Rational[] c = new Rational[degree + 1];
        Arrays.fill(c, Rational.ZERO);
        c[degree] = coefficient;
        return new Polynomial(c);
    }

    /**
     * -1 for the zero polynomial.
     */
    public int degree() {
        return coefficients.length - 1;
    }

    public boolean isZero() {
        return coefficients.length == 0;
    }

    public Rational coefficient(int degree) {
        return degree < coefficients.length ? coefficients[degree] : Rational.ZERO;
    }

    public Rational leading() {
        return isZero() ? Rational.ZERO : coefficients[coefficients.length - 1];
    }

    public Polynomial add(Polynomial other) {
        int n = Math.max(coefficients.length, other.coefficients.length);
        Rational[] c = new Rational[n];
        for (int i = 0; i < n; i++) {
            c[i] = coefficient(i).add(other.coefficient(i));
        }
        return new Polynomial(c);
    }

    public Polynomial subtract(Polynomial other) {
        return add(other.multiply(Rational.MINUS_ONE));
    }

    public Polynomial multiply(Rational factor) {
        Rational[] c = new Rational[coefficients.length];
        for (int i = 0; i < c.length; i++) {
            c[i] = coefficients[i].multiply(factor);
        }
        return new Polynomial(c);
    }

    public Polynomial multiply(Polynomial other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        Rational[] c = new Rational[coefficients.length + other.coefficients.length - 1];
        Arrays.fill(c, Rational.ZERO);
        for (int i = 0; i < coefficients.length; i++) {
            for (int j = 0; j < other.coefficients.length; j++) {
                c[i + j] = c[i + j].add(coefficients[i].multiply(other.coefficients[j]));
            }
        }
        return new Polynomial(c);
    }

    public Polynomial pow(int exponent) {
        Polynomial result = ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    /**
     * Long division: {@code [quotient, remainder]}.
     */
    public Polynomial[] divide(Polynomial divisor) {
        if (divisor.isZero()) {
            throw new DivisionByZeroException("polynomial division by zero");
        }
        if (degree() < divisor.degree()) {
            return new Polynomial[]{ZERO, this};
        }
        Rational[] remainder = coefficients.clone();
        Rational[] quotient = new Rational[degree() - divisor.degree() + 1];
        Arrays.fill(quotient, Rational.ZERO);
        Rational lead = divisor.leading();
        for (int i = remainder.length - 1; i >= divisor.degree(); i--) {
            Rational factor = remainder[i].divide(lead);
            if (factor.isZero()) {
                continue;
            }
            int shift = i - divisor.degree();
            quotient[shift] = factor;
            for (int j = 0; j <= divisor.degree(); j++) {
                remainder[shift + j] = remainder[shift + j].subtract(factor.multiply(divisor.coefficients[j]));
            }
        }
        return new Polynomial[]{new Polynomial(quotient), new Polynomial(remainder)};
    }

    public Polynomial monic() {
        return isZero() ? this : multiply(leading().invert());
    }

    /**
     * Monic greatest common divisor by Euclid's algorithm.
     */
    public Polynomial gcd(Polynomial other) {
        Polynomial a = this;
        Polynomial b = other;
        while (!b.isZero()) {
            Polynomial r = a.divide(b)[1];
            a = b;
            b = r;
        }
        return a.monic();
    }

    public Polynomial derivative() {
        if (coefficients.length <= 1) {
            return ZERO;
        }
        Rational[] c = new Rational[coefficients.length - 1];
        for (int i = 1; i < coefficients.length; i++) {
            c[i - 1] = coefficients[i].multiply(Rational.valueOf(i));
        }
        return new Polynomial(c);
    }

    public Rational evaluate(Rational x) {
        Rational result = Rational.ZERO;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result.multiply(x).add(coefficients[i]);
        }
        return result;
    }

    /**
     * The rational number that divides this polynomial into one with coprime integer
     * coefficients and a positive leading coefficient.
     */
    public Rational content() {
        if (isZero()) {
            return Rational.ONE;
        }
        BigInteger numeratorGcd = BigInteger.ZERO;
        BigInteger denominatorLcm = BigInteger.ONE;
        for (Rational c : coefficients) {
            numeratorGcd = numeratorGcd.gcd(c.numerator());
            denominatorLcm = lcm(denominatorLcm, c.denominator());
        }
        Rational content = Rational.valueOf(numeratorGcd, denominatorLcm);
        return leading().isNegative() ? content.negate() : content;
    }

    /**
     * Distinct rational roots by the rational root theorem, ascending. Polynomials whose
     * constant or leading coefficient is too large to enumerate divisors of yield only the root 0
     * if present.
     */
    public MutableList<Rational> rationalRoots() {
        MutableList<Rational> roots = Lists.mutable.empty();
        if (degree() < 1) {
            return roots;
        }
        Polynomial p = this;
        if (p.coefficient(0).isZero()) {
            roots.add(Rational.ZERO);
            int shift = 0;
            while (p.coefficient(shift).isZero()) {
                shift++;
            }
            p = new Polynomial(Arrays.copyOfRange(p.coefficients, shift, p.coefficients.length));
            if (p.degree() < 1) {
                return roots;
            }
        }
        Polynomial integral = p.multiply(p.content().invert());
        BigInteger constant = integral.coefficient(0).numerator().abs();
        BigInteger lead = integral.leading().numerator().abs();
        if (constant.compareTo(DIVISOR_SEARCH_LIMIT) > 0 || lead.compareTo(DIVISOR_SEARCH_LIMIT) > 0) {
            return roots;
        }
        MutableList<BigInteger> ps = divisors(constant);
        MutableList<BigInteger> qs = divisors(lead);
        for (BigInteger numerator : ps) {
            for (BigInteger denominator : qs) {
                for (int sign = 1; sign >= -1; sign -= 2) {
                    Rational candidate = Rational.valueOf(numerator.multiply(BigInteger.valueOf(sign)), denominator);
                    if (!roots.contains(candidate) && integral.evaluate(candidate).isZero()) {
                        roots.add(candidate);
                    }
                }
            }
        }
        return roots.sortThis();
    }

    /**
     * How many times {@code x - root} divides this polynomial.
     */
    public int multiplicity(Rational root) {
        int count = 0;
        Polynomial p = this;
        Polynomial factor = linear(root);
        while (!p.isZero() && p.degree() >= 1) {
            Polynomial[] qr = p.divide(factor);
            if (!qr[1].isZero()) {
                break;
            }
            p = qr[0];
            count++;
        }
        return count;
    }

    private static MutableList<BigInteger> divisors(BigInteger n) {
        MutableList<BigInteger> result = Lists.mutable.empty();
        for (BigInteger d = BigInteger.ONE; d.multiply(d).compareTo(n) <= 0; d = d.add(BigInteger.ONE)) {
            if (n.mod(d).signum() == 0) {
                result.add(d);
                BigInteger pair = n.divide(d);
                if (!pair.equals(d)) {
                    result.add(pair);
                }
            }
        }
        return result;
    }

    private static BigInteger lcm(BigInteger a, BigInteger b) {
        return a.divide(a.gcd(b)).multiply(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Polynomial)) {
            return false;
        }
        return Arrays.equals(coefficients, ((Polynomial) o).coefficients);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(coefficients);
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = coefficients.length - 1; i >= 0; i--) {
            if (coefficients[i].isZero()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(coefficients[i].isNegative() ? " - " : " + ");
            } else if (coefficients[i].isNegative()) {
                sb.append('-');
            }
            Rational magnitude = coefficients[i].abs();
            if (!magnitude.isOne() || i == 0) {
                sb.append(magnitude);
            }
            if (i > 0) {
                sb.append(i == 1 ? "x" : "x^" + i);
            }
        }
        return sb.toString();
    }
}
