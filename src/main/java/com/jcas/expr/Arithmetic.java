package com.jcas.expr;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.UndefinedException;
import com.jcas.math.Rational;
import com.jcas.output.ExprFormatter;
import com.jcas.session.DeadlineGuard;
import com.jcas.session.Settings;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.math.BigInteger;

/**
 * The five operators of the expression algebra. Every result is in canonical form.
 *
 * <p>Each binary operation computes a key per operand; equal keys merge by combining a
 * rational (the multiplier under addition, the exponent under multiplication), otherwise the
 * operands become children of a new sum or product, re-merging any colliding keys.
 *
 * <p>Operands are copied first unless the session runs in fast mode, in which case they may be
 * consumed in place.
 */
public final class Arithmetic {
    private static final int TRIAL_DIVISION_LIMIT = 10_000;
    private static final int ROOT_SEARCH_BITS = 2048;

    private final Settings settings;
    private final DeadlineGuard deadline;

    public Arithmetic(Settings settings) {
        this(settings, new DeadlineGuard());
    }

    public Arithmetic(Settings settings, DeadlineGuard deadline) {
        this.settings = settings;
        this.deadline = deadline;
    }

    private ExprNode own(ExprNode node) {
        return settings.isImmutable() ? node.copy() : node;
    }

    // ========== addition ==========

    public ExprNode add(ExprNode a, ExprNode b) {
        a = own(a);
        b = own(b);
        if (a.isZero()) {
            return b;
        }
        if (b.isZero()) {
            return a;
        }
        if (a.isConstant() && b.isConstant()) {
            return ExprNode.constant(a.multiplier().add(b.multiplier()));
        }
        if (!isFlattenable(a) && !isFlattenable(b)
                && ExprFormatter.additiveKey(a).equals(ExprFormatter.additiveKey(b))) {
            Rational sum = a.multiplier().add(b.multiplier());
            if (sum.isZero()) {
                return ExprNode.zero();
            }
            a.setMultiplier(sum);
            return a;
        }
        MutableMap<String, ExprNode> terms = Maps.mutable.empty();
        collectTerms(a, terms);
        collectTerms(b, terms);
        return buildSum(terms);
    }

    public ExprNode subtract(ExprNode a, ExprNode b) {
        return add(a, negate(b));
    }

    public ExprNode negate(ExprNode a) {
        return multiply(a, ExprNode.constant(Rational.MINUS_ONE));
    }

    private static boolean isFlattenable(ExprNode node) {
        return node.shape().isComposite() && node.power().isOne();
    }

    private static void collectTerms(ExprNode node, MutableMap<String, ExprNode> terms) {
        if (isFlattenable(node)) {
            Rational outer = node.multiplier();
            for (ExprNode term : node.childMap().valuesView()) {
                term.setMultiplier(term.multiplier().multiply(outer));
                mergeTerm(term, terms);
            }
        } else {
            mergeTerm(node, terms);
        }
    }

    private static void mergeTerm(ExprNode term, MutableMap<String, ExprNode> terms) {
        if (term.isZero()) {
            return;
        }
        String key = ExprFormatter.additiveKey(term);
        ExprNode existing = terms.get(key);
        if (existing == null) {
            terms.put(key, term);
            return;
        }
        Rational sum = existing.multiplier().add(term.multiplier());
        if (sum.isZero()) {
            terms.remove(key);
        } else if (existing.isConstant()) {
            terms.put(key, ExprNode.constant(sum));
        } else {
            existing.setMultiplier(sum);
        }
    }

    private static ExprNode buildSum(MutableMap<String, ExprNode> terms) {
        if (terms.isEmpty()) {
            return ExprNode.zero();
        }
        if (terms.size() == 1) {
            return terms.valuesView().getFirst();
        }
        return ExprNode.composite(isPolynomialList(terms) ? Shape.POLYNOMIAL_LIST : Shape.SUM, terms, Rational.ONE);
    }

    private static boolean isPolynomialList(MutableMap<String, ExprNode> terms) {
        String variable = null;
        for (ExprNode term : terms.valuesView()) {
            if (term.shape() != Shape.MONOMIAL || term.isNumericBase()) {
                return false;
            }
            if (variable == null) {
                variable = term.value();
            } else if (!variable.equals(term.value())) {
                return false;
            }
        }
        return true;
    }

    // ========== multiplication ==========

    public ExprNode multiply(ExprNode a, ExprNode b) {
        a = own(a);
        b = own(b);
        if (a.isZero() || b.isZero()) {
            return ExprNode.zero();
        }
        if (a.isConstant()) {
            return scale(b, a.multiplier());
        }
        if (b.isConstant()) {
            return scale(a, b.multiplier());
        }
        Rational[] coefficient = {a.multiplier().multiply(b.multiplier())};
        a.setMultiplier(Rational.ONE);
        b.setMultiplier(Rational.ONE);
        MutableMap<String, ExprNode> factors = Maps.mutable.empty();
        collectFactors(a, factors, coefficient);
        collectFactors(b, factors, coefficient);
        return buildProduct(factors, coefficient[0]);
    }

    public ExprNode divide(ExprNode a, ExprNode b) {
        if (b.isZero()) {
            throw new DivisionByZeroException("division by zero");
        }
        return multiply(a, invert(b));
    }

    public ExprNode invert(ExprNode a) {
        if (a.isZero()) {
            throw new DivisionByZeroException("division by zero");
        }
        return pow(a, ExprNode.constant(Rational.MINUS_ONE));
    }

    private static ExprNode scale(ExprNode node, Rational factor) {
        if (factor.isZero()) {
            return ExprNode.zero();
        }
        node.setMultiplier(node.multiplier().multiply(factor));
        return node;
    }

    private void collectFactors(ExprNode node, MutableMap<String, ExprNode> factors, Rational[] coefficient) {
        if (node.shape() == Shape.PRODUCT) {
            coefficient[0] = coefficient[0].multiply(node.multiplier());
            for (ExprNode factor : node.childMap().valuesView()) {
                mergeFactor(factor, factors, coefficient);
            }
        } else {
            mergeFactor(node, factors, coefficient);
        }
    }

    private void mergeFactor(ExprNode factor, MutableMap<String, ExprNode> factors, Rational[] coefficient) {
        if (factor.isConstant()) {
            coefficient[0] = coefficient[0].multiply(factor.multiplier());
            return;
        }
        coefficient[0] = coefficient[0].multiply(factor.multiplier());
        factor.setMultiplier(Rational.ONE);
        String key = ExprFormatter.multiplicativeKey(factor);
        ExprNode existing = factors.remove(key);
        if (existing == null) {
            factors.put(key, factor);
            return;
        }
        ExprNode merged = pow(unitBase(existing), add(exponentOf(existing), exponentOf(factor)));
        if (merged.shape() == Shape.PRODUCT) {
            collectFactors(merged, factors, coefficient);
        } else {
            mergeFactor(merged, factors, coefficient);
        }
    }

    private static ExprNode buildProduct(MutableMap<String, ExprNode> factors, Rational coefficient) {
        if (coefficient.isZero()) {
            return ExprNode.zero();
        }
        if (factors.isEmpty()) {
            return ExprNode.constant(coefficient);
        }
        if (factors.size() == 1) {
            return scale(factors.valuesView().getFirst(), coefficient);
        }
        return ExprNode.composite(Shape.PRODUCT, factors, coefficient);
    }

    /**
     * The base of a factor at power 1, as the thing its exponent applies to.
     */
    private static ExprNode unitBase(ExprNode factor) {
        if (factor.shape() == Shape.EXPONENTIAL) {
            return factor.base().copy();
        }
        if (factor.isNumericBase()) {
            return ExprNode.constant(Rational.valueOf(new BigInteger(factor.value())));
        }
        ExprNode base = factor.copy();
        base.setPower(Rational.ONE);
        base.setMultiplier(Rational.ONE);
        return base;
    }

    private static ExprNode exponentOf(ExprNode factor) {
        if (factor.shape() == Shape.EXPONENTIAL) {
            return factor.exponent().copy();
        }
        return ExprNode.constant(factor.power());
    }

    // ========== powers ==========

    public ExprNode pow(ExprNode a, ExprNode b) {
        a = own(a);
        b = own(b);
        if (b.isConstant()) {
            return powRational(a, b.multiplier());
        }
        if (a.isZero()) {
            return ExprNode.zero();
        }
        if (a.isOne()) {
            return ExprNode.one();
        }
        if (a.isConstant()) {
            return ExprNode.exponential(a, b);
        }
        if (!a.multiplier().isOne()) {
            ExprNode coefficient = pow(ExprNode.constant(a.multiplier()), b.copy());
            a.setMultiplier(Rational.ONE);
            return multiply(coefficient, pow(a, b));
        }
        return switch (a.shape()) {
            case EXPONENTIAL -> {
                ExprNode exponent = multiply(a.exponent(), b);
                if (exponent.isConstant()) {
                    yield powRational(a.base(), exponent.multiplier());
                }
                a.setExponent(exponent);
                yield a;
            }
            case PRODUCT -> {
                ExprNode result = ExprNode.one();
                for (ExprNode factor : a.childMap().valuesView()) {
                    result = multiply(result, pow(factor, b.copy()));
                }
                yield result;
            }
            case MONOMIAL, FUNCTION, SUM, POLYNOMIAL_LIST -> {
                ExprNode exponent = multiply(b, ExprNode.constant(a.power()));
                ExprNode base = unitBase(a);
                if (exponent.isConstant()) {
                    yield powRational(base, exponent.multiplier());
                }
                yield ExprNode.exponential(base, exponent);
            }
            default -> throw new IllegalStateException("Unknown shape: " + a.shape());
        };
    }

    private ExprNode powRational(ExprNode a, Rational r) {
        if (r.isZero()) {
            if (a.isZero()) {
                throw new UndefinedException("0^0 is undefined");
            }
            return ExprNode.one();
        }
        if (a.isZero()) {
            if (r.isNegative()) {
                throw new UndefinedException("0^" + r + " is undefined");
            }
            return ExprNode.zero();
        }
        if (r.isOne()) {
            return a;
        }
        if (a.isConstant()) {
            return powConstant(a.multiplier(), r);
        }
        ExprNode coefficient = a.multiplier().isOne() ? null : powConstant(a.multiplier(), r);
        a.setMultiplier(Rational.ONE);
        ExprNode unit = powUnit(a, r);
        return coefficient == null ? unit : multiply(coefficient, unit);
    }

    private ExprNode powUnit(ExprNode a, Rational r) {
        if (a.shape() == Shape.MONOMIAL && a.isNumericBase()) {
            return powInteger(new BigInteger(a.value()), a.power().multiply(r));
        }
        return switch (a.shape()) {
            case MONOMIAL, FUNCTION, SUM, POLYNOMIAL_LIST -> {
                Rational p = a.power().multiply(r);
                if (p.isZero()) {
                    yield ExprNode.one();
                }
                a.setPower(p);
                yield a;
            }
            case PRODUCT -> {
                ExprNode result = ExprNode.one();
                for (ExprNode factor : a.childMap().valuesView()) {
                    result = multiply(result, powRational(factor, r));
                }
                yield result;
            }
            case EXPONENTIAL -> {
                ExprNode exponent = multiply(a.exponent(), ExprNode.constant(r));
                if (exponent.isConstant()) {
                    yield powRational(a.base(), exponent.multiplier());
                }
                a.setExponent(exponent);
                yield a;
            }
            default -> throw new IllegalStateException("Unknown shape: " + a.shape());
        };
    }

    private ExprNode powConstant(Rational base, Rational r) {
        if (r.isInteger()) {
            return ExprNode.constant(base.pow(r.numerator()));
        }
        if (base.isInteger()) {
            return powInteger(base.numerator(), r);
        }
        return multiply(powInteger(base.numerator(), r), powInteger(base.denominator(), r.negate()));
    }

    /**
     * An integer raised to a rational power, with perfect powers pulled out of the radical and
     * the remaining exponent normalized into (0, 1).
     */
    private ExprNode powInteger(BigInteger base, Rational r) {
        if (r.isInteger()) {
            return ExprNode.constant(Rational.valueOf(base).pow(r.numerator()));
        }
        if (base.signum() == 0) {
            return powRational(ExprNode.zero(), r);
        }
        if (base.signum() < 0) {
            BigInteger q = r.denominator();
            if (q.testBit(0)) {
                Rational sign = r.numerator().testBit(0) ? Rational.MINUS_ONE : Rational.ONE;
                return scale(powInteger(base.negate(), r), sign);
            }
            ExprNode minusOne = ExprNode.monomial("-1", r.mod(Rational.TWO), Rational.ONE);
            if (base.equals(BigInteger.ONE.negate())) {
                return minusOne;
            }
            return multiply(minusOne, powInteger(base.negate(), r));
        }
        if (base.equals(BigInteger.ONE)) {
            return ExprNode.one();
        }
        if (r.denominator().bitLength() > 31 || base.bitLength() > ROOT_SEARCH_BITS) {
            return radical(base, r, Rational.ONE);
        }
        int q = r.denominator().intValueExact();
        BigInteger[] split = extractRoot(base, q);
        BigInteger outside = split[0];
        BigInteger inside = split[1];
        Rational coefficient = Rational.valueOf(outside).pow(r.numerator());
        if (inside.equals(BigInteger.ONE)) {
            return ExprNode.constant(coefficient);
        }
        Rational fraction = r.subtract(Rational.valueOf(r.floor()));
        for (int k = inside.bitLength(); k >= 2; k--) {
            deadline.check();
            BigInteger root = integerRoot(inside, k);
            if (root != null) {
                Rational whole = Rational.valueOf(r.floor());
                coefficient = coefficient.multiply(Rational.valueOf(inside).pow(whole.numerator()));
                return scale(powInteger(root, fraction.multiply(Rational.valueOf(k))), coefficient);
            }
        }
        return radical(inside, r, coefficient);
    }

    /**
     * {@code coefficient * n^r} with the integer part of {@code r} folded into the coefficient.
     */
    private static ExprNode radical(BigInteger n, Rational r, Rational coefficient) {
        Rational whole = Rational.valueOf(r.floor());
        Rational scaled = coefficient.multiply(Rational.valueOf(n).pow(whole.numerator()));
        return ExprNode.monomial(n.toString(), r.subtract(whole), scaled);
    }

    /**
     * Splits {@code n} into {@code outside^q * inside} with {@code inside} free of q-th powers
     * among small primes.
     */
    private BigInteger[] extractRoot(BigInteger n, int q) {
        BigInteger outside = BigInteger.ONE;
        BigInteger inside = BigInteger.ONE;
        BigInteger rest = n;
        for (int d = 2; d <= TRIAL_DIVISION_LIMIT; d++) {
            deadline.check();
            BigInteger divisor = BigInteger.valueOf(d);
            if (divisor.multiply(divisor).compareTo(rest) > 0) {
                break;
            }
            int count = 0;
            while (rest.mod(divisor).signum() == 0) {
                rest = rest.divide(divisor);
                count++;
            }
            if (count > 0) {
                outside = outside.multiply(divisor.pow(count / q));
                inside = inside.multiply(divisor.pow(count % q));
            }
        }
        BigInteger root = integerRoot(rest, q);
        if (root != null) {
            outside = outside.multiply(root);
        } else {
            inside = inside.multiply(rest);
        }
        return new BigInteger[]{outside, inside};
    }

    /**
     * The exact k-th root of a positive integer, or null.
     */
    private BigInteger integerRoot(BigInteger n, int k) {
        if (n.signum() <= 0) {
            return n.signum() == 0 ? BigInteger.ZERO : null;
        }
        BigInteger low = BigInteger.ONE;
        BigInteger high = BigInteger.ONE.shiftLeft(n.bitLength() / k + 1);
        while (low.compareTo(high) <= 0) {
            deadline.check();
            BigInteger mid = low.add(high).shiftRight(1);
            int cmp = mid.pow(k).compareTo(n);
            if (cmp == 0) {
                return mid;
            }
            if (cmp < 0) {
                low = mid.add(BigInteger.ONE);
            } else {
                high = mid.subtract(BigInteger.ONE);
            }
        }
        return null;
    }
}
