package com.jcas.transform;

import com.jcas.error.DimensionException;
import com.jcas.expr.ExprNode;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;

/**
 * Polynomial utilities over one variable: gcd and lcm, division with remainder, degree and
 * coefficient lists, completing the square, the line through two points, and finite sums and
 * products. Inputs outside their reach come back as inert calls.
 */
public final class Algebra extends TransformSupport {

    public Algebra(Session session) {
        super(session);
    }

    // ========== gcd and lcm ==========

    /**
     * Greatest common divisor of integers, rationals or univariate polynomials with rational
     * coefficients. Polynomial results carry the gcd of the contents, so
     * {@code gcd(2*x^2+2*x, 4*x) = 2*x}.
     */
    public ExprNode gcd(ListIterable<ExprNode> args) {
        if (args.allSatisfy(ExprNode::isConstant)) {
            Rational result = Rational.ZERO;
            for (ExprNode arg : args) {
                result = gcd(result, arg.multiplier());
            }
            return num(result);
        }
        String x = singleVariable(args);
        MutableList<Polynomial> polynomials = x == null ? null : polynomials(args, x);
        if (polynomials == null) {
            return ExprNode.function("gcd", args.toList().collect(ExprNode::copy));
        }
        Polynomial result = Polynomial.ZERO;
        Rational content = Rational.ZERO;
        for (Polynomial p : polynomials) {
            deadline().check();
            if (p.isZero()) {
                continue;
            }
            result = result.isZero() ? p.monic() : result.gcd(p);
            content = gcd(content, p.content());
        }
        Polynomial primitive = result.multiply(result.content().invert());
        return mul(num(content), session.decomposition().fromPolynomial(primitive, x));
    }

    /**
     * Least common multiple, {@code a*b/gcd(a, b)} folded over the arguments.
     */
    public ExprNode lcm(ListIterable<ExprNode> args) {
        if (args.allSatisfy(ExprNode::isConstant)) {
            return num(rationalLcm(args.collect(ExprNode::multiplier)));
        }
        String x = singleVariable(args);
        MutableList<Polynomial> polynomials = x == null ? null : polynomials(args, x);
        if (polynomials == null || polynomials.anySatisfy(Polynomial::isZero)) {
            return ExprNode.function("lcm", args.toList().collect(ExprNode::copy));
        }
        Polynomial result = polynomials.getFirst();
        for (Polynomial p : polynomials.subList(1, polynomials.size())) {
            deadline().check();
            result = result.multiply(p).divide(result.gcd(p))[0];
        }
        Rational content = rationalLcm(polynomials.collect(Polynomial::content));
        Polynomial primitive = result.multiply(result.content().invert());
        return mul(num(content), session.decomposition().fromPolynomial(primitive, x));
    }

    private static Rational rationalLcm(ListIterable<Rational> values) {
        Rational result = values.getFirst().abs();
        for (Rational value : values) {
            Rational divisor = gcd(result, value);
            result = divisor.isZero() ? Rational.ZERO : result.multiply(value).abs().divide(divisor);
        }
        return result;
    }

    private static Rational gcd(Rational a, Rational b) {
        BigInteger numerator = a.numerator().gcd(b.numerator());
        BigInteger denominator = a.denominator().multiply(b.denominator())
                .divide(a.denominator().gcd(b.denominator()));
        return Rational.valueOf(numerator, denominator);
    }

    // ========== division ==========

    /**
     * {@code [quotient, remainder]} of polynomial long division, or null when either side is
     * not a polynomial in a single shared variable.
     */
    public ExprNode[] quotientRemainder(ExprNode dividend, ExprNode divisor) {
        if (divisor.isConstant()) {
            return new ExprNode[]{div(dividend, divisor), ExprNode.zero()};
        }
        String x = singleVariable(Lists.immutable.with(dividend, divisor));
        if (x == null) {
            return null;
        }
        Polynomial top = session.decomposition().toPolynomial(dividend, x);
        Polynomial bottom = session.decomposition().toPolynomial(divisor, x);
        if (top == null || bottom == null) {
            return null;
        }
        Polynomial[] qr = top.divide(bottom);
        Decomposition decomposition = session.decomposition();
        return new ExprNode[]{decomposition.fromPolynomial(qr[0], x), decomposition.fromPolynomial(qr[1], x)};
    }

    /**
     * {@code quotient + remainder/divisor}.
     */
    public ExprNode divide(ExprNode dividend, ExprNode divisor) {
        ExprNode[] qr = quotientRemainder(dividend, divisor);
        if (qr == null) {
            return ExprNode.function("divide", dividend.copy(), divisor.copy());
        }
        return add(qr[0], div(qr[1], divisor));
    }

    // ========== coefficients ==========

    /**
     * Highest power of {@code x}, or an inert {@code deg(f, x)} when {@code f} is not a
     * polynomial in it.
     */
    public ExprNode degree(ExprNode f, String x) {
        MutableIntObjectMap<ExprNode> coefficients = session.decomposition().coefficients(f, x);
        if (coefficients == null) {
            return ExprNode.function("deg", f.copy(), var(x));
        }
        return num(coefficients.isEmpty() ? 0 : coefficients.keySet().max());
    }

    /**
     * Coefficients from degree 0 upwards, zeros included; null when {@code f} is not a
     * polynomial in {@code x}.
     */
    public MutableList<ExprNode> coefficients(ExprNode f, String x) {
        MutableIntObjectMap<ExprNode> coefficients = session.decomposition().coefficients(f, x);
        if (coefficients == null) {
            return null;
        }
        int degree = coefficients.isEmpty() ? 0 : coefficients.keySet().max();
        MutableList<ExprNode> result = Lists.mutable.empty();
        for (int i = 0; i <= degree; i++) {
            ExprNode c = coefficients.get(i);
            result.add(c == null ? ExprNode.zero() : c);
        }
        return result;
    }

    /**
     * {@code a*x^2 + b*x + c} as {@code (sqrt(a)*x + b/(2*sqrt(a)))^2 + c - b^2/(4*a)}. Anything
     * that is not a quadratic in {@code x} is returned unchanged.
     */
    public ExprNode completeSquare(ExprNode f, String x) {
        MutableList<ExprNode> c = coefficients(f, x);
        if (c == null || c.size() != 3) {
            return f.copy();
        }
        ExprNode a = c.get(2);
        ExprNode b = c.get(1);
        ExprNode root = pow(a, Rational.HALF);
        ExprNode shift = div(b, mul(num(2), root));
        ExprNode square = pow(add(mul(root, var(x)), shift), Rational.TWO);
        return add(square, sub(c.get(0), div(pow(b, Rational.TWO), mul(num(4), a))));
    }

    /**
     * The line through {@code (x1, y1)} and {@code (x2, y2)}: {@code m*x - m*x1 + y1}.
     */
    public ExprNode line(ExprNode first, ExprNode second, String x) {
        ExprNode[] p = point(first);
        ExprNode[] q = point(second);
        ExprNode slope = div(sub(q[1], p[1]), sub(q[0], p[0]));
        return add(sub(mul(slope, var(x)), mul(slope, p[0])), p[1]);
    }

    private static ExprNode[] point(ExprNode arg) {
        if (!arg.isFunction("vector") || arg.args().size() != 2) {
            throw new DimensionException("line expects points as vector(x, y) but got " + arg);
        }
        return new ExprNode[]{arg.arg(0), arg.arg(1)};
    }

    // ========== sums and products ==========

    /**
     * {@code f} summed over integer {@code index} from {@code start} to {@code end}
     * inclusive; an inert {@code sum} for symbolic bounds.
     */
    public ExprNode sum(ExprNode f, String index, ExprNode start, ExprNode end) {
        if (!isIntegerBound(start) || !isIntegerBound(end)) {
            return ExprNode.function("sum", f.copy(), var(index), start.copy(), end.copy());
        }
        ExprNode result = ExprNode.zero();
        for (BigInteger i = start.multiplier().numerator(); i.compareTo(end.multiplier().numerator()) <= 0;
             i = i.add(BigInteger.ONE)) {
            deadline().check();
            result = add(result, substitute(f, index, num(Rational.valueOf(i))));
        }
        return result;
    }

    /**
     * {@code f} multiplied over integer {@code index} from {@code start} to {@code end}
     * inclusive; an inert {@code product} for symbolic bounds.
     */
    public ExprNode product(ExprNode f, String index, ExprNode start, ExprNode end) {
        if (!isIntegerBound(start) || !isIntegerBound(end)) {
            return ExprNode.function("product", f.copy(), var(index), start.copy(), end.copy());
        }
        ExprNode result = ExprNode.one();
        for (BigInteger i = start.multiplier().numerator(); i.compareTo(end.multiplier().numerator()) <= 0;
             i = i.add(BigInteger.ONE)) {
            deadline().check();
            result = mul(result, substitute(f, index, num(Rational.valueOf(i))));
        }
        return result;
    }

    private static boolean isIntegerBound(ExprNode bound) {
        return bound.isConstant() && bound.multiplier().isInteger();
    }

    // ========== helpers ==========

    /**
     * The one free variable shared by the arguments, or null for none or several.
     */
    private String singleVariable(ListIterable<ExprNode> args) {
        MutableList<String> names = args.flatCollect(ExprNode::variables, Lists.mutable.empty())
                .distinct()
                .reject(session::isConstantName);
        return names.size() == 1 ? names.getFirst() : null;
    }

    private MutableList<Polynomial> polynomials(ListIterable<ExprNode> args, String x) {
        MutableList<Polynomial> result = Lists.mutable.empty();
        for (ExprNode arg : args) {
            Polynomial p = session.decomposition().toPolynomial(arg, x);
            if (p == null) {
                return null;
            }
            result.add(p);
        }
        return result;
    }
}
