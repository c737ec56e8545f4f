package com.jcas.transform;

import com.jcas.error.DivisionByZeroException;
import com.jcas.error.MaximumIterationsException;
import com.jcas.error.OperatorException;
import com.jcas.error.OutOfFunctionDomainException;
import com.jcas.error.UndefinedException;
import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.LinearSystem;
import com.jcas.math.Polynomial;
import com.jcas.math.Rational;
import com.jcas.numeric.CompiledFunction;
import com.jcas.numeric.Compiler;
import com.jcas.numeric.NumericMethods;
import com.jcas.session.Session;
import com.jcas.session.Settings;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.function.UnaryOperator;

/**
 * Real roots of {@code f(x) = 0}. Products are split into factors, polynomials are solved in
 * closed form up to degree two and by rational roots beyond, a single occurrence of the
 * variable inside an invertible function is isolated, and whatever remains is scanned
 * numerically.
 */
public final class Solver extends TransformSupport {
    private static final Logger logger = LoggerFactory.getLogger(Solver.class);
    private static final int ROOT_SCALE = 13;
    private static final double EPSILON = 1e-14;
    private static final double RESIDUAL_TOLERANCE = 1e-6;

    /**
     * Inverses of functions of one argument: given {@code f(u) = value}, the {@code u}.
     */
    private final MutableMap<String, UnaryOperator<ExprNode>> inverses = Maps.mutable.empty();

    public Solver(Session session) {
        super(session);
        inverses.put("sin", v -> call("asin", v));
        inverses.put("cos", v -> call("acos", v));
        inverses.put("tan", v -> call("atan", v));
        inverses.put("asin", v -> call("sin", v));
        inverses.put("acos", v -> call("cos", v));
        inverses.put("atan", v -> call("tan", v));
        inverses.put("sinh", v -> call("asinh", v));
        inverses.put("cosh", v -> call("acosh", v));
        inverses.put("tanh", v -> call("atanh", v));
        inverses.put("asinh", v -> call("sinh", v));
        inverses.put("atanh", v -> call("tanh", v));
        inverses.put("log", v -> pow(var("e"), v));
        inverses.put("log10", v -> pow(num(10), v));
    }

    /**
     * Distinct roots in the order they were found.
     */
    public MutableList<ExprNode> solve(ExprNode f, String x) {
        MutableList<ExprNode> roots = Lists.mutable.empty();
        solve(f, x, 0, roots);
        return roots.distinct();
    }

    /**
     * Solves {@code equations[i] = 0} for the unknowns when the system is square and linear with
     * rational coefficients. The values follow the order of {@code unknowns}; null when the
     * system is non-linear, symbolic or singular.
     */
    public MutableList<ExprNode> solveLinearSystem(ListIterable<ExprNode> equations, ListIterable<String> unknowns) {
        int n = unknowns.size();
        if (equations.size() != n || n == 0) {
            return null;
        }
        MutableMap<String, ExprNode> zeros = Maps.mutable.empty();
        unknowns.forEach(v -> zeros.put(v, ExprNode.zero()));
        Rational[][] a = new Rational[n][n];
        Rational[] b = new Rational[n];
        for (int row = 0; row < n; row++) {
            deadline().check();
            ExprNode equation = equations.get(row);
            ExprNode constant = session.substituteAll(equation, zeros);
            if (!constant.isConstant()) {
                return null;
            }
            ExprNode residual = sub(equation, constant);
            for (int col = 0; col < n; col++) {
                String v = unknowns.get(col);
                ExprNode coefficient = session.derivative().diff(equation, v, 1);
                if (!coefficient.isConstant()) {
                    return null;
                }
                a[row][col] = coefficient.multiplier();
                residual = sub(residual, mul(coefficient, var(v)));
            }
            if (!session.expander().expand(residual).isZero()) {
                return null;
            }
            b[row] = constant.multiplier().negate();
        }
        Rational[] solution = LinearSystem.solve(a, b);
        if (solution == null) {
            logger.debug("Singular system {} in {}", equations, unknowns);
            return null;
        }
        MutableList<ExprNode> values = Lists.mutable.empty();
        for (Rational value : solution) {
            values.add(num(value));
        }
        return values;
    }

    private void solve(ExprNode f, String x, int depth, MutableList<ExprNode> roots) {
        deadline().check();
        if (depth > session.settings().maxSolveDepth()) {
            logger.debug("Solve depth exceeded for {}", f);
            return;
        }
        if (!f.contains(x)) {
            return;
        }
        Decomposition.Fraction fraction = session.decomposition().fraction(f);
        MutableList<ExprNode> candidates = Lists.mutable.empty();
        MutableList<ExprNode> factors = fraction.numerator().shape() == Shape.PRODUCT
                ? fraction.numerator().factors()
                : Lists.mutable.with(fraction.numerator());
        for (ExprNode factor : factors) {
            if (factor.contains(x)) {
                solveFactor(factor, x, depth, candidates);
            }
        }
        for (ExprNode candidate : candidates) {
            if (isAdmissible(fraction.denominator(), x, candidate)) {
                roots.add(candidate);
            }
        }
    }

    /**
     * False when {@code root} zeroes the denominator or makes it undefined.
     */
    private boolean isAdmissible(ExprNode denominator, String x, ExprNode root) {
        if (!denominator.contains(x)) {
            return true;
        }
        try {
            return !substitute(denominator, x, root).isZero();
        } catch (DivisionByZeroException | UndefinedException | OutOfFunctionDomainException e) {
            return false;
        }
    }

    private void solveFactor(ExprNode factor, String x, int depth, MutableList<ExprNode> roots) {
        Rational p = factor.power();
        switch (factor.shape()) {
            case MONOMIAL -> {
                if (p.signum() > 0) {
                    roots.add(ExprNode.zero());
                }
            }
            case EXPONENTIAL -> {
                // a^u never vanishes
            }
            case FUNCTION -> {
                if (p.signum() > 0) {
                    isolate(factor.withPower(Rational.ONE), ExprNode.zero(), x, depth, roots);
                }
            }
            case SUM, POLYNOMIAL_LIST -> {
                if (p.signum() > 0) {
                    solveSum(factor.withPower(Rational.ONE), x, depth, roots);
                }
            }
            default -> numericRoots(factor, x, roots);
        }
    }

    private void solveSum(ExprNode sum, String x, int depth, MutableList<ExprNode> roots) {
        MutableIntObjectMap<ExprNode> coefficients = session.decomposition().coefficients(sum, x);
        if (coefficients != null && !coefficients.isEmpty()) {
            solvePolynomial(sum, coefficients, x, depth, roots);
            return;
        }
        ExprNode variablePart = ExprNode.zero();
        ExprNode constantPart = ExprNode.zero();
        for (ExprNode term : sum.terms()) {
            if (term.contains(x)) {
                variablePart = add(variablePart, term);
            } else {
                constantPart = add(constantPart, term);
            }
        }
        if (variablePart.terms().size() == 1) {
            isolate(variablePart, neg(constantPart), x, depth, roots);
            return;
        }
        ExprNode expanded = session.expander().expand(sum);
        if (!expanded.equals(sum)) {
            solve(expanded, x, depth + 1, roots);
            return;
        }
        numericRoots(sum, x, roots);
    }

    // ========== polynomials ==========

    private void solvePolynomial(ExprNode polynomial, MutableIntObjectMap<ExprNode> coefficients, String x, int depth,
                                 MutableList<ExprNode> roots) {
        int degree = coefficients.keySet().max();
        if (degree < 1) {
            return;
        }
        if (degree == 1) {
            roots.add(neg(div(coefficient(coefficients, 0), coefficient(coefficients, 1))));
            return;
        }
        if (degree == 2) {
            quadratic(coefficient(coefficients, 2), coefficient(coefficients, 1), coefficient(coefficients, 0), roots);
            return;
        }
        if (coefficients.size() == 2 && coefficients.containsKey(0)) {
            binomial(degree, neg(div(coefficient(coefficients, 0), coefficient(coefficients, degree))), roots);
            return;
        }
        if (coefficients.allSatisfy(ExprNode::isConstant)) {
            Rational[] values = new Rational[degree + 1];
            for (int i = 0; i <= degree; i++) {
                values[i] = coefficient(coefficients, i).multiplier();
            }
            solveRationalPolynomial(Polynomial.of(values), x, depth, roots);
            return;
        }
        numericRoots(polynomial, x, roots);
    }

    private void quadratic(ExprNode a, ExprNode b, ExprNode c, MutableList<ExprNode> roots) {
        ExprNode discriminant = sub(pow(b, Rational.TWO), mul(num(4), mul(a, c)));
        if (discriminant.isConstant() && discriminant.multiplier().isNegative()) {
            return;
        }
        ExprNode twoA = mul(num(2), a);
        if (discriminant.isZero()) {
            roots.add(neg(div(b, twoA)));
            return;
        }
        ExprNode root = pow(discriminant, Rational.HALF);
        roots.add(div(sub(root, b), twoA));
        roots.add(neg(div(add(b, root), twoA)));
    }

    /**
     * Real roots of {@code x^n = c}.
     */
    private void binomial(int n, ExprNode c, MutableList<ExprNode> roots) {
        Rational exponent = Rational.valueOf(1, n);
        if (n % 2 == 1) {
            if (c.isConstant() && c.multiplier().isNegative()) {
                roots.add(neg(pow(neg(c), exponent)));
            } else {
                roots.add(pow(c, exponent));
            }
            return;
        }
        if (c.isConstant() && c.multiplier().isNegative()) {
            return;
        }
        ExprNode root = pow(c, exponent);
        roots.add(root);
        if (!root.isZero()) {
            roots.add(neg(root));
        }
    }

    private void solveRationalPolynomial(Polynomial polynomial, String x, int depth, MutableList<ExprNode> roots) {
        Polynomial rest = polynomial;
        for (Rational root : polynomial.rationalRoots()) {
            roots.add(num(root));
            rest = rest.divide(Polynomial.linear(root).pow(rest.multiplicity(root)))[0];
        }
        if (rest.degree() >= 1) {
            ExprNode deflated = session.decomposition().fromPolynomial(rest, x);
            if (rest.degree() <= 2) {
                solve(deflated, x, depth + 1, roots);
            } else {
                numericRoots(deflated, x, roots);
            }
        }
    }

    // ========== isolation ==========

    /**
     * Solves {@code term = value} where {@code term} is a single term holding every occurrence
     * of {@code x}, by peeling off coefficients, powers and invertible functions.
     */
    private void isolate(ExprNode term, ExprNode value, String x, int depth, MutableList<ExprNode> roots) {
        deadline().check();
        Decomposition.Split split = session.decomposition().splitCoefficient(term, x);
        ExprNode target = div(value, split.coefficient());
        ExprNode h = split.rest();
        switch (h.shape()) {
            case FUNCTION -> {
                if (!h.power().isOne()) {
                    isolatePower(h, target, x, depth, roots);
                    return;
                }
                UnaryOperator<ExprNode> inverse = inverses.get(h.value());
                if (inverse == null || h.args().size() != 1) {
                    numericRoots(sub(h, target), x, roots);
                    return;
                }
                ExprNode argumentValue;
                try {
                    argumentValue = inverse.apply(target);
                } catch (OutOfFunctionDomainException e) {
                    return;
                }
                solve(sub(h.arg(0), argumentValue), x, depth + 1, roots);
            }
            case EXPONENTIAL -> {
                if (h.base().contains(x)) {
                    numericRoots(sub(h, target), x, roots);
                    return;
                }
                if (target.isConstant() && target.multiplier().signum() <= 0) {
                    return;
                }
                ExprNode exponentValue = div(call("log", target), call("log", h.base()));
                solve(sub(h.exponent(), exponentValue), x, depth + 1, roots);
            }
            case MONOMIAL, SUM, POLYNOMIAL_LIST -> isolatePower(h, target, x, depth, roots);
            default -> numericRoots(sub(h, target), x, roots);
        }
    }

    /**
     * {@code base^p = value}: both signs of the root for even integer powers.
     */
    private void isolatePower(ExprNode h, ExprNode value, String x, int depth, MutableList<ExprNode> roots) {
        Rational p = h.power();
        ExprNode base = h.withPower(Rational.ONE);
        if (p.isOne()) {
            solve(sub(base, value), x, depth + 1, roots);
            return;
        }
        boolean even = p.numerator().mod(BigInteger.TWO).signum() == 0;
        if (even && value.isConstant() && value.multiplier().isNegative()) {
            return;
        }
        if (p.signum() < 0 && value.isZero()) {
            return;
        }
        ExprNode root;
        try {
            root = pow(value, p.invert());
        } catch (UndefinedException e) {
            return;
        }
        solve(sub(base, root), x, depth + 1, roots);
        if (even && !root.isZero()) {
            solve(add(base, root), x, depth + 1, roots);
        }
    }

    // ========== numeric fallback ==========

    /**
     * Sign changes of {@code f} on a grid over {@code [-solveRadius, solveRadius]}, refined by
     * bisection with Newton's method as a backup. Only available when {@code x} is the sole free
     * variable.
     */
    private void numericRoots(ExprNode f, String x, MutableList<ExprNode> roots) {
        CompiledFunction compiled;
        CompiledFunction slope;
        try {
            compiled = Compiler.compile(f, x);
            slope = Compiler.compile(session.derivative().diff(f, x), x);
        } catch (UndefinedException | OperatorException e) {
            logger.debug("No numeric roots for {}: {}", f, e.getMessage());
            return;
        }
        Settings settings = session.settings();
        double radius = settings.solveRadius();
        double step = settings.solveStep();
        int steps = (int) Math.ceil(2 * radius / step);
        double left = -radius;
        double fl = evaluate(compiled, left);
        for (int i = 1; i <= steps; i++) {
            deadline().check();
            double right = Math.min(radius, -radius + i * step);
            double fr = evaluate(compiled, right);
            if (fl == 0) {
                addNumericRoot(compiled, left, roots);
            } else if (Double.isFinite(fl) && Double.isFinite(fr) && fr != 0 && Math.signum(fl) != Math.signum(fr)) {
                refine(compiled, slope, left, right, roots);
            }
            left = right;
            fl = fr;
        }
        if (fl == 0) {
            addNumericRoot(compiled, left, roots);
        }
    }

    private void refine(CompiledFunction f, CompiledFunction slope, double left, double right,
                        MutableList<ExprNode> roots) {
        Settings settings = session.settings();
        double root;
        try {
            root = NumericMethods.bisection(t -> evaluate(f, t), left, right,
                    settings.maxBisectionIterations(), EPSILON, deadline());
        } catch (MaximumIterationsException e) {
            try {
                root = NumericMethods.newton(t -> evaluate(f, t), t -> evaluate(slope, t), (left + right) / 2,
                        settings.maxNewtonIterations(), EPSILON, deadline());
            } catch (MaximumIterationsException inner) {
                logger.debug("No convergence in [{}, {}]", left, right);
                return;
            }
        }
        addNumericRoot(f, root, roots);
    }

    /**
     * Adds {@code root} rounded to a fixed number of decimals, unless {@code f} is not actually
     * small there (a pole between grid points).
     */
    private void addNumericRoot(CompiledFunction f, double root, MutableList<ExprNode> roots) {
        double residual = evaluate(f, root);
        if (!(Math.abs(residual) < RESIDUAL_TOLERANCE)) {
            return;
        }
        BigDecimal rounded = BigDecimal.valueOf(root).setScale(ROOT_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        roots.add(num(Rational.valueOf(rounded)));
    }

    private static double evaluate(CompiledFunction f, double x) {
        try {
            return f.apply(x);
        } catch (DivisionByZeroException e) {
            return Double.NaN;
        }
    }

    private static ExprNode coefficient(MutableIntObjectMap<ExprNode> coefficients, int degree) {
        ExprNode c = coefficients.get(degree);
        return c == null ? ExprNode.zero() : c;
    }
}
