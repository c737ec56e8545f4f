package com.jcas.parser;

import com.jcas.error.DimensionException;
import com.jcas.error.InvalidVariableNameException;
import com.jcas.error.OutOfFunctionDomainException;
import com.jcas.error.OutOfRangeException;
import com.jcas.expr.ExprNode;
import com.jcas.expr.Shape;
import com.jcas.math.Rational;
import com.jcas.numeric.NumericFunctions;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.function.Function;

/**
 * The standard function table: elementary functions with their exact special values, and the
 * transform entry points.
 */
public final class BuiltinFunctions {
    private static final String[] ELEMENTARY = {
            "sin", "cos", "tan", "sec", "csc", "cot", "asin", "acos", "atan",
            "sinh", "cosh", "tanh", "sech", "csch", "coth", "asinh", "acosh", "atanh",
            "log", "log10", "abs", "erf"
    };
    private static final int MAX_EXACT_FACTORIAL = 5000;

    private BuiltinFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        for (String name : ELEMENTARY) {
            registry.register(name, 1, 1, (session, args) -> elementary(session, name, args.get(0)));
        }
        registry.register("exp", 1, 1, BuiltinFunctions::exp);
        registry.register("sqrt", 1, 1, BuiltinFunctions::sqrt);
        registry.register("factorial", 1, 1, BuiltinFunctions::factorial);
        registry.register("vector", 0, -1, (session, args) -> ExprNode.function("vector", args));

        registry.register("diff", 1, 3, BuiltinFunctions::diff);
        registry.register("integrate", 1, 2, (session, args) ->
                mapOverVector(args.get(0), f -> session.integrate(f, variableArgument(session, args, 1, f, "integrate"))));
        registry.register("defint", 3, 4, BuiltinFunctions::defint);
        registry.register("laplace", 3, 3, (session, args) -> session.laplace(scalar(args.get(0), "laplace"),
                variableName(args.get(1), "laplace"), variableName(args.get(2), "laplace")));
        registry.register("ilt", 3, 3, (session, args) -> session.inverseLaplace(scalar(args.get(0), "ilt"),
                variableName(args.get(1), "ilt"), variableName(args.get(2), "ilt")));
        registry.register("expand", 1, 1, (session, args) -> mapOverVector(args.get(0), session::expand));
        registry.register("factor", 1, 1, (session, args) -> mapOverVector(args.get(0), session::factor));
        registry.register("simplify", 1, 1, (session, args) -> mapOverVector(args.get(0), session::simplify));
        registry.register("partfrac", 1, 2, (session, args) -> {
            ExprNode f = scalar(args.get(0), "partfrac");
            return session.partialFractions(f, variableArgument(session, args, 1, f, "partfrac"));
        });
        registry.register("solve", 1, 2, (session, args) -> {
            ExprNode f = scalar(args.get(0), "solve");
            return ExprNode.function("vector", session.solve(f, variableArgument(session, args, 1, f, "solve")));
        });
        registry.register("solveEquations", 1, 2, BuiltinFunctions::solveEquations);
        registry.register("limit", 3, 3, (session, args) -> session.limit(scalar(args.get(0), "limit"),
                variableName(args.get(1), "limit"), scalar(args.get(2), "limit")));

        registry.register("gcd", 1, -1, (session, args) -> session.gcd(args));
        registry.register("lcm", 1, -1, (session, args) -> session.lcm(args));
        registry.register("divide", 2, 2, (session, args) ->
                session.divide(scalar(args.get(0), "divide"), scalar(args.get(1), "divide")));
        registry.register("div", 2, 2, BuiltinFunctions::quotientRemainder);
        registry.register("deg", 1, 2, (session, args) -> {
            ExprNode f = scalar(args.get(0), "deg");
            return session.algebra().degree(f, variableArgument(session, args, 1, f, "deg"));
        });
        registry.register("coeffs", 1, 2, BuiltinFunctions::coefficients);
        registry.register("sqcomp", 1, 2, (session, args) -> {
            ExprNode f = scalar(args.get(0), "sqcomp");
            return session.algebra().completeSquare(f, variableArgument(session, args, 1, f, "sqcomp"));
        });
        registry.register("line", 2, 3, (session, args) -> session.algebra().line(args.get(0), args.get(1),
                args.size() > 2 ? variableName(args.get(2), "line") : "x"));
        registry.register("sum", 4, 4, (session, args) -> session.sum(args.get(0),
                variableName(args.get(1), "sum"), args.get(2), args.get(3)));
        registry.register("product", 4, 4, (session, args) -> session.product(args.get(0),
                variableName(args.get(1), "product"), args.get(2), args.get(3)));
    }

    // ========== elementary functions ==========

    static ExprNode elementary(Session session, String name, ExprNode arg) {
        ExprNode exact = exactValue(session, name, arg);
        if (exact != null) {
            return exact;
        }
        if (session.settings().isNumeric() && arg.isConstant()) {
            return numeric(name, arg);
        }
        return ExprNode.function(name, arg);
    }

    private static ExprNode exactValue(Session session, String name, ExprNode arg) {
        Rational piMultiple = piMultiple(arg);
        return switch (name) {
            case "sin", "tan" -> {
                if (arg.isZero() || (piMultiple != null && piMultiple.isInteger())) {
                    yield ExprNode.zero();
                }
                yield null;
            }
            case "cos" -> {
                if (arg.isZero()) {
                    yield ExprNode.one();
                }
                if (piMultiple != null && piMultiple.isInteger()) {
                    yield ExprNode.constant(piMultiple.numerator().testBit(0) ? Rational.MINUS_ONE : Rational.ONE);
                }
                yield null;
            }
            case "asin", "atan", "sinh", "tanh", "asinh", "atanh", "erf" -> arg.isZero() ? ExprNode.zero() : null;
            case "cosh", "sech" -> arg.isZero() ? ExprNode.one() : null;
            case "acos", "acosh" -> arg.isOne() ? ExprNode.zero() : null;
            case "log" -> exactLog(arg);
            case "log10" -> exactLog10(arg);
            case "abs" -> {
                if (arg.isConstant()) {
                    yield ExprNode.constant(arg.multiplier().abs());
                }
                if (!arg.multiplier().isOne()) {
                    ExprNode inner = ExprNode.function("abs", arg.withMultiplier(Rational.ONE));
                    yield session.arithmetic().multiply(ExprNode.constant(arg.multiplier().abs()), inner);
                }
                yield null;
            }
            default -> null;
        };
    }

    private static ExprNode exactLog(ExprNode arg) {
        if (arg.isZero()) {
            throw new OutOfFunctionDomainException("log(0) is undefined");
        }
        if (arg.isConstant() && arg.multiplier().isNegative()) {
            throw new OutOfFunctionDomainException("log(" + arg + ") is undefined for negative arguments");
        }
        if (arg.isOne()) {
            return ExprNode.zero();
        }
        if (arg.shape() == Shape.MONOMIAL && arg.value().equals("e") && arg.multiplier().isOne()) {
            return ExprNode.constant(arg.power());
        }
        if (arg.shape() == Shape.EXPONENTIAL && arg.multiplier().isOne() && arg.base().isVariable("e")) {
            return arg.exponent().copy();
        }
        return null;
    }

    private static ExprNode exactLog10(ExprNode arg) {
        if (arg.isZero()) {
            throw new OutOfFunctionDomainException("log10(0) is undefined");
        }
        if (!arg.isConstant()) {
            return null;
        }
        Rational value = arg.multiplier();
        if (value.isNegative()) {
            throw new OutOfFunctionDomainException("log10(" + arg + ") is undefined for negative arguments");
        }
        Integer exponent = powerOfTen(value.isInteger() ? value.numerator() : null);
        if (exponent != null) {
            return ExprNode.constant(exponent);
        }
        if (value.numerator().equals(BigInteger.ONE)) {
            exponent = powerOfTen(value.denominator());
            if (exponent != null) {
                return ExprNode.constant(-exponent);
            }
        }
        return null;
    }

    private static Integer powerOfTen(BigInteger n) {
        if (n == null || n.signum() <= 0) {
            return null;
        }
        int exponent = 0;
        while (n.compareTo(BigInteger.ONE) > 0) {
            BigInteger[] qr = n.divideAndRemainder(BigInteger.TEN);
            if (qr[1].signum() != 0) {
                return null;
            }
            n = qr[0];
            exponent++;
        }
        return exponent;
    }

    /**
     * k for {@code k*pi}, otherwise null.
     */
    private static Rational piMultiple(ExprNode arg) {
        if (arg.shape() == Shape.MONOMIAL && arg.value().equals("pi") && arg.power().isOne()) {
            return arg.multiplier();
        }
        return null;
    }

    private static ExprNode numeric(String name, ExprNode arg) {
        double value = NumericFunctions.lookup(name).applyAsDouble(arg.multiplier().doubleValue());
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new OutOfFunctionDomainException(name + "(" + arg + ") is undefined");
        }
        return ExprNode.constant(Rational.fromDouble(value));
    }

    private static ExprNode exp(Session session, MutableList<ExprNode> args) {
        ExprNode arg = args.get(0);
        if (session.settings().isNumeric() && arg.isConstant()) {
            return numeric("exp", arg);
        }
        return session.arithmetic().pow(ExprNode.variable("e"), arg);
    }

    private static ExprNode sqrt(Session session, MutableList<ExprNode> args) {
        ExprNode arg = args.get(0);
        if (session.settings().isNumeric() && arg.isConstant()) {
            return numeric("sqrt", arg);
        }
        return session.arithmetic().pow(arg, ExprNode.constant(Rational.HALF));
    }

    private static ExprNode factorial(Session session, MutableList<ExprNode> args) {
        ExprNode arg = args.get(0);
        if (!arg.isConstant()) {
            return ExprNode.function("factorial", arg);
        }
        Rational n = arg.multiplier();
        if (n.isInteger()) {
            if (n.isNegative()) {
                throw new OutOfFunctionDomainException("factorial(" + n + ") is undefined for negative integers");
            }
            if (n.compareTo(Rational.valueOf(MAX_EXACT_FACTORIAL)) > 0) {
                throw new OutOfRangeException("factorial(" + n + ") exceeds the exact limit of " + MAX_EXACT_FACTORIAL);
            }
            BigInteger result = BigInteger.ONE;
            for (int i = 2; i <= n.intValueExact(); i++) {
                result = result.multiply(BigInteger.valueOf(i));
            }
            return ExprNode.constant(Rational.valueOf(result));
        }
        if (session.settings().isNumeric()) {
            return numeric("factorial", arg);
        }
        return ExprNode.function("factorial", arg);
    }

    // ========== transform entry points ==========

    private static ExprNode diff(Session session, MutableList<ExprNode> args) {
        int order = 1;
        if (args.size() == 3) {
            ExprNode n = args.get(2);
            if (!n.isConstant() || !n.multiplier().isInteger() || n.multiplier().isNegative()) {
                throw new OutOfRangeException("diff order must be a non-negative integer but got " + n);
            }
            order = n.multiplier().intValueExact();
        }
        int times = order;
        return mapOverVector(args.get(0), f -> session.diff(f, variableArgument(session, args, 1, f, "diff"), times));
    }

    private static ExprNode defint(Session session, MutableList<ExprNode> args) {
        ExprNode f = scalar(args.get(0), "defint");
        ExprNode from = scalar(args.get(1), "defint");
        ExprNode to = scalar(args.get(2), "defint");
        return session.definiteIntegral(f, from, to, variableArgument(session, args, 3, f, "defint"));
    }

    private static ExprNode quotientRemainder(Session session, MutableList<ExprNode> args) {
        ExprNode dividend = scalar(args.get(0), "div");
        ExprNode divisor = scalar(args.get(1), "div");
        ExprNode[] qr = session.algebra().quotientRemainder(dividend, divisor);
        if (qr == null) {
            return ExprNode.function("div", dividend, divisor);
        }
        return ExprNode.function("vector", qr);
    }

    private static ExprNode coefficients(Session session, MutableList<ExprNode> args) {
        ExprNode f = scalar(args.get(0), "coeffs");
        String x = variableArgument(session, args, 1, f, "coeffs");
        MutableList<ExprNode> coefficients = session.algebra().coefficients(f, x);
        if (coefficients == null) {
            return ExprNode.function("coeffs", f, ExprNode.variable(x));
        }
        return ExprNode.function("vector", coefficients);
    }

    /**
     * {@code solveEquations(vector(eq1, eq2, ...), vector(x, y, ...))} with each equation equal to
     * zero; the unknowns default to the free variables in sorted order. The result pairs each
     * unknown with its value, {@code vector(vector(x, 1), vector(y, 2))}.
     */
    private static ExprNode solveEquations(Session session, MutableList<ExprNode> args) {
        ExprNode system = args.get(0);
        MutableList<ExprNode> equations = system.isFunction("vector")
                ? system.args().toList()
                : Lists.mutable.with(system);
        MutableList<String> unknowns;
        if (args.size() > 1) {
            ExprNode names = args.get(1);
            unknowns = names.isFunction("vector")
                    ? names.args().toList().collect(v -> variableName(v, "solveEquations"))
                    : Lists.mutable.with(variableName(names, "solveEquations"));
        } else {
            unknowns = equations.flatCollect(ExprNode::variables).distinct()
                    .reject(session::isConstantName).sortThis();
        }
        MutableList<ExprNode> values = session.solveEquations(equations, unknowns);
        if (values == null) {
            return ExprNode.function("solveEquations", args);
        }
        MutableList<ExprNode> pairs = Lists.mutable.empty();
        for (int i = 0; i < values.size(); i++) {
            pairs.add(ExprNode.function("vector", ExprNode.variable(unknowns.get(i)), values.get(i)));
        }
        return ExprNode.function("vector", pairs);
    }

    private static ExprNode mapOverVector(ExprNode arg, Function<ExprNode, ExprNode> transform) {
        if (arg.isFunction("vector")) {
            return ExprNode.function("vector", arg.args().collect(transform::apply));
        }
        return transform.apply(arg);
    }

    private static ExprNode scalar(ExprNode arg, String function) {
        if (arg.isFunction("vector")) {
            throw new DimensionException(function + " expects a scalar expression but got a vector " + arg);
        }
        return arg;
    }

    /**
     * The variable given at {@code index}, or the single free variable of {@code f} when it is
     * omitted ({@code x} for variable-free expressions).
     */
    private static String variableArgument(Session session, MutableList<ExprNode> args, int index, ExprNode f,
                                           String function) {
        if (index < args.size()) {
            return variableName(args.get(index), function);
        }
        MutableList<String> variables = f.variables().reject(session::isConstantName);
        if (variables.isEmpty()) {
            return "x";
        }
        if (variables.size() > 1) {
            throw new InvalidVariableNameException(function + " needs an explicit variable for " + f);
        }
        return variables.getFirst();
    }

    private static String variableName(ExprNode arg, String function) {
        if (arg.shape() != Shape.MONOMIAL || !arg.power().isOne() || !arg.multiplier().isOne() || arg.isNumericBase()) {
            throw new InvalidVariableNameException(function + " expects a variable but got " + arg);
        }
        return arg.value();
    }
}
