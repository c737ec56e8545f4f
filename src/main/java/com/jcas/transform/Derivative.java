package com.jcas.transform;

import com.jcas.expr.ExprNode;
import com.jcas.math.Rational;
import com.jcas.session.Session;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.function.UnaryOperator;

/**
 * Symbolic differentiation: power, product and chain rules over a table of known function
 * derivatives. Calls with no table entry come back as an inert {@code diff(f, x)}.
 */
public final class Derivative extends TransformSupport {
    private static final Rational MINUS_HALF = Rational.valueOf(-1, 2);

    /**
     * Outer derivatives f'(u), to be multiplied by du/dx.
     */
    private final MutableMap<String, UnaryOperator<ExprNode>> table = Maps.mutable.empty();

    public Derivative(Session session) {
        super(session);
        table.put("sin", u -> call("cos", u));
        table.put("cos", u -> neg(call("sin", u)));
        table.put("tan", u -> pow(call("sec", u), Rational.TWO));
        table.put("sec", u -> mul(call("sec", u), call("tan", u)));
        table.put("csc", u -> neg(mul(call("csc", u), call("cot", u))));
        table.put("cot", u -> neg(pow(call("csc", u), Rational.TWO)));
        table.put("asin", u -> pow(sub(num(1), square(u)), MINUS_HALF));
        table.put("acos", u -> neg(pow(sub(num(1), square(u)), MINUS_HALF)));
        table.put("atan", u -> pow(add(num(1), square(u)), Rational.MINUS_ONE));
        table.put("sinh", u -> call("cosh", u));
        table.put("cosh", u -> call("sinh", u));
        table.put("tanh", u -> pow(call("sech", u), Rational.TWO));
        table.put("sech", u -> neg(mul(call("sech", u), call("tanh", u))));
        table.put("csch", u -> neg(mul(call("csch", u), call("coth", u))));
        table.put("coth", u -> neg(pow(call("csch", u), Rational.TWO)));
        table.put("asinh", u -> pow(add(square(u), num(1)), MINUS_HALF));
        table.put("acosh", u -> pow(sub(square(u), num(1)), MINUS_HALF));
        table.put("atanh", u -> pow(sub(num(1), square(u)), Rational.MINUS_ONE));
        table.put("log", u -> pow(u, Rational.MINUS_ONE));
        table.put("log10", u -> pow(mul(u, call("log", num(10))), Rational.MINUS_ONE));
        table.put("abs", u -> div(u, call("abs", u)));
        table.put("erf", u -> mul(div(num(2), pow(var("pi"), Rational.HALF)),
                pow(var("e"), neg(square(u)))));
    }

    /**
     * The {@code order}-th derivative.
     */
    public ExprNode diff(ExprNode f, String variable, int order) {
        ExprNode result = f;
        for (int i = 0; i < order; i++) {
            result = diff(result, variable);
        }
        return result;
    }

    public ExprNode diff(ExprNode f, String x) {
        deadline().check();
        if (!f.contains(x)) {
            return ExprNode.zero();
        }
        Rational m = f.multiplier();
        Rational p = f.power();
        return switch (f.shape()) {
            case MONOMIAL -> mul(num(m.multiply(p)), pow(var(x), p.subtract(Rational.ONE)));
            case FUNCTION -> {
                ExprNode unit = f.withMultiplier(Rational.ONE).withPower(Rational.ONE);
                yield chain(unit, m, p, derivativeOfCall(unit, x));
            }
            case SUM, POLYNOMIAL_LIST -> {
                ExprNode unit = f.withMultiplier(Rational.ONE).withPower(Rational.ONE);
                ExprNode inner = ExprNode.zero();
                for (ExprNode term : unit.terms()) {
                    inner = add(inner, diff(term, x));
                }
                yield chain(unit, m, p, inner);
            }
            case PRODUCT -> {
                MutableList<ExprNode> factors = f.factors();
                ExprNode result = ExprNode.zero();
                for (int i = 0; i < factors.size(); i++) {
                    ExprNode term = diff(factors.get(i), x);
                    for (int j = 0; j < factors.size() && !term.isZero(); j++) {
                        if (j != i) {
                            term = mul(term, factors.get(j));
                        }
                    }
                    result = add(result, term);
                }
                yield mul(num(m), result);
            }
            case EXPONENTIAL -> {
                ExprNode unit = f.withMultiplier(Rational.ONE);
                ExprNode logarithmic = diff(mul(call("log", f.base()), f.exponent()), x);
                yield mul(num(m), mul(unit, logarithmic));
            }
            default -> throw new IllegalStateException("Unexpected shape: " + f.shape());
        };
    }

    /**
     * {@code m * p * unit^(p-1) * inner}, the generalized power rule.
     */
    private ExprNode chain(ExprNode unit, Rational m, Rational p, ExprNode inner) {
        if (p.isOne()) {
            return mul(num(m), inner);
        }
        return mul(num(m.multiply(p)), mul(pow(unit, p.subtract(Rational.ONE)), inner));
    }

    private ExprNode derivativeOfCall(ExprNode call, String x) {
        UnaryOperator<ExprNode> outer = table.get(call.value());
        if (outer == null || call.args().size() != 1) {
            return ExprNode.function("diff", call, var(x));
        }
        ExprNode arg = call.arg(0);
        return mul(outer.apply(arg.copy()), diff(arg, x));
    }

    private ExprNode square(ExprNode u) {
        return pow(u, Rational.TWO);
    }
}
