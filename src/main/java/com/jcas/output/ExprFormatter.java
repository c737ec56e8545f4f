package com.jcas.output;

import com.jcas.expr.ExprNode;
import com.jcas.expr.NodeOrder;
import com.jcas.expr.Shape;
import com.jcas.math.Rational;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;

/**
 * Renders expression trees as text.
 *
 * <p>The canonical formatter produces text that parses back to an equal tree, and is also the
 * source of the merge keys used by the arithmetic core. Decimal formatters are lossy and only
 * meant for display.
 */
public class ExprFormatter {
    public static final ExprFormatter CANONICAL = new ExprFormatter(false, 0);

    private final boolean decimal;
    private final int precision;

    private ExprFormatter(boolean decimal, int precision) {
        this.decimal = decimal;
        this.precision = precision;
    }

    public static ExprFormatter decimal(int precision) {
        return new ExprFormatter(true, precision);
    }

    public String format(ExprNode node) {
        StringBuilder sb = new StringBuilder(64);
        appendNode(node, sb);
        return sb.toString();
    }

    // ========== merge keys ==========

    /**
     * The node with its multiplier stripped. Terms with equal additive keys merge under
     * addition. All constants share the key {@code "#"}.
     */
    public static String additiveKey(ExprNode node) {
        if (node.isConstant()) {
            return "#";
        }
        StringBuilder sb = new StringBuilder(32);
        CANONICAL.appendTerm(node, Rational.ONE, sb);
        return sb.toString();
    }

    /**
     * The base of the node with its power stripped. Factors with equal multiplicative keys
     * merge under multiplication by adding exponents.
     */
    public static String multiplicativeKey(ExprNode node) {
        return switch (node.shape()) {
            case CONSTANT -> "#";
            case MONOMIAL -> literal(node.value());
            case FUNCTION -> CANONICAL.callText(node);
            case SUM, POLYNOMIAL_LIST -> "(" + CANONICAL.sumBody(node) + ")";
            case EXPONENTIAL -> CANONICAL.baseText(node.base());
            case PRODUCT -> additiveKey(node);
        };
    }

    // ========== rendering ==========

    private void appendNode(ExprNode node, StringBuilder sb) {
        switch (node.shape()) {
            case CONSTANT -> sb.append(number(node.multiplier()));
            case SUM, POLYNOMIAL_LIST -> {
                if (node.power().isOne() && node.multiplier().isOne()) {
                    sb.append(sumBody(node));
                } else {
                    appendTerm(node, node.multiplier(), sb);
                }
            }
            default -> appendTerm(node, node.multiplier(), sb);
        }
    }

    private String sumBody(ExprNode sum) {
        StringBuilder sb = new StringBuilder(64);
        boolean first = true;
        for (ExprNode term : NodeOrder.sortedChildren(sum)) {
            String text = format(term);
            if (!first && !text.startsWith("-")) {
                sb.append('+');
            }
            sb.append(text);
            first = false;
        }
        return sb.toString();
    }

    private void appendTerm(ExprNode node, Rational multiplier, StringBuilder sb) {
        MutableList<String> numerator = Lists.mutable.empty();
        MutableList<String> denominator = Lists.mutable.empty();
        MutableList<ExprNode> factors = node.shape() == Shape.PRODUCT
                ? NodeOrder.sortedChildren(node)
                : Lists.mutable.with(node);
        for (ExprNode factor : factors) {
            Rational p = factor.shape() == Shape.EXPONENTIAL ? Rational.ONE : factor.power();
            if (p.isNegative()) {
                denominator.add(factorText(factor, p.negate()));
            } else {
                numerator.add(factorText(factor, p));
            }
        }

        if (multiplier.isNegative()) {
            sb.append('-');
        }
        Rational magnitude = multiplier.abs();
        MutableList<String> top = Lists.mutable.empty();
        MutableList<String> bottom = Lists.mutable.empty();
        if (decimal) {
            if (!magnitude.isOne() || numerator.isEmpty()) {
                top.add(magnitude.toDecimal(precision));
            }
        } else {
            if (!magnitude.numerator().equals(BigInteger.ONE) || numerator.isEmpty()) {
                top.add(magnitude.numerator().toString());
            }
            if (!magnitude.denominator().equals(BigInteger.ONE)) {
                bottom.add(magnitude.denominator().toString());
            }
        }
        top.addAll(numerator);
        bottom.addAll(denominator);

        sb.append(top.makeString("*"));
        if (bottom.notEmpty()) {
            sb.append('/');
            if (bottom.size() == 1) {
                sb.append(bottom.getFirst());
            } else {
                sb.append('(').append(bottom.makeString("*")).append(')');
            }
        }
    }

    private String factorText(ExprNode factor, Rational p) {
        return switch (factor.shape()) {
            case MONOMIAL -> literal(factor.value()) + powerSuffix(p);
            case FUNCTION -> callText(factor) + powerSuffix(p);
            case SUM, POLYNOMIAL_LIST -> "(" + sumBody(factor) + ")" + powerSuffix(p);
            case EXPONENTIAL -> baseText(factor.base()) + "^" + exponentText(factor.exponent());
            default -> "(" + format(factor) + ")";
        };
    }

    private String callText(ExprNode call) {
        String arguments = call.args().collect(this::format).makeString(",");
        if (call.value().equals("vector")) {
            return "[" + arguments + "]";
        }
        return call.value() + "(" + arguments + ")";
    }

    private String baseText(ExprNode base) {
        boolean unit = base.power().isOne() && base.multiplier().isOne();
        return switch (base.shape()) {
            case CONSTANT -> {
                Rational value = base.multiplier();
                yield value.isInteger() && value.signum() > 0 ? number(value) : "(" + number(value) + ")";
            }
            case MONOMIAL -> unit ? literal(base.value()) : "(" + format(base) + ")";
            case FUNCTION -> unit ? callText(base) : "(" + format(base) + ")";
            default -> "(" + format(base) + ")";
        };
    }

    private String exponentText(ExprNode exponent) {
        boolean unit = exponent.power().isOne() && exponent.multiplier().isOne();
        if (exponent.shape() == Shape.MONOMIAL && unit && !exponent.value().startsWith("-")) {
            return exponent.value();
        }
        if (exponent.shape() == Shape.FUNCTION && unit) {
            return callText(exponent);
        }
        if (exponent.isConstant() && exponent.multiplier().isInteger() && exponent.multiplier().signum() >= 0) {
            return number(exponent.multiplier());
        }
        return "(" + format(exponent) + ")";
    }

    private static String powerSuffix(Rational p) {
        if (p.isOne()) {
            return "";
        }
        if (p.isInteger() && p.signum() > 0) {
            return "^" + p;
        }
        return "^(" + p + ")";
    }

    private static String literal(String value) {
        return value.startsWith("-") ? "(" + value + ")" : value;
    }

    private String number(Rational value) {
        return decimal ? value.toDecimal(precision) : value.toString();
    }
}
