package com.jcas.expr;

import com.jcas.math.Rational;
import com.jcas.output.ExprFormatter;
import org.eclipse.collections.api.RichIterable;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Objects;

/**
 * A node of the canonical expression tree.
 *
 * <p>Every node carries a rational multiplier and a rational power. Which of the other fields
 * are populated depends on the {@link Shape}: {@code value} names a monomial or function,
 * {@code children} holds the keyed terms of a sum or factors of a product, {@code args} holds
 * function arguments and {@code base}/{@code exponent} describe an exponential.
 *
 * <p>Nodes are only ever built in canonical form by {@link Arithmetic}. Outside this package
 * they are read-only; the mutators below are package private and only used on nodes the
 * caller owns.
 */
public final class ExprNode {
    private final Shape shape;
    private final String value;
    private Rational multiplier;
    private Rational power;
    private final MutableMap<String, ExprNode> children;
    private final MutableList<ExprNode> args;
    private ExprNode base;
    private ExprNode exponent;

    ExprNode(Shape shape, String value, Rational multiplier, Rational power,
             MutableMap<String, ExprNode> children, MutableList<ExprNode> args,
             ExprNode base, ExprNode exponent) {
        this.shape = shape;
        this.value = value;
        this.multiplier = multiplier;
        this.power = power;
        this.children = children;
        this.args = args;
        this.base = base;
        this.exponent = exponent;
    }

    // ========== factories ==========

    public static ExprNode constant(Rational value) {
        return new ExprNode(Shape.CONSTANT, null, Objects.requireNonNull(value), Rational.ONE, null, null, null, null);
    }

    public static ExprNode constant(long value) {
        return constant(Rational.valueOf(value));
    }

    public static ExprNode zero() {
        return constant(Rational.ZERO);
    }

    public static ExprNode one() {
        return constant(Rational.ONE);
    }

    /**
     * A free variable with multiplier and power 1. Name validation happens in the parser.
     */
    public static ExprNode variable(String name) {
        return new ExprNode(Shape.MONOMIAL, Objects.requireNonNull(name), Rational.ONE, Rational.ONE, null, null, null, null);
    }

    /**
     * An unevaluated call. No simplification is applied; this is how inert transform results
     * and opaque function applications are built.
     */
    public static ExprNode function(String name, ListIterable<ExprNode> arguments) {
        MutableList<ExprNode> copies = Lists.mutable.withInitialCapacity(arguments.size());
        arguments.forEach(a -> copies.add(a.copy()));
        return new ExprNode(Shape.FUNCTION, Objects.requireNonNull(name), Rational.ONE, Rational.ONE, null, copies, null, null);
    }

    public static ExprNode function(String name, ExprNode... arguments) {
        return function(name, Lists.mutable.with(arguments));
    }

    static ExprNode monomial(String value, Rational power, Rational multiplier) {
        return new ExprNode(Shape.MONOMIAL, value, multiplier, power, null, null, null, null);
    }

    static ExprNode composite(Shape shape, MutableMap<String, ExprNode> children, Rational multiplier) {
        return new ExprNode(shape, null, multiplier, Rational.ONE, children, null, null, null);
    }

    static ExprNode exponential(ExprNode base, ExprNode exponent) {
        return new ExprNode(Shape.EXPONENTIAL, null, Rational.ONE, Rational.ONE, null, null, base, exponent);
    }

    // ========== accessors ==========

    public Shape shape() {
        return shape;
    }

    public String value() {
        return value;
    }

    public Rational multiplier() {
        return multiplier;
    }

    public Rational power() {
        return power;
    }

    public RichIterable<ExprNode> children() {
        return children == null ? Lists.immutable.empty() : children.valuesView();
    }

    public int childCount() {
        return children == null ? 0 : children.size();
    }

    public ListIterable<ExprNode> args() {
        return args == null ? Lists.immutable.empty() : args.asUnmodifiable();
    }

    public ExprNode arg(int index) {
        return args.get(index);
    }

    public ExprNode base() {
        return base;
    }

    public ExprNode exponent() {
        return exponent;
    }

    MutableMap<String, ExprNode> childMap() {
        return children;
    }

    void setMultiplier(Rational multiplier) {
        this.multiplier = multiplier;
    }

    void setPower(Rational power) {
        this.power = power;
    }

    void setExponent(ExprNode exponent) {
        this.exponent = exponent;
    }

    // ========== predicates ==========

    public boolean isConstant() {
        return shape == Shape.CONSTANT;
    }

    public boolean isZero() {
        return shape == Shape.CONSTANT && multiplier.isZero();
    }

    public boolean isOne() {
        return shape == Shape.CONSTANT && multiplier.isOne();
    }

    /**
     * True for the bare variable {@code name}: multiplier 1, power 1.
     */
    public boolean isVariable(String name) {
        return shape == Shape.MONOMIAL && value.equals(name) && power.isOne() && multiplier.isOne();
    }

    /**
     * True for an integer literal base such as the 2 in {@code 2^(1/2)}.
     */
    public boolean isNumericBase() {
        return shape == Shape.MONOMIAL && isIntegerLiteral(value);
    }

    public boolean isFunction(String name) {
        return shape == Shape.FUNCTION && value.equals(name);
    }

    public boolean contains(String variable) {
        return switch (shape) {
            case CONSTANT -> false;
            case MONOMIAL -> value.equals(variable);
            case FUNCTION -> args.anySatisfy(a -> a.contains(variable));
            case SUM, POLYNOMIAL_LIST, PRODUCT -> children.anySatisfy(c -> c.contains(variable));
            case EXPONENTIAL -> base.contains(variable) || exponent.contains(variable);
            default -> throw new IllegalStateException("Unknown shape: " + shape);
        };
    }

    /**
     * True if a call to {@code name} occurs anywhere in the tree.
     */
    public boolean containsFunction(String name) {
        return switch (shape) {
            case CONSTANT, MONOMIAL -> false;
            case FUNCTION -> value.equals(name) || args.anySatisfy(a -> a.containsFunction(name));
            case SUM, POLYNOMIAL_LIST, PRODUCT -> children.anySatisfy(c -> c.containsFunction(name));
            case EXPONENTIAL -> base.containsFunction(name) || exponent.containsFunction(name);
            default -> throw new IllegalStateException("Unknown shape: " + shape);
        };
    }

    /**
     * Free identifiers in sorted order, numeric bases excluded.
     */
    public MutableList<String> variables() {
        MutableList<String> names = Lists.mutable.empty();
        collectVariables(names);
        return names.distinct().sortThis();
    }

    private void collectVariables(MutableList<String> names) {
        switch (shape) {
            case CONSTANT -> {
            }
            case MONOMIAL -> {
                if (!isIntegerLiteral(value)) {
                    names.add(value);
                }
            }
            case FUNCTION -> args.forEach(a -> a.collectVariables(names));
            case SUM, POLYNOMIAL_LIST, PRODUCT -> children.forEachValue(c -> c.collectVariables(names));
            case EXPONENTIAL -> {
                base.collectVariables(names);
                exponent.collectVariables(names);
            }
            default -> throw new IllegalStateException("Unknown shape: " + shape);
        }
    }

    // ========== derived views ==========

    /**
     * The additive terms of this node with the outer multiplier distributed. A node that is not
     * a sum of power 1 is its own single term.
     */
    public MutableList<ExprNode> terms() {
        if (shape.isComposite() && power.isOne()) {
            MutableList<ExprNode> result = Lists.mutable.withInitialCapacity(children.size());
            for (ExprNode term : NodeOrder.sortedChildren(this)) {
                ExprNode copy = term.copy();
                copy.multiplier = copy.multiplier.multiply(multiplier);
                result.add(copy);
            }
            return result;
        }
        return Lists.mutable.with(copy());
    }

    /**
     * The multiplicative factors of this node, multiplier excluded.
     */
    public MutableList<ExprNode> factors() {
        if (shape == Shape.PRODUCT) {
            return NodeOrder.sortedChildren(this).collect(ExprNode::copy);
        }
        if (shape == Shape.CONSTANT) {
            return Lists.mutable.empty();
        }
        return Lists.mutable.with(withMultiplier(Rational.ONE));
    }

    // ========== copies ==========

    public ExprNode copy() {
        MutableMap<String, ExprNode> childCopies = null;
        if (children != null) {
            childCopies = Maps.mutable.withInitialCapacity(children.size());
            for (var entry : children.keyValuesView()) {
                childCopies.put(entry.getOne(), entry.getTwo().copy());
            }
        }
        MutableList<ExprNode> argCopies = args == null ? null : args.collect(ExprNode::copy);
        return new ExprNode(shape, value, multiplier, power, childCopies, argCopies,
                base == null ? null : base.copy(),
                exponent == null ? null : exponent.copy());
    }

    /**
     * A copy with a different multiplier. A zero multiplier yields the zero constant.
     */
    public ExprNode withMultiplier(Rational newMultiplier) {
        if (newMultiplier.isZero()) {
            return zero();
        }
        ExprNode copy = copy();
        copy.multiplier = newMultiplier;
        return copy;
    }

    /**
     * A copy with a different power. Only meaningful for monomials, functions and sums. A zero
     * power yields the multiplier as a constant.
     */
    public ExprNode withPower(Rational newPower) {
        if (newPower.isZero()) {
            return constant(multiplier);
        }
        ExprNode copy = copy();
        copy.power = newPower;
        return copy;
    }

    static boolean isIntegerLiteral(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int start = text.charAt(0) == '-' ? 1 : 0;
        if (start == text.length()) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // ========== identity ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExprNode)) {
            return false;
        }
        return toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public String toString() {
        return ExprFormatter.CANONICAL.format(this);
    }
}
