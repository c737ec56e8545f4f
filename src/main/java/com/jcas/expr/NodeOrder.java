package com.jcas.expr;

import com.jcas.math.Rational;
import com.jcas.output.ExprFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Display and iteration order of sum terms and product factors. Child maps are unordered, so
 * anything that walks children and needs a stable result goes through here.
 */
public final class NodeOrder {
    /**
     * Terms by leading name, then by descending degree, constants last.
     */
    public static final Comparator<ExprNode> TERMS = Comparator
            .comparing((ExprNode t) -> t.isConstant() ? 1 : 0)
            .thenComparing(NodeOrder::leadingName)
            .thenComparing(NodeOrder::leadingDegree, Comparator.reverseOrder())
            .thenComparing(ExprFormatter::additiveKey);

    /**
     * Numeric bases first, then factors by their multiplicative key.
     */
    public static final Comparator<ExprNode> FACTORS = Comparator
            .comparing((ExprNode f) -> f.isNumericBase() ? 0 : 1)
            .thenComparing(NodeOrder::numericBaseValue)
            .thenComparing(ExprFormatter::multiplicativeKey)
            .thenComparing(ExprFormatter::additiveKey);

    private NodeOrder() {
    }

    public static MutableList<ExprNode> sortedChildren(ExprNode node) {
        if (node.childCount() == 0) {
            return Lists.mutable.empty();
        }
        return node.children().toSortedList(node.shape() == Shape.PRODUCT ? FACTORS : TERMS);
    }

    private static String leadingName(ExprNode term) {
        return switch (term.shape()) {
            case CONSTANT -> "";
            case MONOMIAL, FUNCTION -> term.value();
            case PRODUCT -> leadingName(leadingFactor(term));
            default -> ExprFormatter.multiplicativeKey(term);
        };
    }

    private static Rational leadingDegree(ExprNode term) {
        if (term.shape() == Shape.PRODUCT) {
            return leadingDegree(leadingFactor(term));
        }
        return term.shape() == Shape.EXPONENTIAL || term.isConstant() ? Rational.ZERO : term.power();
    }

    private static ExprNode leadingFactor(ExprNode product) {
        MutableList<ExprNode> factors = sortedChildren(product);
        ExprNode symbolic = factors.detect(f -> !f.isNumericBase());
        return symbolic == null ? factors.getFirst() : symbolic;
    }

    private static BigInteger numericBaseValue(ExprNode factor) {
        return factor.isNumericBase() ? new BigInteger(factor.value()) : BigInteger.ZERO;
    }
}
