package com.jcas.expr;

/**
 * The closed set of node shapes. Every algorithm dispatches on this with an explicit switch.
 */
public enum Shape {
    /** A bare rational, held entirely in the multiplier. */
    CONSTANT,
    /** An identifier, or a positive integer literal, raised to a rational power. */
    MONOMIAL,
    /** A named call with ordered arguments. */
    FUNCTION,
    /** Terms keyed by their additive key. */
    SUM,
    /** A sum whose terms are all monomials of one variable. */
    POLYNOMIAL_LIST,
    /** Factors keyed by their multiplicative key. */
    PRODUCT,
    /** A base raised to a symbolic exponent. */
    EXPONENTIAL;

    public boolean isComposite() {
        return this == SUM || this == POLYNOMIAL_LIST;
    }
}
