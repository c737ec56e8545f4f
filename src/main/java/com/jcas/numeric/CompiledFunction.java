package com.jcas.numeric;

/**
 * A compiled expression over an ordered variable list.
 */
@FunctionalInterface
public interface CompiledFunction {
    double apply(double... values);
}
