package com.jcas.numeric;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.function.DoubleUnaryOperator;

/**
 * Floating-point counterparts of the built-in functions, used by numeric mode and compiled
 * callables. Results outside a function's domain are NaN.
 */
public final class NumericFunctions {
    private static final double[] LANCZOS = {
            0.99999999999980993, 676.5203681218851, -1259.1392167224028, 771.32342877765313,
            -176.61503916999185, 12.507343278686905, -0.13857109526572012, 9.9843695780195716e-6,
            1.5056327351493116e-7
    };

    private static final MutableMap<String, DoubleUnaryOperator> FUNCTIONS = Maps.mutable.empty();

    static {
        FUNCTIONS.put("sin", Math::sin);
        FUNCTIONS.put("cos", Math::cos);
        FUNCTIONS.put("tan", Math::tan);
        FUNCTIONS.put("sec", x -> 1 / Math.cos(x));
        FUNCTIONS.put("csc", x -> 1 / Math.sin(x));
        FUNCTIONS.put("cot", x -> 1 / Math.tan(x));
        FUNCTIONS.put("asin", Math::asin);
        FUNCTIONS.put("acos", Math::acos);
        FUNCTIONS.put("atan", Math::atan);
        FUNCTIONS.put("sinh", Math::sinh);
        FUNCTIONS.put("cosh", Math::cosh);
        FUNCTIONS.put("tanh", Math::tanh);
        FUNCTIONS.put("sech", x -> 1 / Math.cosh(x));
        FUNCTIONS.put("csch", x -> 1 / Math.sinh(x));
        FUNCTIONS.put("coth", x -> 1 / Math.tanh(x));
        FUNCTIONS.put("asinh", x -> Math.log(x + Math.sqrt(x * x + 1)));
        FUNCTIONS.put("acosh", x -> Math.log(x + Math.sqrt(x * x - 1)));
        FUNCTIONS.put("atanh", x -> 0.5 * Math.log((1 + x) / (1 - x)));
        FUNCTIONS.put("log", x -> x > 0 ? Math.log(x) : Double.NaN);
        FUNCTIONS.put("log10", x -> x > 0 ? Math.log10(x) : Double.NaN);
        FUNCTIONS.put("exp", Math::exp);
        FUNCTIONS.put("sqrt", Math::sqrt);
        FUNCTIONS.put("abs", Math::abs);
        FUNCTIONS.put("erf", NumericFunctions::erf);
        FUNCTIONS.put("factorial", NumericFunctions::factorial);
    }

    private NumericFunctions() {
    }

    public static DoubleUnaryOperator lookup(String name) {
        return FUNCTIONS.get(name);
    }

    public static boolean contains(String name) {
        return FUNCTIONS.containsKey(name);
    }

    /**
     * Power series below 3, continued fraction for the complement above.
     */
    static double erf(double x) {
        if (Double.isNaN(x)) {
            return x;
        }
        double ax = Math.abs(x);
        if (ax > 6) {
            return Math.signum(x);
        }
        if (ax <= 3) {
            double term = x;
            double sum = x;
            double x2 = x * x;
            for (int n = 1; n < 200; n++) {
                term *= -x2 / n;
                double contribution = term / (2 * n + 1);
                sum += contribution;
                if (Math.abs(contribution) < 1e-17 * Math.abs(sum)) {
                    break;
                }
            }
            return 2 / Math.sqrt(Math.PI) * sum;
        }
        double k = ax;
        for (int n = 60; n >= 1; n--) {
            k = ax + (n / 2.0) / k;
        }
        double erfc = Math.exp(-ax * ax) / (Math.sqrt(Math.PI) * k);
        return Math.signum(x) * (1 - erfc);
    }

    /**
     * Exact product for small non-negative integers, Lanczos gamma otherwise.
     */
    static double factorial(double n) {
        if (n == Math.rint(n)) {
            if (n < 0) {
                return Double.NaN;
            }
            if (n <= 170) {
                double result = 1;
                for (int i = 2; i <= n; i++) {
                    result *= i;
                }
                return result;
            }
            return Double.POSITIVE_INFINITY;
        }
        return gamma(n + 1);
    }

    static double gamma(double x) {
        if (x < 0.5) {
            return Math.PI / (Math.sin(Math.PI * x) * gamma(1 - x));
        }
        x -= 1;
        double a = LANCZOS[0];
        double t = x + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            a += LANCZOS[i] / (x + i);
        }
        return Math.sqrt(2 * Math.PI) * Math.pow(t, x + 0.5) * Math.exp(-t) * a;
    }
}
