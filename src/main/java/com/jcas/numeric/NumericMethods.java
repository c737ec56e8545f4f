package com.jcas.numeric;

import com.jcas.error.MaximumIterationsException;
import com.jcas.session.DeadlineGuard;

import java.util.function.DoubleUnaryOperator;

/**
 * Bounded numeric fallbacks. Each method either converges or throws
 * {@link MaximumIterationsException}; callers decide what non-convergence means.
 */
public final class NumericMethods {

    private NumericMethods() {
    }

    /**
     * Adaptive Simpson quadrature of {@code f} over {@code [a, b]}.
     */
    public static double simpson(DoubleUnaryOperator f, double a, double b, double tolerance, int maxDepth,
                                 DeadlineGuard deadline) {
        double fa = f.applyAsDouble(a);
        double fb = f.applyAsDouble(b);
        double m = (a + b) / 2;
        double fm = f.applyAsDouble(m);
        double whole = (b - a) / 6 * (fa + 4 * fm + fb);
        double result = simpsonStep(f, a, b, fa, fm, fb, whole, tolerance, maxDepth, deadline);
        if (!Double.isFinite(result)) {
            throw new MaximumIterationsException("quadrature diverged on [" + a + ", " + b + "]");
        }
        return result;
    }

    private static double simpsonStep(DoubleUnaryOperator f, double a, double b, double fa, double fm, double fb,
                                      double whole, double tolerance, int depth, DeadlineGuard deadline) {
        deadline.check();
        double m = (a + b) / 2;
        double lm = (a + m) / 2;
        double rm = (m + b) / 2;
        double flm = f.applyAsDouble(lm);
        double frm = f.applyAsDouble(rm);
        double left = (m - a) / 6 * (fa + 4 * flm + fm);
        double right = (b - m) / 6 * (fm + 4 * frm + fb);
        double delta = left + right - whole;
        if (Double.isNaN(delta)) {
            throw new MaximumIterationsException("quadrature hit an undefined value near " + m);
        }
        if (Math.abs(delta) <= 15 * tolerance) {
            return left + right + delta / 15;
        }
        if (depth <= 0) {
            throw new MaximumIterationsException("quadrature did not converge on [" + a + ", " + b + "]");
        }
        return simpsonStep(f, a, m, fa, flm, fm, left, tolerance / 2, depth - 1, deadline)
                + simpsonStep(f, m, b, fm, frm, fb, right, tolerance / 2, depth - 1, deadline);
    }

    /**
     * Bisection on a bracketing interval. The signs of {@code f(left)} and {@code f(right)}
     * must differ.
     */
    public static double bisection(DoubleUnaryOperator f, double left, double right, int maxIterations,
                                   double epsilon, DeadlineGuard deadline) {
        double fl = f.applyAsDouble(left);
        double fr = f.applyAsDouble(right);
        if (fl == 0) {
            return left;
        }
        if (fr == 0) {
            return right;
        }
        if (Math.signum(fl) == Math.signum(fr)) {
            throw new IllegalArgumentException("interval [" + left + ", " + right + "] does not bracket a root");
        }
        for (int i = 0; i < maxIterations; i++) {
            deadline.check();
            double mid = (left + right) / 2;
            double fm = f.applyAsDouble(mid);
            if (fm == 0 || (right - left) / 2 < epsilon) {
                return mid;
            }
            if (Math.signum(fm) == Math.signum(fl)) {
                left = mid;
                fl = fm;
            } else {
                right = mid;
            }
        }
        throw new MaximumIterationsException("bisection did not converge in " + maxIterations + " iterations");
    }

    /**
     * Newton's method from {@code start}.
     */
    public static double newton(DoubleUnaryOperator f, DoubleUnaryOperator df, double start, int maxIterations,
                                double epsilon, DeadlineGuard deadline) {
        double x = start;
        for (int i = 0; i < maxIterations; i++) {
            deadline.check();
            double slope = df.applyAsDouble(x);
            if (slope == 0 || !Double.isFinite(slope)) {
                break;
            }
            double next = x - f.applyAsDouble(x) / slope;
            if (!Double.isFinite(next)) {
                break;
            }
            if (Math.abs(next - x) <= epsilon * Math.max(1, Math.abs(next))) {
                return next;
            }
            x = next;
        }
        throw new MaximumIterationsException("Newton's method did not converge from " + start);
    }
}
