package com.jcas.math;

/**
 * Exact Gauss-Jordan elimination over the rationals.
 */
public final class LinearSystem {

    private LinearSystem() {
    }

    /**
     * Solves {@code a x = b} for a square system. Returns null when the matrix is singular.
     * Neither argument is modified.
     */
    public static Rational[] solve(Rational[][] a, Rational[] b) {
        int n = b.length;
        if (a.length != n) {
            throw new IllegalArgumentException("Matrix has " + a.length + " rows but " + n + " right-hand values");
        }
        Rational[][] m = new Rational[n][n + 1];
        for (int i = 0; i < n; i++) {
            if (a[i].length != n) {
                throw new IllegalArgumentException("Row " + i + " has " + a[i].length + " columns, expected " + n);
            }
            System.arraycopy(a[i], 0, m[i], 0, n);
            m[i][n] = b[i];
        }

        for (int col = 0; col < n; col++) {
            int pivot = -1;
            for (int row = col; row < n; row++) {
                if (!m[row][col].isZero()) {
                    pivot = row;
                    break;
                }
            }
            if (pivot < 0) {
                return null;
            }
            Rational[] tmp = m[pivot];
            m[pivot] = m[col];
            m[col] = tmp;

            Rational inverse = m[col][col].invert();
            for (int k = col; k <= n; k++) {
                m[col][k] = m[col][k].multiply(inverse);
            }
            for (int row = 0; row < n; row++) {
                if (row == col || m[row][col].isZero()) {
                    continue;
                }
                Rational factor = m[row][col];
                for (int k = col; k <= n; k++) {
                    m[row][k] = m[row][k].subtract(factor.multiply(m[col][k]));
                }
            }
        }

        Rational[] x = new Rational[n];
        for (int i = 0; i < n; i++) {
            x[i] = m[i][n];
        }
        return x;
    }
}
