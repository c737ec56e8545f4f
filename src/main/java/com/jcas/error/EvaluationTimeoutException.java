package com.jcas.error;

/**
 * Raised by the deadline guard once the configured budget is spent. Nothing inside the engine
 * catches it; it always reaches the outermost caller.
 */
public class EvaluationTimeoutException extends CasException {
    private final long budgetMillis;

    public EvaluationTimeoutException(long budgetMillis) {
        super("timeout: computation exceeded " + budgetMillis + "ms");
        this.budgetMillis = budgetMillis;
    }

    public long budgetMillis() {
        return budgetMillis;
    }
}
