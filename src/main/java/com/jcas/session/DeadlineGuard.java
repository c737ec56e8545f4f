package com.jcas.session;

import com.jcas.error.EvaluationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative wall-clock budget for one session. Long-running algorithms call {@link #check()}
 * at loop and recursion entries.
 */
public final class DeadlineGuard {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineGuard.class);

    private static final Scope NO_OP = () -> { };

    private boolean armed;
    private long budgetMillis;
    private long deadlineNanos;

    /**
     * A disarming handle. Closing the scope returned by a nested arm does nothing.
     */
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Starts the clock unless it is already running. A budget of 0 arms without a limit.
     */
    public Scope arm(long budgetMillis) {
        if (armed) {
            return NO_OP;
        }
        armed = true;
        this.budgetMillis = budgetMillis;
        this.deadlineNanos = budgetMillis <= 0 ? Long.MAX_VALUE : System.nanoTime() + budgetMillis * 1_000_000L;
        logger.debug("Deadline armed with a budget of {}ms", budgetMillis);
        return this::disarm;
    }

    public void check() {
        if (armed && deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos > 0) {
            logger.debug("Deadline of {}ms exceeded", budgetMillis);
            throw new EvaluationTimeoutException(budgetMillis);
        }
    }

    public boolean isArmed() {
        return armed;
    }

    private void disarm() {
        armed = false;
        deadlineNanos = 0;
    }
}
