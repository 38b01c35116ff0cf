package io.tradeload.retry;

import java.sql.SQLException;
import java.sql.SQLTransientException;

/**
 * Retries transient connectivity failures with a doubling, capped delay. A failure counts as transient
 * when it is a {@link SQLTransientException} or carries an SQLState of class {@code 08} (connection
 * exception). Anything else, such as rejected credentials or an unknown database, fails at once.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    static final String CONNECTION_EXCEPTION_CLASS = "08";

    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && isTransient(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    /** Whether {@code e}, or an SQL exception in its cause chain, reports a transient connection problem. */
    public static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof SQLTransientException) return true;
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS)) return true;
            }
        }
        return false;
    }
}
