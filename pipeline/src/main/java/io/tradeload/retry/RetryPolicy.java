package io.tradeload.retry;

/** Decides whether a failed store operation is attempted again, and after how long. */
public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    static RetryPolicy never() {
        return new RetryPolicy() {
            @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
            @Override public long backoffMillis(int attempt) { return 0; }
        };
    }
}
