package io.tradeload.store;

import io.tradeload.error.StoreException;
import io.tradeload.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens {@link JdbcStoreSession}s through {@link DriverManager}, retrying connection failures as the
 * retry policy allows.
 */
public class JdbcStoreSessionFactory implements StoreSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreSessionFactory.class);

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final RetryPolicy retryPolicy;

    public JdbcStoreSessionFactory(String jdbcUrl, String user, String password, RetryPolicy retryPolicy) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.user = user;
        this.password = password;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public StoreSession open() {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return new JdbcStoreSession(getConnection());
            } catch (SQLException e) {
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    throw new StoreException("cannot connect to " + jdbcUrl + " after " + attempt + " attempt(s)", e);
                }
                long backoff = retryPolicy.backoffMillis(attempt);
                log.warn("connection attempt {} to {} failed ({}); retrying in {} ms", attempt, jdbcUrl, e.getMessage(), backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StoreException("interrupted while waiting to reconnect", ie);
                }
            }
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
