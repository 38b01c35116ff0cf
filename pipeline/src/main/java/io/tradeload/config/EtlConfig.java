package io.tradeload.config;

import java.math.BigDecimal;
import java.nio.file.Path;

/**
 * Runtime settings. Each value is read from a system property, then an environment variable, then
 * falls back to a default.
 */
public record EtlConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        Path inputDir,
        Path failureReport,
        BigDecimal tolerance,
        boolean parallelValidation,
        int connectAttempts
) {
    public static EtlConfig fromEnv() {
        String url = setting("etl.jdbc.url", "ETL_JDBC_URL", "jdbc:postgresql://localhost:5432/etl");
        String user = setting("etl.jdbc.user", "ETL_JDBC_USER", null);
        String password = setting("etl.jdbc.password", "ETL_JDBC_PASSWORD", null);
        Path in = Path.of(setting("etl.in", "ETL_IN", "."));
        Path failures = Path.of(setting("etl.failures", "ETL_FAILURES", "./out/failures.jsonl"));
        BigDecimal tolerance = new BigDecimal(setting("etl.tolerance", "ETL_TOLERANCE", "0.01"));
        boolean parallel = Boolean.parseBoolean(setting("etl.parallel", "ETL_PARALLEL", "false"));
        int attempts = Integer.parseInt(setting("etl.connect.attempts", "ETL_CONNECT_ATTEMPTS", "3"));
        return new EtlConfig(url, user, password, in, failures, tolerance, parallel, attempts);
    }

    public EtlConfig withJdbc(String url, String user, String password) {
        return new EtlConfig(url, user, password, inputDir, failureReport, tolerance, parallelValidation, connectAttempts);
    }

    public EtlConfig withInputDir(Path dir) {
        return new EtlConfig(jdbcUrl, jdbcUser, jdbcPassword, dir, failureReport, tolerance, parallelValidation, connectAttempts);
    }

    public EtlConfig withTolerance(BigDecimal value) {
        return new EtlConfig(jdbcUrl, jdbcUser, jdbcPassword, inputDir, failureReport, value, parallelValidation, connectAttempts);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
