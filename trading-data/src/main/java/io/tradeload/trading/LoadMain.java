package io.tradeload.trading;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.tradeload.config.EtlConfig;
import io.tradeload.metrics.Metrics;
import io.tradeload.runtime.PipelineOrchestrator;
import io.tradeload.runtime.PipelineRunResult;
import io.tradeload.runtime.PipelineStepResult;
import picocli.CommandLine;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI that loads account and transaction CSVs into the relational store in one pipeline run.
 */
@CommandLine.Command(name = "tradeload", mixinStandardHelpOptions = true, description = "Validate and upsert account and transaction CSVs")
public final class LoadMain implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_RUN = 1;
    static final int EXIT_BAD_ARGS = 2;

    @CommandLine.Option(names = {"-i", "--in"}, description = "Directory holding account.csv and transaction.csv")
    Path inputDir;

    @CommandLine.Option(names = {"-u", "--jdbc-url"}, description = "JDBC URL of the target store")
    String jdbcUrl;

    @CommandLine.Option(names = "--user", description = "Database user")
    String user;

    @CommandLine.Option(names = "--password", description = "Database password", interactive = true, arity = "0..1")
    String password;

    @CommandLine.Option(names = {"-t", "--tolerance"}, description = "Allowed discrepancy for arithmetic checks (default 0.01)")
    BigDecimal tolerance;

    public static void main(String[] args) {
        int code = new CommandLine(new LoadMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        EtlConfig config = EtlConfig.fromEnv();
        if (jdbcUrl != null || user != null || password != null) {
            config = config.withJdbc(jdbcUrl != null ? jdbcUrl : config.jdbcUrl(),
                    user != null ? user : config.jdbcUser(),
                    password != null ? password : config.jdbcPassword());
        }
        if (inputDir != null) config = config.withInputDir(inputDir);
        if (tolerance != null) config = config.withTolerance(tolerance);

        if (config.tolerance().signum() < 0) {
            System.err.println("Tolerance must not be negative");
            return EXIT_BAD_ARGS;
        }
        if (!Files.isDirectory(config.inputDir())) {
            System.err.println("Input directory does not exist: " + config.inputDir());
            return EXIT_BAD_ARGS;
        }

        Injector injector = Guice.createInjector(new TradingLoadModule(config));
        PipelineOrchestrator orchestrator = injector.getInstance(PipelineOrchestrator.class);
        PipelineRunResult result = orchestrator.runPipeline();
        printSummary(result, injector.getInstance(MetricRegistry.class));
        return result.success() ? EXIT_OK : EXIT_FAILED_RUN;
    }

    private static void printSummary(PipelineRunResult result, MetricRegistry registry) {
        System.out.println("Run " + (result.success() ? "succeeded" : "failed") + " in " + result.elapsed().toMillis() + " ms");
        for (PipelineStepResult step : result.steps()) {
            String status = step.finalState() + (step.success() ? " rows=" + step.rowsLoaded() : " " + step.errorMessage());
            System.out.println("  " + step.entityName() + ": " + status);
        }
        if (!result.success()) System.out.println("  " + result.errorMessage());
        Timer upsert = registry.timer(Metrics.UPSERT_TIME);
        System.out.println("  updated=" + registry.counter(Metrics.ROWS_UPDATED).getCount()
                + " inserted=" + registry.counter(Metrics.ROWS_INSERTED).getCount()
                + " upsert.p50(ms)=" + TimeUnit.NANOSECONDS.toMillis((long) upsert.getSnapshot().getMedian()));
    }
}
