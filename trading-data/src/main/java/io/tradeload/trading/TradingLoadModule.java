package io.tradeload.trading;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.tradeload.config.EtlConfig;
import io.tradeload.core.BatchSource;
import io.tradeload.error.FailureReportSink;
import io.tradeload.error.FileFailureReportSink;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.retry.ExponentialBackoffRetryPolicy;
import io.tradeload.runtime.OrchestratorBuilder;
import io.tradeload.runtime.PipelineOrchestrator;
import io.tradeload.runtime.PostLoadHook;
import io.tradeload.store.JdbcStoreSessionFactory;
import io.tradeload.store.StoreSessionFactory;
import io.tradeload.store.UpsertEngine;

import java.io.IOException;

public class TradingLoadModule extends AbstractModule {
    private final EtlConfig config;

    public TradingLoadModule(EtlConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(EtlConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton EntityRegistry entityRegistry() { return TradingEntities.registry(); }

    @Provides @Singleton UpsertEngine upsertEngine() { return new UpsertEngine(); }

    @Provides @Singleton StoreSessionFactory storeSessions() {
        return new JdbcStoreSessionFactory(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword(),
                new ExponentialBackoffRetryPolicy(config.connectAttempts(), 200, 5_000));
    }

    @Provides BatchSource source() { return new CsvBatchSource(config.inputDir()); }

    @Provides @Singleton FailureReportSink failureSink() throws IOException { return new FileFailureReportSink(config.failureReport()); }

    @Provides @Singleton PostLoadHook statisticsReport(EntityRegistry registry) {
        return new JdbcStatisticsReport(registry, config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
    }

    @Provides @Singleton PipelineOrchestrator orchestrator(EntityRegistry registry, BatchSource source, StoreSessionFactory sessions,
                                                           UpsertEngine upsertEngine, MetricRegistry metrics,
                                                           FailureReportSink failureSink, PostLoadHook report) {
        return new OrchestratorBuilder()
                .registry(registry)
                .source(source)
                .sessions(sessions)
                .tolerance(config.tolerance())
                .parallelValidation(config.parallelValidation())
                .upsertEngine(upsertEngine)
                .metrics(metrics)
                .failureSink(failureSink)
                .postLoadHook(report)
                .build();
    }
}
