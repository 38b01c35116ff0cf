package io.tradeload.runtime;

import com.codahale.metrics.MetricRegistry;
import io.tradeload.coerce.TypeCoercer;
import io.tradeload.core.BatchSource;
import io.tradeload.error.FailureReportSink;
import io.tradeload.metrics.Metrics;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.store.StoreSessionFactory;
import io.tradeload.store.UpsertEngine;
import io.tradeload.validate.RecordValidator;

import java.math.BigDecimal;
import java.util.Objects;

public class OrchestratorBuilder {
    private EntityRegistry registry;
    private BatchSource source;
    private StoreSessionFactory sessions;
    private BigDecimal tolerance = RecordValidator.DEFAULT_TOLERANCE;
    private boolean parallelValidation = false;
    private UpsertEngine upsertEngine;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private StepListener listener = StepListener.NONE;
    private FailureReportSink failureSink;
    private PostLoadHook postLoadHook;

    public OrchestratorBuilder registry(EntityRegistry r) { this.registry = r; return this; }
    public OrchestratorBuilder source(BatchSource s) { this.source = s; return this; }
    public OrchestratorBuilder sessions(StoreSessionFactory f) { this.sessions = f; return this; }
    public OrchestratorBuilder tolerance(BigDecimal t) { this.tolerance = Objects.requireNonNull(t); return this; }
    public OrchestratorBuilder parallelValidation(boolean p) { this.parallelValidation = p; return this; }
    public OrchestratorBuilder upsertEngine(UpsertEngine e) { this.upsertEngine = e; return this; }
    public OrchestratorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public OrchestratorBuilder listener(StepListener l) { this.listener = l; return this; }
    public OrchestratorBuilder failureSink(FailureReportSink s) { this.failureSink = s; return this; }
    public OrchestratorBuilder postLoadHook(PostLoadHook h) { this.postLoadHook = h; return this; }

    public PipelineOrchestrator build() {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sessions, "sessions");
        return new PipelineOrchestrator(registry, source, sessions,
                new RecordValidator(registry, tolerance, parallelValidation),
                new TypeCoercer(registry),
                upsertEngine != null ? upsertEngine : new UpsertEngine(),
                new Metrics(metricRegistry), listener, failureSink, postLoadHook);
    }
}
