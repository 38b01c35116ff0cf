package io.tradeload.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.tradeload.core.Batch;
import io.tradeload.core.BatchSource;
import io.tradeload.core.CoercedBatch;
import io.tradeload.coerce.TypeCoercer;
import io.tradeload.error.FailureReportSink;
import io.tradeload.error.PipelineException;
import io.tradeload.error.ValidationException;
import io.tradeload.metrics.Metrics;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.store.StoreSession;
import io.tradeload.store.StoreSessionFactory;
import io.tradeload.store.UpsertEngine;
import io.tradeload.store.UpsertResult;
import io.tradeload.validate.FieldViolation;
import io.tradeload.validate.RecordValidator;
import io.tradeload.validate.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs extract, validate, coerce and upsert for every registered entity, parents before children.
 * The first failing step stops the run; every later entity is reported as skipped. Steps that already
 * committed stay committed.
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String PHASE_REFERENCES = "reference lookup";
    static final String PHASE_EXTRACTION = "extraction";
    static final String PHASE_VALIDATION = "validation";
    static final String PHASE_COERCION = "coercion";
    static final String PHASE_UPSERT = "upsert";

    private final EntityRegistry registry;
    private final BatchSource source;
    private final StoreSessionFactory sessions;
    private final RecordValidator validator;
    private final TypeCoercer coercer;
    private final UpsertEngine upsertEngine;
    private final StepListener listener;
    private final FailureReportSink failureSink;
    private final PostLoadHook postLoadHook;

    private final Timer validateTimer;
    private final Timer coerceTimer;
    private final Timer upsertTimer;
    private final Counter updatedCounter;
    private final Counter insertedCounter;
    private final Counter loadedCounter;
    private final Meter failureMeter;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public PipelineOrchestrator(EntityRegistry registry,
                                BatchSource source,
                                StoreSessionFactory sessions,
                                RecordValidator validator,
                                TypeCoercer coercer,
                                UpsertEngine upsertEngine,
                                Metrics metrics,
                                StepListener listener,
                                FailureReportSink failureSink,
                                PostLoadHook postLoadHook) {
        this.registry = Objects.requireNonNull(registry);
        this.source = Objects.requireNonNull(source);
        this.sessions = Objects.requireNonNull(sessions);
        this.validator = Objects.requireNonNull(validator);
        this.coercer = Objects.requireNonNull(coercer);
        this.upsertEngine = Objects.requireNonNull(upsertEngine);
        this.listener = listener == null ? StepListener.NONE : listener;
        this.failureSink = failureSink;
        this.postLoadHook = postLoadHook;
        this.validateTimer = metrics.timer(Metrics.VALIDATE_TIME);
        this.coerceTimer = metrics.timer(Metrics.COERCE_TIME);
        this.upsertTimer = metrics.timer(Metrics.UPSERT_TIME);
        this.updatedCounter = metrics.counter(Metrics.ROWS_UPDATED);
        this.insertedCounter = metrics.counter(Metrics.ROWS_INSERTED);
        this.loadedCounter = metrics.counter(Metrics.ROWS_LOADED);
        this.failureMeter = metrics.meter(Metrics.STEP_FAILURES);
    }

    /** Requests that the current run stop before its next step. Steps already committed are kept. */
    public void cancel() { cancelRequested.set(true); }

    public boolean isRunning() { return runLock.isLocked(); }

    /** Runs every registered entity once. Concurrent calls are serialized. Never throws for data or store failures. */
    public PipelineRunResult runPipeline() {
        runLock.lock();
        try {
            cancelRequested.set(false);
            return runOnce();
        } finally {
            runLock.unlock();
        }
    }

    private PipelineRunResult runOnce() {
        Instant startedAt = Instant.now();
        List<EntityDescriptor> order;
        try {
            order = registry.orderedEntities();
        } catch (PipelineException e) {
            log.error("cannot order registered entities: {}", e.getMessage());
            return new PipelineRunResult(List.of(), false, startedAt, Instant.now(), "cannot order registered entities: " + e.getMessage());
        }
        log.info("starting pipeline run over {} entities: {}", order.size(), order.stream().map(EntityDescriptor::name).toList());

        List<PipelineStepResult> results = new ArrayList<>();
        String failure = null;
        String failedEntity = null;

        StoreSession session = openSession();
        if (session == null) {
            failure = "store session could not be opened";
        }
        try {
            Map<String, StepState> states = new HashMap<>();
            for (EntityDescriptor entity : order) {
                if (failure == null && cancelRequested.get()) {
                    failure = "run cancelled before '" + entity.name() + "'";
                    log.warn(failure);
                }
                if (failure != null) {
                    String reason = failedEntity != null
                            ? "skipped because '" + failedEntity + "' failed"
                            : "skipped: " + failure;
                    log.warn("'{}' {}", entity.name(), reason);
                    transition(entity.name(), null, StepState.SKIPPED);
                    states.put(entity.name(), StepState.SKIPPED);
                    results.add(PipelineStepResult.skipped(entity.name(), reason));
                    continue;
                }
                PipelineStepResult step = runStep(session, entity, states);
                results.add(step);
                if (!step.success()) {
                    failure = step.errorMessage();
                    failedEntity = entity.name();
                }
            }
        } finally {
            closeQuietly(session);
        }

        PipelineRunResult result;
        if (failure == null) {
            result = new PipelineRunResult(results, true, startedAt, Instant.now(), null);
        } else {
            List<String> skipped = results.stream().filter(PipelineStepResult::skipped).map(PipelineStepResult::entityName).toList();
            String message = failure + (skipped.isEmpty()
                    ? "; no entities were skipped"
                    : "; skipped dependent entities: " + skipped);
            result = new PipelineRunResult(results, false, startedAt, Instant.now(), message);
        }
        log.info("pipeline run finished: success={} rowsLoaded={} elapsed={}ms",
                result.success(), result.totalRowsLoaded(), result.elapsed().toMillis());
        if (result.success()) runPostLoadHook(result);
        return result;
    }

    private PipelineStepResult runStep(StoreSession session, EntityDescriptor entity, Map<String, StepState> states) {
        String name = entity.name();
        StepState state = StepState.PENDING;
        transition(name, null, state);
        String phase = PHASE_REFERENCES;
        try {
            Set<String> parentKeys = null;
            if (entity.parentEntity().isPresent()) {
                String parent = entity.parentEntity().get();
                if (states.get(parent) != StepState.DONE) {
                    throw new IllegalStateException("parent '" + parent + "' has not completed");
                }
                EntityDescriptor parentDescriptor = registry.lookup(parent);
                parentKeys = session.listKeys(parentDescriptor.tableName(), entity.referencedKeyColumn());
                log.debug("loaded {} '{}' keys for referential checks of '{}'", parentKeys.size(), parent, name);
            }

            phase = PHASE_EXTRACTION;
            Batch batch = extract(entity);
            log.info("extracted {} rows for '{}'", batch.size(), name);

            phase = PHASE_VALIDATION;
            transition(name, state, state = StepState.VALIDATING);
            ValidationOutcome outcome;
            try (Timer.Context ignored = validateTimer.time()) {
                outcome = validator.validate(name, batch, parentKeys);
            }
            if (!outcome.valid()) throw new ValidationException(name, outcome.errors());

            phase = PHASE_COERCION;
            transition(name, state, state = StepState.COERCING);
            CoercedBatch coerced;
            try (Timer.Context ignored = coerceTimer.time()) {
                coerced = coercer.coerce(name, outcome.passedData().orElseThrow());
            }

            phase = PHASE_UPSERT;
            transition(name, state, state = StepState.UPSERTING);
            UpsertResult upsert;
            try (Timer.Context ignored = upsertTimer.time()) {
                upsert = upsertEngine.upsert(session, coerced, entity.tableName(), entity.conflictKey(), entity.columnNames());
            }
            if (!upsert.success()) throw upsert.error().orElseThrow();

            updatedCounter.inc(upsert.updatedRows());
            insertedCounter.inc(upsert.insertedRows());
            loadedCounter.inc(upsert.rowsLoaded());
            transition(name, state, StepState.DONE);
            states.put(name, StepState.DONE);
            log.info("loaded '{}': {} updated, {} inserted", name, upsert.updatedRows(), upsert.insertedRows());
            return PipelineStepResult.done(name, upsert.rowsLoaded());
        } catch (RuntimeException e) {
            List<FieldViolation> violations = e instanceof ValidationException
                    ? ((ValidationException) e).violations()
                    : List.of();
            String message = "entity '" + name + "' failed during " + phase + ": " + e.getMessage();
            if (e instanceof PipelineException) {
                log.warn(message);
            } else {
                log.error(message, e);
            }
            failureMeter.mark();
            transition(name, state, StepState.FAILED);
            states.put(name, StepState.FAILED);
            report(name, phase, message, violations);
            return PipelineStepResult.failed(name, phase, message, violations);
        }
    }

    private Batch extract(EntityDescriptor entity) {
        try {
            Batch batch = source.extract(entity);
            return batch == null ? Batch.empty(entity.name()) : batch;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new PipelineException("cannot extract '" + entity.name() + "': " + e.getMessage(), e);
        }
    }

    private StoreSession openSession() {
        try {
            return sessions.open();
        } catch (RuntimeException e) {
            log.error("store session could not be opened: {}", e.getMessage());
            return null;
        }
    }

    private void closeQuietly(StoreSession session) {
        if (session == null) return;
        try {
            session.close();
        } catch (Exception e) {
            log.warn("closing store session failed: {}", e.getMessage());
        }
    }

    private void report(String entityName, String phase, String message, List<FieldViolation> violations) {
        if (failureSink == null) return;
        try {
            failureSink.acceptFailure(entityName, phase, message, violations);
        } catch (RuntimeException e) {
            log.warn("failure report for '{}' was not written: {}", entityName, e.getMessage());
        }
    }

    private void runPostLoadHook(PipelineRunResult result) {
        if (postLoadHook == null) return;
        try {
            postLoadHook.afterLoad(result);
        } catch (Exception e) {
            log.warn("post-load hook failed, run result unchanged: {}", e.getMessage(), e);
        }
    }

    private void transition(String entityName, StepState from, StepState to) {
        log.debug("'{}': {} -> {}", entityName, from, to);
        try {
            listener.onTransition(entityName, from, to);
        } catch (RuntimeException e) {
            log.warn("step listener failed on '{}' {} -> {}: {}", entityName, from, to, e.getMessage());
        }
    }
}
