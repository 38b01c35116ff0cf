package io.tradeload.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Names and accessors for the pipeline's Dropwizard metrics. Step timers record the validate, coerce
 * and upsert phases of each entity; counters accumulate rows updated, inserted and loaded across runs.
 */
public class Metrics {
    public static final String VALIDATE_TIME = "pipeline.step.validate.time";
    public static final String COERCE_TIME = "pipeline.step.coerce.time";
    public static final String UPSERT_TIME = "pipeline.step.upsert.time";
    public static final String ROWS_UPDATED = "pipeline.rows.updated";
    public static final String ROWS_INSERTED = "pipeline.rows.inserted";
    public static final String ROWS_LOADED = "pipeline.rows.loaded";
    /** Meter marked once per failed step. */
    public static final String STEP_FAILURES = "pipeline.step.failures";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
