package com.dsflow.datasource;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;

/**
 * Micrometer meters for one data source, tagged with its name.
 */
public final class PipelineMetrics {
    public static final String SAMPLES = "dsflow.samples";
    public static final String ABANDONED = "dsflow.samples.abandoned";
    public static final String EVICTIONS = "dsflow.entities.evicted";
    public static final String EPOCHS = "dsflow.epochs";
    public static final String BATCH_DURATION = "dsflow.batch.duration";

    private final Counter accepted;
    private final Counter rejected;
    private final Counter failed;
    private final Counter timedOut;
    private final Counter abandoned;
    private final Counter evicted;
    private final Counter epochs;
    private final Timer batchTimer;
    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry, String source) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.accepted = sampleCounter(source, "accepted");
        this.rejected = sampleCounter(source, "rejected");
        this.failed   = sampleCounter(source, "failed");
        this.timedOut = sampleCounter(source, "timed_out");
        this.abandoned = Counter.builder(ABANDONED)
                .description("Timed-out sample tasks still running after the interrupt")
                .tag("source", source)
                .register(registry);
        this.evicted = Counter.builder(EVICTIONS)
                .description("Raw data released under memory pressure")
                .tag("source", source)
                .register(registry);
        this.epochs = Counter.builder(EPOCHS)
                .description("Completed cyclic scans of the entity store")
                .tag("source", source)
                .register(registry);
        this.batchTimer = Timer.builder(BATCH_DURATION)
                .tag("source", source)
                .register(registry);
    }

    private Counter sampleCounter(String source, String outcome) {
        return Counter.builder(SAMPLES)
                .tag("source", source)
                .tag("outcome", outcome)
                .register(registry);
    }

    void record(SampleProcessor.Outcome outcome) {
        switch (outcome) {
            case ACCEPTED:  accepted.increment(); break;
            case REJECTED:  rejected.increment(); break;
            case FAILED:    failed.increment(); break;
            case TIMED_OUT: timedOut.increment(); break;
            default: break;
        }
    }

    void markAbandoned() {
        abandoned.increment();
    }

    void evicted() {
        evicted.increment();
    }

    void epoch() {
        epochs.increment();
    }

    Timer batchTimer() {
        return batchTimer;
    }

    public double accepted() { return accepted.count(); }
    public double rejected() { return rejected.count(); }
    public double failed() { return failed.count(); }
    public double timedOut() { return timedOut.count(); }
    public double abandoned() { return abandoned.count(); }
    public double evictions() { return evicted.count(); }
    public double epochs() { return epochs.count(); }
}
