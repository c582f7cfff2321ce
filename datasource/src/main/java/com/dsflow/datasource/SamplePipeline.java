package com.dsflow.datasource;

import com.dsflow.common.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One filler and N workers connected by two bounded queues.
 *
 * <p>The queues are the only state the units share. {@link #stop()} flips the cancellation
 * flag, interrupts every unit and waits for them to finish.
 */
final class SamplePipeline<D, L> {
    private static final Logger logger = LoggerFactory.getLogger(SamplePipeline.class);

    static final long STOP_TIMEOUT_MS = 5_000;

    private final EntityStore<D, L> store;
    private final SampleProcessor<D, L> processor;
    private final int workers;
    private final String name;
    private final BlockingQueue<Entity<D, L>> entityQueue;
    private final BlockingQueue<ProcessedSample<D, L>> sampleQueue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    SamplePipeline(EntityStore<D, L> store, SampleProcessor<D, L> processor,
                   int workers, int queueSize, String name) {
        if (workers <= 0) throw new IllegalArgumentException("Workers must be a positive integer");
        if (queueSize <= 0) throw new IllegalArgumentException("Queue size must be positive");
        this.store = store;
        this.processor = processor;
        this.workers = workers;
        this.name = name;
        this.entityQueue = new ArrayBlockingQueue<>(queueSize);
        this.sampleQueue = new ArrayBlockingQueue<>(queueSize);
    }

    synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline already started");
        }
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers + 1, r -> {
            Thread t = new Thread(r, "dsflow-" + name + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        executor.execute(new EntityQueueFiller<>(store, entityQueue, sampleQueue, running));
        for (int i = 0; i < workers; i++) {
            executor.execute(new SampleWorker<>(entityQueue, sampleQueue, processor, running));
        }
        logger.info("Started pipeline '{}': 1 filler, {} workers, queue capacity {}",
                name, workers, sampleQueue.remainingCapacity());
    }

    /**
     * @return the next accepted sample, or null if none arrived within {@code timeoutMs}
     */
    ProcessedSample<D, L> poll(long timeoutMs) throws InterruptedException {
        return sampleQueue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    boolean isRunning() {
        return running.get();
    }

    synchronized void stop() {
        if (!running.getAndSet(false) || executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("Pipeline '{}' units did not terminate within {} ms", name, STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        entityQueue.clear();
        sampleQueue.clear();
        logger.info("Stopped pipeline '{}'", name);
    }

    int queuedSamples() {
        return sampleQueue.size();
    }
}
