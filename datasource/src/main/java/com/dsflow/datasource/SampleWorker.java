package com.dsflow.datasource;

import com.dsflow.common.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumer: entity in, accepted sample out. A bad sample is dropped, never fatal.
 */
final class SampleWorker<D, L> implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(SampleWorker.class);

    private final BlockingQueue<Entity<D, L>> entityQueue;
    private final BlockingQueue<ProcessedSample<D, L>> sampleQueue;
    private final SampleProcessor<D, L> processor;
    private final AtomicBoolean running;

    SampleWorker(BlockingQueue<Entity<D, L>> entityQueue,
                 BlockingQueue<ProcessedSample<D, L>> sampleQueue,
                 SampleProcessor<D, L> processor,
                 AtomicBoolean running) {
        this.entityQueue = entityQueue;
        this.sampleQueue = sampleQueue;
        this.processor = processor;
        this.running = running;
    }

    @Override
    public void run() {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                Entity<D, L> entity = entityQueue.take();
                SampleProcessor.Result<D, L> r;
                try {
                    r = processor.process(entity);
                } catch (RuntimeException e) {
                    logger.warn("Unexpected failure processing entity {}", entity.getUniqueId(), e);
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                if (r.isAccepted()) {
                    sampleQueue.put(new ProcessedSample<>(entity, r.sample()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Sample worker {} stopped", Thread.currentThread().getName());
    }
}
