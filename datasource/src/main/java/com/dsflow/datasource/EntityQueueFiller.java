package com.dsflow.datasource;

import com.dsflow.common.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Producer: walks the entity store cyclically and feeds the entity queue.
 *
 * <p>Backpressure is two-hop: while the downstream sample queue is full the filler backs off
 * instead of pushing, and a full entity queue blocks the push itself. Owns the store's
 * cursor for as long as it runs.
 */
final class EntityQueueFiller<D, L> implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(EntityQueueFiller.class);

    static final long BACKOFF_MS = 5;

    private final EntityStore<D, L> store;
    private final BlockingQueue<Entity<D, L>> entityQueue;
    private final BlockingQueue<?> sampleQueue;
    private final AtomicBoolean running;

    EntityQueueFiller(EntityStore<D, L> store,
                      BlockingQueue<Entity<D, L>> entityQueue,
                      BlockingQueue<?> sampleQueue,
                      AtomicBoolean running) {
        this.store = store;
        this.entityQueue = entityQueue;
        this.sampleQueue = sampleQueue;
        this.running = running;
    }

    @Override
    public void run() {
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                if (sampleQueue.remainingCapacity() == 0) {
                    TimeUnit.MILLISECONDS.sleep(BACKOFF_MS);
                    continue;
                }
                entityQueue.put(store.next());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            logger.error("Entity queue filler died", e);
            throw e;
        }
        logger.debug("Entity queue filler stopped");
    }
}
