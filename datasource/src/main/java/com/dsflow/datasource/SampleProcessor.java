package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.common.Sample;
import com.dsflow.config.Verbosity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Materializes one sample and runs it through the controller chain.
 *
 * <p>Never throws for a bad sample: loader and controller exceptions become
 * {@link Outcome#FAILED}. With a deadline configured the work runs on
 * {@code deadlineExecutor} and is cancelled once the deadline passes; that counts as a
 * rejection ({@link Outcome#TIMED_OUT}).
 *
 * <p>A task that ignores the interrupt keeps its pool thread until it returns. The pool is
 * fixed-size, and an entity whose earlier task is still running is not submitted again.
 */
final class SampleProcessor<D, L> {
    private static final Logger logger = LoggerFactory.getLogger(SampleProcessor.class);

    enum Outcome { ACCEPTED, REJECTED, FAILED, TIMED_OUT }

    static final class Result<D, L> {
        private final Outcome outcome;
        private final Sample<D, L> sample;

        private Result(Outcome outcome, Sample<D, L> sample) {
            this.outcome = outcome;
            this.sample = sample;
        }

        Outcome outcome() {
            return outcome;
        }

        Sample<D, L> sample() {
            return sample;
        }

        boolean isAccepted() {
            return outcome == Outcome.ACCEPTED;
        }
    }

    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int DROPPED = 2;
    private static final int DONE = 3;

    private final ControllerChain<D, L> chain;
    private final Long timeoutMs;
    private final ThreadPoolExecutor deadlineExecutor;
    private final PipelineMetrics metrics;
    private final boolean verboseFailures;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    SampleProcessor(ControllerChain<D, L> chain, Long timeoutMs, ThreadPoolExecutor deadlineExecutor,
                    Verbosity verbosity, PipelineMetrics metrics) {
        if (timeoutMs != null && deadlineExecutor == null) {
            throw new IllegalArgumentException("A sample timeout needs an executor to run on");
        }
        this.chain = chain;
        this.timeoutMs = timeoutMs;
        this.deadlineExecutor = deadlineExecutor;
        this.metrics = metrics;
        this.verboseFailures = verbosity == Verbosity.DEBUG || verbosity == Verbosity.TRACE;
    }

    /**
     * Fixed pool of {@code threads} daemon threads with a hand-off queue of the same size:
     * each caller has at most one task waiting, so the queue never fills in normal use.
     */
    static ThreadPoolExecutor newDeadlineExecutor(String name, int threads) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(threads),
                r -> {
                    Thread t = new Thread(r, "dsflow-" + name + "-sample-" + seq.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    Result<D, L> process(Entity<D, L> entity) {
        Result<D, L> r = timeoutMs == null ? processNow(entity) : processWithDeadline(entity);
        metrics.record(r.outcome());
        return r;
    }

    private Result<D, L> processWithDeadline(Entity<D, L> entity) {
        String id = entity.getUniqueId();
        if (!inFlight.add(id)) {
            logger.debug("Entity {} still has an abandoned sample task running, skipping it", id);
            return new Result<>(Outcome.TIMED_OUT, null);
        }
        Attempt attempt = new Attempt(entity);
        Future<Result<D, L>> f;
        try {
            f = deadlineExecutor.submit(attempt);
        } catch (RejectedExecutionException e) {
            // shut down (source closing) or every thread is held by an abandoned task
            inFlight.remove(id);
            return new Result<>(Outcome.FAILED, null);
        }
        try {
            return f.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(attempt, f);
            logger.debug("Sample for entity {} exceeded {} ms, dropping it", id, timeoutMs);
            return new Result<>(Outcome.TIMED_OUT, null);
        } catch (InterruptedException e) {
            abandon(attempt, f);
            Thread.currentThread().interrupt();
            return new Result<>(Outcome.FAILED, null);
        } catch (ExecutionException e) {
            logFailure(id, e.getCause());
            return new Result<>(Outcome.FAILED, null);
        }
    }

    private void abandon(Attempt attempt, Future<?> f) {
        f.cancel(true);
        if (f instanceof Runnable) {
            deadlineExecutor.remove((Runnable) f);
        }
        if (attempt.state.compareAndSet(PENDING, DROPPED)) {
            inFlight.remove(attempt.entity.getUniqueId());
        } else if (attempt.state.get() == RUNNING) {
            // the task clears its own in-flight mark when it finally returns
            metrics.markAbandoned();
        }
    }

    private Result<D, L> processNow(Entity<D, L> entity) {
        try {
            Sample<D, L> raw = entity.getSample();
            Optional<Sample<D, L>> controlled = chain.apply(raw);
            return controlled
                    .map(s -> new Result<>(Outcome.ACCEPTED, s))
                    .orElseGet(() -> new Result<>(Outcome.REJECTED, null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Result<>(Outcome.FAILED, null);
        } catch (Exception e) {
            logFailure(entity.getUniqueId(), e);
            return new Result<>(Outcome.FAILED, null);
        }
    }

    private void logFailure(String id, Throwable t) {
        if (verboseFailures) {
            logger.warn("Controller or sample failure for entity {}", id, t);
        } else {
            logger.debug("Controller or sample failure for entity {}: {}", id, String.valueOf(t));
        }
    }

    int inFlight() {
        return inFlight.size();
    }

    private final class Attempt implements Callable<Result<D, L>> {
        private final Entity<D, L> entity;
        private final AtomicInteger state = new AtomicInteger(PENDING);

        Attempt(Entity<D, L> entity) {
            this.entity = entity;
        }

        @Override
        public Result<D, L> call() {
            if (!state.compareAndSet(PENDING, RUNNING)) {
                return new Result<>(Outcome.FAILED, null);
            }
            try {
                return processNow(entity);
            } finally {
                state.set(DONE);
                inFlight.remove(entity.getUniqueId());
            }
        }
    }
}
