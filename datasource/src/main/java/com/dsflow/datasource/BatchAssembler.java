package com.dsflow.datasource;

import com.dsflow.common.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects accepted samples until a batch is full. Never returns a short batch; gives up with
 * {@link BatchStallException} instead.
 */
abstract class BatchAssembler<D, L> {
    private final MemoryPressurePolicy memoryPolicy;

    BatchAssembler(MemoryPressurePolicy memoryPolicy) {
        this.memoryPolicy = memoryPolicy;
    }

    final List<Sample<D, L>> assemble(int batchSize) {
        List<Sample<D, L>> batch = new ArrayList<>(batchSize);
        while (batch.size() < batchSize) {
            ProcessedSample<D, L> next = nextAccepted(batch.size(), batchSize);
            batch.add(next.sample());
            memoryPolicy.afterAccept(next.entity());
        }
        return batch;
    }

    /**
     * Blocks until one more sample is accepted.
     *
     * @throws BatchStallException when the mode's stall bound is hit
     */
    abstract ProcessedSample<D, L> nextAccepted(int collected, int requested);

    /**
     * Single-worker mode: fetch and control inline on the caller's thread, advancing the
     * store's cursor directly.
     */
    static final class Inline<D, L> extends BatchAssembler<D, L> {
        private final EntityStore<D, L> store;
        private final SampleProcessor<D, L> processor;
        private final int maxRejectedAttempts;

        Inline(EntityStore<D, L> store, SampleProcessor<D, L> processor,
               MemoryPressurePolicy memoryPolicy, int maxRejectedAttempts) {
            super(memoryPolicy);
            this.store = store;
            this.processor = processor;
            this.maxRejectedAttempts = maxRejectedAttempts;
        }

        @Override
        ProcessedSample<D, L> nextAccepted(int collected, int requested) {
            int attempts = 0;
            while (true) {
                var entity = store.next();
                SampleProcessor.Result<D, L> r = processor.process(entity);
                if (r.isAccepted()) {
                    return new ProcessedSample<>(entity, r.sample());
                }
                if (Thread.currentThread().isInterrupted()) {
                    throw new BatchStallException("Interrupted while assembling a batch", collected, requested);
                }
                if (++attempts >= maxRejectedAttempts) {
                    throw new BatchStallException(attempts + " consecutive samples were rejected or failed " +
                            "(last outcome " + r.outcome() + "); giving up on this batch", collected, requested);
                }
            }
        }
    }

    /**
     * Multi-worker mode: take from the pipeline's sample queue; the filler owns the cursor.
     */
    static final class Queued<D, L> extends BatchAssembler<D, L> {
        private final SamplePipeline<D, L> pipeline;
        private final long stallTimeoutMs;

        Queued(SamplePipeline<D, L> pipeline, MemoryPressurePolicy memoryPolicy, long stallTimeoutMs) {
            super(memoryPolicy);
            this.pipeline = pipeline;
            this.stallTimeoutMs = stallTimeoutMs;
        }

        @Override
        ProcessedSample<D, L> nextAccepted(int collected, int requested) {
            ProcessedSample<D, L> ps;
            try {
                ps = pipeline.poll(stallTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchStallException("Interrupted while waiting for samples", collected, requested, e);
            }
            if (ps == null) {
                throw new BatchStallException("No sample accepted within " + stallTimeoutMs + " ms", collected, requested);
            }
            return ps;
        }
    }
}
