package com.dsflow.datasource;

/**
 * Anything that hands out training batches: a single {@link DataSource} or a
 * {@link DataSourceUnion} of several.
 */
public interface BatchSource<D, L> extends AutoCloseable {

    /** Next batch of the configured size; blocks until it is full. */
    Batch<D, L> next();

    Batch<D, L> next(int batchSize);

    /** Number of entities behind this source. */
    int size();

    /**
     * Weighted union with another source. Neither operand is modified.
     *
     * @throws IllegalArgumentException if {@code other} is not a DataSource or DataSourceUnion
     */
    DataSourceUnion<D, L> plus(BatchSource<D, L> other);

    @Override
    void close();
}
