package com.dsflow.datasource;

/** The two halves produced by {@link DataSource#split(DataSource, double)}. */
public record SplitResult<D, L>(DataSource<D, L> first, DataSource<D, L> second) {
}
