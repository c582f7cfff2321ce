package com.dsflow.datasource;

import com.dsflow.common.Entity;

/**
 * Entity-level predicate applied once at startup. Implementations should only look at
 * the id and the label; raw data is not loaded yet.
 */
@FunctionalInterface
public interface Prefilter<D, L> {
    boolean test(Entity<D, L> entity);
}
