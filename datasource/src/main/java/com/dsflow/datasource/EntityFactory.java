package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.config.Verbosity;
import com.dsflow.loader.Retrieval;

/**
 * Builds one entity per identifier. {@code retrieval} is null when the data source runs
 * without one, in which case a single synthetic entity with id {@code "0"} is requested.
 * {@code verbosity} is the data source's configured level, for entities that log their own loading.
 */
@FunctionalInterface
public interface EntityFactory<D, L> {
    Entity<D, L> create(String id, Retrieval<D, L> retrieval, Verbosity verbosity) throws Exception;
}
