package com.dsflow.loader;

import com.dsflow.common.Entity;

import java.io.IOException;
import java.util.List;

/**
 * Source of entity identifiers and of previously cached entities.
 */
public interface Retrieval<D, L> {
    /**
     * Enumerate every raw item identifier this retrieval can serve.
     *
     * @return identifiers, in the retrieval's natural order
     * @throws IOException when the backing store cannot be listed
     */
    List<String> list() throws IOException;

    /** @return true if {@link #loadFromCache()} would succeed */
    boolean isCached();

    /**
     * Load the fully materialized entity list written by an earlier {@link #cache(List)}.
     *
     * @throws IOException on read errors or a corrupt cache
     */
    List<Entity<D, L>> loadFromCache() throws IOException;

    /**
     * Persist the entities just built from {@link #list()} for future runs.
     *
     * @throws IOException on write errors
     */
    void cache(List<? extends Entity<D, L>> entities) throws IOException;
}
