package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.config.Verbosity;
import com.dsflow.loader.Retrieval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a retrieval into entities: from the retrieval's cache when allowed, otherwise one
 * entity per listed identifier followed by a cache write.
 */
final class EntityLoader {
    private static final Logger logger = LoggerFactory.getLogger(EntityLoader.class);

    static final String SYNTHETIC_ID = "0";

    private EntityLoader() {}

    static <D, L> List<Entity<D, L>> load(Retrieval<D, L> retrieval,
                                          EntityFactory<D, L> factory,
                                          boolean ignoreCache,
                                          Verbosity verbosity) throws IOException {
        List<Entity<D, L>> entities = new ArrayList<>();
        if (retrieval == null) {
            logger.info("Retrieval is not set. Assuming a single synthetic entity.");
            entities.add(create(factory, SYNTHETIC_ID, null, verbosity));
        } else if (!ignoreCache && retrieval.isCached()) {
            entities.addAll(retrieval.loadFromCache());
        } else {
            for (String id : retrieval.list()) {
                entities.add(create(factory, id, retrieval, verbosity));
            }
            retrieval.cache(entities);
        }

        if (entities.isEmpty()) {
            throw new IllegalStateException("Cannot initialize an empty data source");
        }
        logger.debug("Loaded {} entities", entities.size());
        return entities;
    }

    private static <D, L> Entity<D, L> create(EntityFactory<D, L> factory, String id, Retrieval<D, L> retrieval,
                                              Verbosity verbosity) {
        Entity<D, L> e;
        try {
            e = factory.create(id, retrieval, verbosity);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to create entity " + id, ex);
        }
        if (e == null) {
            throw new IllegalStateException("Entity factory returned null for id " + id);
        }
        return e;
    }
}
