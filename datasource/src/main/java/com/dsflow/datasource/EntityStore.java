package com.dsflow.datasource;

import com.dsflow.common.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Ordered entities plus a cursor for cyclic scanning.
 *
 * <p>Not thread-safe. While a multi-worker pipeline runs, its filler is the only caller of
 * {@link #next()}; in single-worker mode it is the batch assembler on the caller's thread.
 */
public class EntityStore<D, L> {
    private static final Logger logger = LoggerFactory.getLogger(EntityStore.class);

    private final List<Entity<D, L>> entities;
    private final Random random;
    private int cursor;
    private volatile long epoch;
    private Runnable epochListener = () -> { };

    public EntityStore(List<? extends Entity<D, L>> entities, Random random) {
        this.entities = new ArrayList<>(Objects.requireNonNull(entities, "entities"));
        this.random = Objects.requireNonNull(random, "random");
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Returns the entity under the cursor and advances. Reaching the end reshuffles and
     * starts a new epoch, so every entity is handed out once before any repeats.
     */
    public Entity<D, L> next() {
        if (entities.isEmpty()) {
            throw new IllegalStateException("Entity store is empty");
        }
        Entity<D, L> e = entities.get(cursor);
        cursor++;
        if (cursor >= entities.size()) {
            wrapAround();
        }
        return e;
    }

    private void wrapAround() {
        logger.info("Shuffling the data source after {} entities", entities.size());
        Collections.shuffle(entities, random);
        cursor = 0;
        epoch++;
        epochListener.run();
    }

    /** Shuffle without counting an epoch; used once at construction. */
    public void shuffle() {
        Collections.shuffle(entities, random);
        cursor = 0;
    }

    /**
     * Replaces the contents with the entities matching {@code keep}, fully materialized.
     *
     * @return number of entities removed
     */
    public int retain(Predicate<? super Entity<D, L>> keep) {
        List<Entity<D, L>> kept = new ArrayList<>(entities.size());
        for (Entity<D, L> e : entities) {
            if (keep.test(e)) kept.add(e);
        }
        int removed = entities.size() - kept.size();
        entities.clear();
        entities.addAll(kept);
        cursor = 0;
        return removed;
    }

    public int cursor() {
        return cursor;
    }

    /** Completed wraparounds. */
    public long epoch() {
        return epoch;
    }

    public void onEpoch(Runnable listener) {
        this.epochListener = Objects.requireNonNull(listener, "listener");
    }

    /** Copy of the current order. */
    public List<Entity<D, L>> snapshot() {
        return List.copyOf(entities);
    }
}
