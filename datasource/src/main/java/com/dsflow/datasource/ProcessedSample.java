package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.common.Sample;

/** An accepted sample together with the entity that produced it. */
final class ProcessedSample<D, L> {
    private final Entity<D, L> entity;
    private final Sample<D, L> sample;

    ProcessedSample(Entity<D, L> entity, Sample<D, L> sample) {
        this.entity = entity;
        this.sample = sample;
    }

    Entity<D, L> entity() {
        return entity;
    }

    Sample<D, L> sample() {
        return sample;
    }
}
