package com.dsflow.common;

import java.io.Serializable;
import java.util.Objects;

/**
 * Addressable unit of raw data that can produce a {@link Sample}.
 *
 * <p>The raw data is loaded lazily on the first {@link #getSample()} call and kept until
 * {@link #evictData()} drops it. The field is volatile because a pipeline worker may load it
 * while the batch assembler evicts it; a lost race only means one extra reload.
 *
 * <p>Subclasses must keep {@link #getLabel()} cheap: prefilters call it for every entity
 * before any raw data is touched.
 */
public abstract class Entity<D, L> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String uniqueId;
    private volatile D data;

    protected Entity(String uniqueId) {
        this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId cannot be null");
    }

    public final String getUniqueId() {
        return uniqueId;
    }

    /** Label known without loading raw data. */
    public abstract L getLabel();

    /** Fetches the raw data from wherever this entity lives. May be slow or remote. */
    protected abstract D loadData() throws Exception;

    /**
     * Materializes one sample, loading the raw data first if it is not cached.
     *
     * @throws Exception whatever {@link #loadData()} raises; callers treat it as a per-sample failure
     */
    public Sample<D, L> getSample() throws Exception {
        D current = data;
        if (current == null) {
            current = loadData();
            data = current;
        }
        return new Sample<>(current, getLabel());
    }

    public boolean isDataLoaded() {
        return data != null;
    }

    /** Releases the cached raw data. Samples already produced keep their own reference. */
    public void evictData() {
        data = null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + uniqueId + "}";
    }
}
