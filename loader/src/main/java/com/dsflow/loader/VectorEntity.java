package com.dsflow.loader;

import com.dsflow.common.Entity;

import java.io.IOException;

/**
 * One FVECS record. The vector is read on demand through the owning retrieval,
 * which is re-attached after the entity comes back from the cache.
 */
public class VectorEntity extends Entity<double[], Integer> {
    private static final long serialVersionUID = 1L;

    private final long recordIndex;
    private final int label;
    private transient FvecsRetrieval source;

    public VectorEntity(String uniqueId, long recordIndex, int label, FvecsRetrieval source) {
        super(uniqueId);
        this.recordIndex = recordIndex;
        this.label = label;
        this.source = source;
    }

    public long getRecordIndex() {
        return recordIndex;
    }

    @Override
    public Integer getLabel() {
        return label;
    }

    void attach(FvecsRetrieval retrieval) {
        this.source = retrieval;
    }

    @Override
    protected double[] loadData() throws IOException {
        if (source == null) {
            throw new IllegalStateException("Entity " + getUniqueId() + " is detached from its retrieval");
        }
        return source.readVector(recordIndex);
    }
}
