package com.dsflow.common;

import java.util.Arrays;
import java.util.Objects;

/**
 * One (data, label) pair produced by an {@link Entity}.
 * Controllers never mutate a sample; they return a replacement instead.
 */
public final class Sample<D, L> {
    private final D data;
    private final L label;

    public Sample(D data, L label) {
        this.data = data;
        this.label = label;
    }

    public D getData() {
        return data;
    }

    public L getLabel() {
        return label;
    }

    public Sample<D, L> withData(D newData) {
        return new Sample<>(newData, label);
    }

    public Sample<D, L> withLabel(L newLabel) {
        return new Sample<>(data, newLabel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sample)) return false;
        Sample<?, ?> other = (Sample<?, ?>) o;
        return Objects.deepEquals(data, other.data) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new Object[]{data, label});
    }

    @Override
    public String toString() {
        return "Sample{label=" + label + "}";
    }
}
