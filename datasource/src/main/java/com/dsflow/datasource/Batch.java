package com.dsflow.datasource;

import com.dsflow.common.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A full batch as two parallel columns, optionally also as dense matrices.
 */
public final class Batch<D, L> {
    private final List<D> data;
    private final List<L> labels;
    private final double[][] denseData;
    private final double[][] denseLabels;

    private Batch(List<D> data, List<L> labels, double[][] denseData, double[][] denseLabels) {
        this.data = data;
        this.labels = labels;
        this.denseData = denseData;
        this.denseLabels = denseLabels;
    }

    static <D, L> Batch<D, L> of(List<Sample<D, L>> samples, boolean dense) {
        List<D> data = new ArrayList<>(samples.size());
        List<L> labels = new ArrayList<>(samples.size());
        for (Sample<D, L> s : samples) {
            data.add(s.getData());
            labels.add(s.getLabel());
        }
        double[][] dd = dense ? DenseArrays.toMatrix(data, "data") : null;
        double[][] dl = dense ? DenseArrays.toMatrix(labels, "labels") : null;
        return new Batch<>(Collections.unmodifiableList(data), Collections.unmodifiableList(labels), dd, dl);
    }

    public List<D> getData() {
        return data;
    }

    public List<L> getLabels() {
        return labels;
    }

    public int size() {
        return data.size();
    }

    public boolean isDense() {
        return denseData != null;
    }

    /** @throws IllegalStateException if the batch was not converted */
    public double[][] getDenseData() {
        if (denseData == null) throw new IllegalStateException("Batch was not converted to dense arrays");
        return denseData;
    }

    /** @throws IllegalStateException if the batch was not converted */
    public double[][] getDenseLabels() {
        if (denseLabels == null) throw new IllegalStateException("Batch was not converted to dense arrays");
        return denseLabels;
    }
}
