package com.dsflow.datasource;

import java.util.List;

/**
 * Converts batch columns into rectangular {@code double[][]} matrices.
 * Scalars become rows of length one.
 */
final class DenseArrays {
    private DenseArrays() {}

    static double[][] toMatrix(List<?> column, String what) {
        double[][] out = new double[column.size()][];
        int width = -1;
        for (int i = 0; i < out.length; i++) {
            double[] row = toRow(column.get(i), what, i);
            if (width >= 0 && row.length != width) {
                throw new IllegalStateException("Ragged " + what + ": row " + i + " has length " +
                        row.length + ", expected " + width);
            }
            width = row.length;
            out[i] = row;
        }
        return out;
    }

    private static double[] toRow(Object v, String what, int i) {
        if (v instanceof double[]) {
            return ((double[]) v).clone();
        }
        if (v instanceof float[]) {
            float[] f = (float[]) v;
            double[] d = new double[f.length];
            for (int j = 0; j < f.length; j++) d[j] = f[j];
            return d;
        }
        if (v instanceof int[]) {
            int[] a = (int[]) v;
            double[] d = new double[a.length];
            for (int j = 0; j < a.length; j++) d[j] = a[j];
            return d;
        }
        if (v instanceof long[]) {
            long[] a = (long[]) v;
            double[] d = new double[a.length];
            for (int j = 0; j < a.length; j++) d[j] = a[j];
            return d;
        }
        if (v instanceof Number) {
            return new double[]{((Number) v).doubleValue()};
        }
        if (v instanceof Boolean) {
            return new double[]{((Boolean) v) ? 1.0 : 0.0};
        }
        if (v instanceof List) {
            List<?> l = (List<?>) v;
            double[] d = new double[l.size()];
            for (int j = 0; j < d.length; j++) {
                Object x = l.get(j);
                if (!(x instanceof Number)) {
                    throw notNumeric(what, i, x);
                }
                d[j] = ((Number) x).doubleValue();
            }
            return d;
        }
        throw notNumeric(what, i, v);
    }

    private static IllegalStateException notNumeric(String what, int i, Object v) {
        return new IllegalStateException("Cannot convert " + what + " row " + i + " of type " +
                (v == null ? "null" : v.getClass().getName()) + " to a dense array");
    }
}
