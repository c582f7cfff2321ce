package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.loader.Retrieval;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Fixtures: integer-id entities whose data is {@code {i, 2i}} and whose label is {@code i % 3}. */
final class TestEntities {

    static final EntityFactory<double[], Integer> FACTORY = (id, retrieval, verbosity) -> new NumberEntity(id);

    private TestEntities() {}

    static final class NumberEntity extends Entity<double[], Integer> {
        final AtomicInteger loads = new AtomicInteger();

        NumberEntity(String id) {
            super(id);
        }

        int value() {
            return Integer.parseInt(getUniqueId());
        }

        @Override
        public Integer getLabel() {
            return value() % 3;
        }

        @Override
        protected double[] loadData() {
            loads.incrementAndGet();
            return new double[]{value(), 2.0 * value()};
        }
    }

    /** Retrieval over ids "0".."n-1" that never has a cache. */
    static final class RangeRetrieval implements Retrieval<double[], Integer> {
        private final int n;
        int cacheCalls;

        RangeRetrieval(int n) {
            this.n = n;
        }

        @Override
        public List<String> list() {
            List<String> ids = new ArrayList<>(n);
            for (int i = 0; i < n; i++) ids.add(String.valueOf(i));
            return ids;
        }

        @Override
        public boolean isCached() {
            return false;
        }

        @Override
        public List<Entity<double[], Integer>> loadFromCache() {
            throw new UnsupportedOperationException("no cache");
        }

        @Override
        public void cache(List<? extends Entity<double[], Integer>> entities) {
            cacheCalls++;
        }
    }

    static List<Entity<double[], Integer>> entities(int n) {
        List<Entity<double[], Integer>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(new NumberEntity(String.valueOf(i)));
        return out;
    }

    static DataSource.Builder<double[], Integer> builder(int n) {
        return DataSource.builder(FACTORY).retrieval(new RangeRetrieval(n));
    }

    static List<Integer> values(Batch<double[], Integer> batch) {
        List<Integer> out = new ArrayList<>(batch.size());
        for (double[] d : batch.getData()) out.add((int) d[0]);
        return out;
    }
}
