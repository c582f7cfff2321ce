package com.dsflow.datasource;

import com.dsflow.common.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Weighted union of data sources. Each member contributes samples in proportion to its
 * entity count, drawn independently for every slot of a batch.
 *
 * <p>Immutable: combining with another source always yields a new union. Member order has
 * no effect on sampling.
 */
public class DataSourceUnion<D, L> implements BatchSource<D, L> {
    private static final Logger logger = LoggerFactory.getLogger(DataSourceUnion.class);

    private final List<DataSource<D, L>> members;
    private final Random random;

    public DataSourceUnion(List<DataSource<D, L>> members) {
        this(members, new Random());
    }

    public DataSourceUnion(List<DataSource<D, L>> members, Random random) {
        Objects.requireNonNull(members, "members");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one data source");
        }
        Set<DataSource<D, L>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (DataSource<D, L> m : members) {
            Objects.requireNonNull(m, "member");
            if (!seen.add(m)) {
                throw new IllegalArgumentException("Data source '" + m.getName() + "' appears twice in the union");
            }
        }
        this.members = List.copyOf(members);
        this.random = Objects.requireNonNull(random, "random");
        logger.info("Union of {} data sources, {} entities in total", members.size(), size());
    }

    public List<DataSource<D, L>> getMembers() {
        return members;
    }

    /** Share of samples expected from {@code member}. */
    public double weightOf(DataSource<D, L> member) {
        if (!members.contains(member)) return 0.0;
        return (double) member.size() / size();
    }

    @Override
    public int size() {
        int total = 0;
        for (DataSource<D, L> m : members) total += m.size();
        return total;
    }

    @Override
    public Batch<D, L> next() {
        return next(members.get(0).getBatchSize());
    }

    @Override
    public Batch<D, L> next(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        int[] counts = drawCounts(batchSize);
        List<Sample<D, L>> samples = new ArrayList<>(batchSize);
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] > 0) {
                samples.addAll(members.get(i).nextSamples(counts[i]));
            }
        }
        Collections.shuffle(samples, random);
        return Batch.of(samples, members.get(0).getConfig().isConvertBatchToDense());
    }

    /** Multinomial draw of how many slots each member fills. */
    int[] drawCounts(int batchSize) {
        int[] sizes = new int[members.size()];
        long total = 0;
        for (int i = 0; i < sizes.length; i++) {
            sizes[i] = members.get(i).size();
            total += sizes[i];
        }
        int[] counts = new int[sizes.length];
        for (int slot = 0; slot < batchSize; slot++) {
            long pick = (long) (random.nextDouble() * total);
            int i = 0;
            while (pick >= sizes[i]) {
                pick -= sizes[i];
                i++;
            }
            counts[i]++;
        }
        return counts;
    }

    @Override
    public DataSourceUnion<D, L> plus(BatchSource<D, L> other) {
        List<DataSource<D, L>> combined = new ArrayList<>(members);
        if (other instanceof DataSource) {
            combined.add((DataSource<D, L>) other);
        } else if (other instanceof DataSourceUnion) {
            combined.addAll(((DataSourceUnion<D, L>) other).members);
        } else {
            throw new IllegalArgumentException("Can only combine DataSource or DataSourceUnion objects, got " +
                    (other == null ? "null" : other.getClass().getName()));
        }
        return new DataSourceUnion<>(combined, random);
    }

    /** Closes every member. */
    @Override
    public void close() {
        for (DataSource<D, L> m : members) {
            m.close();
        }
    }
}
