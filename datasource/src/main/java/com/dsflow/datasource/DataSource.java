package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.common.MemoryMonitor;
import com.dsflow.common.RuntimeMemoryMonitor;
import com.dsflow.common.Sample;
import com.dsflow.config.DataSourceConfig;
import com.dsflow.loader.Retrieval;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a retrieval into an endless stream of fixed-size batches.
 *
 * <p>Construction loads (or restores from cache) the entities, shuffles them, applies the
 * prefilters and, with more than one worker, starts a background pipeline of one filler and
 * {@code workers} sample workers. {@link #next()} blocks until a full batch is available.
 *
 * <p>Meant for a single consumer thread. {@link #close()} may be called from any thread and
 * stops every background unit.
 */
public class DataSource<D, L> implements BatchSource<D, L>, Iterator<Batch<D, L>> {
    private static final Logger logger = LoggerFactory.getLogger(DataSource.class);

    private static final AtomicInteger UNNAMED = new AtomicInteger();

    private final Settings<D, L> settings;
    private final DataSourceConfig config;
    private final Random random;
    private final PipelineMetrics metrics;
    private final EntityStore<D, L> store;
    private final SampleProcessor<D, L> processor;
    private final MemoryPressurePolicy memoryPolicy;
    private final ThreadPoolExecutor timeoutExecutor;

    private volatile List<Entity<D, L>> members;
    private SamplePipeline<D, L> pipeline;
    private volatile BatchAssembler<D, L> assembler;
    private volatile boolean closed;

    public static <D, L> Builder<D, L> builder(EntityFactory<D, L> entityFactory) {
        return new Builder<>(entityFactory);
    }

    private DataSource(Settings<D, L> settings, List<Entity<D, L>> preloaded) throws IOException {
        this.settings = settings;
        this.config = settings.config;
        this.random = settings.random;

        List<Entity<D, L>> entities = preloaded != null
                ? preloaded
                : EntityLoader.load(settings.retrieval, settings.entityFactory, config.isIgnoreCache(),
                config.getVerbosity());
        this.store = new EntityStore<>(entities, random);
        store.shuffle();
        if (preloaded == null) {
            PrefilterStage.apply(store, settings.prefilters);
        }
        if (store.isEmpty()) {
            throw new IllegalStateException("Cannot initialize an empty data source");
        }
        this.members = store.snapshot();

        this.metrics = new PipelineMetrics(settings.registry, settings.name);
        store.onEpoch(metrics::epoch);
        this.memoryPolicy = new MemoryPressurePolicy(config.getMaxMemPercent(), settings.memoryMonitor, metrics);
        this.timeoutExecutor = config.getTimeoutMs() == null
                ? null
                : SampleProcessor.newDeadlineExecutor(settings.name, config.getWorkers());
        this.processor = new SampleProcessor<>(
                new ControllerChain<>(settings.controllers, random), config.getTimeoutMs(), timeoutExecutor,
                config.getVerbosity(), metrics);

        if (config.isMultiWorker()) {
            startPipeline();
        } else {
            this.assembler = new BatchAssembler.Inline<>(store, processor, memoryPolicy, config.getMaxRejectedAttempts());
        }
        logger.info("Data source '{}' ready with {} entities ({})", settings.name, store.size(), config);
    }

    private void startPipeline() {
        pipeline = new SamplePipeline<>(store, processor, config.getWorkers(), config.effectiveQueueSize(), settings.name);
        assembler = new BatchAssembler.Queued<>(pipeline, memoryPolicy, config.getStallTimeoutMs());
        pipeline.start();
    }

    /* ======================== Batches ======================== */

    @Override
    public Batch<D, L> next() {
        return next(config.getBatchSize());
    }

    /**
     * Assembles one batch of {@code batchSize} samples, overriding the configured size.
     *
     * @throws BatchStallException if the batch cannot be filled within the configured bounds
     * @throws IllegalStateException if the source is closed, or dense conversion is on and a
     *                               column is not numeric
     */
    @Override
    public Batch<D, L> next(int batchSize) {
        List<Sample<D, L>> samples = nextSamples(batchSize);
        return Batch.of(samples, config.isConvertBatchToDense());
    }

    List<Sample<D, L>> nextSamples(int batchSize) {
        checkOpen();
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        long t0 = System.nanoTime();
        List<Sample<D, L>> samples = assembler.assemble(batchSize);
        metrics.batchTimer().record(System.nanoTime() - t0, TimeUnit.NANOSECONDS);
        return samples;
    }

    /** Always true while open: the source cycles forever. */
    @Override
    public boolean hasNext() {
        return !closed;
    }

    /* ======================== Ids ======================== */

    @Override
    public int size() {
        return members.size();
    }

    public List<String> getEntityIds() {
        List<String> ids = new ArrayList<>(members.size());
        for (Entity<D, L> e : members) ids.add(e.getUniqueId());
        return ids;
    }

    /** Writes one entity id per line, UTF-8. */
    public void saveIds(Path path) throws IOException {
        Files.writeString(path, String.join("\n", getEntityIds()), StandardCharsets.UTF_8);
        logger.info("Saved {} ids to {}", members.size(), path);
    }

    /**
     * Keeps only the entities whose id is in {@code ids}. A running pipeline is restarted so
     * nothing filtered out is emitted afterwards.
     *
     * @throws IllegalStateException if no entity would remain
     */
    public synchronized void filterIds(Collection<String> ids) {
        checkOpen();
        Set<String> keep = new HashSet<>(ids);
        long remaining = members.stream().filter(e -> keep.contains(e.getUniqueId())).count();
        if (remaining == 0) {
            throw new IllegalStateException("Filtering by id list would leave the data source empty");
        }

        boolean restart = pipeline != null;
        if (restart) {
            pipeline.stop();
        }
        logger.info("Filtering by id list. Size pre-filter is {}", store.size());
        store.retain(e -> keep.contains(e.getUniqueId()));
        logger.info("Done filtering. Size post-filter is {}", store.size());
        members = store.snapshot();
        if (restart) {
            startPipeline();
        }
    }

    /** Reads an id list written by {@link #saveIds(Path)} and filters by it. */
    public void filterIds(Path idFile) throws IOException {
        List<String> ids = new ArrayList<>();
        for (String line : Files.readAllLines(idFile, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) ids.add(line.trim());
        }
        filterIds(ids);
    }

    /* ======================== Composition ======================== */

    /**
     * Splits {@code source} into two fresh sources over disjoint slices of its shuffled
     * entities. The first holds {@code floor(size * percent)} entities. {@code source} is
     * closed: its entities now belong to the two halves.
     *
     * @throws IllegalArgumentException if percent is outside [0, 1] or a half would be empty
     */
    public static <D, L> SplitResult<D, L> split(DataSource<D, L> source, double percent) {
        Objects.requireNonNull(source, "source");
        if (!(percent >= 0.0 && percent <= 1.0)) {
            throw new IllegalArgumentException("split percent must be in [0, 1], got " + percent);
        }
        source.checkOpen();
        logger.warn("Splitting a single data source may correlate the halves " +
                "(e.g. samples sharing provenance), which can bias evaluation.");

        List<Entity<D, L>> all = new ArrayList<>(source.members);
        Collections.shuffle(all, source.random);
        int breakOff = (int) Math.floor(all.size() * percent);
        if (breakOff == 0 || breakOff == all.size()) {
            throw new IllegalArgumentException("Splitting " + all.size() + " entities at " + percent +
                    " leaves one side empty");
        }

        source.close();
        try {
            DataSource<D, L> first = new DataSource<>(source.settings.derive("-a"),
                    new ArrayList<>(all.subList(0, breakOff)));
            DataSource<D, L> second = new DataSource<>(source.settings.derive("-b"),
                    new ArrayList<>(all.subList(breakOff, all.size())));
            return new SplitResult<>(first, second);
        } catch (IOException e) {
            // preloaded construction never touches the retrieval
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public DataSourceUnion<D, L> plus(BatchSource<D, L> other) {
        if (other instanceof DataSource) {
            return new DataSourceUnion<>(List.of(this, (DataSource<D, L>) other));
        }
        if (other instanceof DataSourceUnion) {
            return ((DataSourceUnion<D, L>) other).plus(this);
        }
        throw new IllegalArgumentException("Can only combine DataSource or DataSourceUnion objects, got " +
                (other == null ? "null" : other.getClass().getName()));
    }

    /* ======================== Lifecycle ======================== */

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (pipeline != null) {
            pipeline.stop();
        }
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
        logger.info("Closed data source '{}'", settings.name);
    }

    public boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Data source '" + settings.name + "' is closed");
        }
    }

    /* ======================== Accessors ======================== */

    public String getName() {
        return settings.name;
    }

    public int getBatchSize() {
        return config.getBatchSize();
    }

    public DataSourceConfig getConfig() {
        return config;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    /** Completed cyclic scans so far. */
    public long getEpoch() {
        return store.epoch();
    }

    SampleProcessor<D, L> processor() {
        return processor;
    }

    List<Entity<D, L>> members() {
        return members;
    }

    /* ======================== Construction ======================== */

    /** Everything a source needs besides its entities; shared by split halves. */
    private static final class Settings<D, L> {
        final String name;
        final EntityFactory<D, L> entityFactory;
        final Retrieval<D, L> retrieval;
        final List<ControllerStage<D, L>> controllers;
        final List<Prefilter<D, L>> prefilters;
        final DataSourceConfig config;
        final MeterRegistry registry;
        final MemoryMonitor memoryMonitor;
        final Random random;

        Settings(String name, EntityFactory<D, L> entityFactory, Retrieval<D, L> retrieval,
                 List<ControllerStage<D, L>> controllers, List<Prefilter<D, L>> prefilters,
                 DataSourceConfig config, MeterRegistry registry, MemoryMonitor memoryMonitor, Random random) {
            this.name = name;
            this.entityFactory = entityFactory;
            this.retrieval = retrieval;
            this.controllers = List.copyOf(controllers);
            this.prefilters = List.copyOf(prefilters);
            this.config = config;
            this.registry = registry;
            this.memoryMonitor = memoryMonitor;
            this.random = random;
        }

        Settings<D, L> derive(String suffix) {
            return new Settings<>(name + suffix, entityFactory, retrieval, controllers, prefilters,
                    config.copy(), registry, memoryMonitor, new Random(random.nextLong()));
        }
    }

    public static final class Builder<D, L> {
        private final EntityFactory<D, L> entityFactory;
        private Retrieval<D, L> retrieval;
        private final List<ControllerStage<D, L>> controllers = new ArrayList<>();
        private final List<Prefilter<D, L>> prefilters = new ArrayList<>();
        private DataSourceConfig config = new DataSourceConfig();
        private MeterRegistry registry;
        private MemoryMonitor memoryMonitor;
        private Random random;
        private String name;

        private Builder(EntityFactory<D, L> entityFactory) {
            if (entityFactory == null) {
                throw new IllegalArgumentException("An entity factory is required");
            }
            this.entityFactory = entityFactory;
        }

        /** Optional; without it the source holds one synthetic entity. */
        public Builder<D, L> retrieval(Retrieval<D, L> retrieval) {
            this.retrieval = retrieval;
            return this;
        }

        public Builder<D, L> controller(Controller<D, L> controller) {
            controllers.add(ControllerStage.single(controller));
            return this;
        }

        public Builder<D, L> controllers(List<? extends Controller<D, L>> list) {
            if (list == null) {
                throw new IllegalArgumentException("Controllers must be given as a list");
            }
            for (Controller<D, L> c : list) controller(c);
            return this;
        }

        /** Adds a stage that applies one of {@code alternatives}, chosen at random per sample. */
        public Builder<D, L> oneOf(List<? extends Controller<D, L>> alternatives) {
            controllers.add(ControllerStage.oneOf(alternatives));
            return this;
        }

        public Builder<D, L> stage(ControllerStage<D, L> stage) {
            controllers.add(Objects.requireNonNull(stage, "stage"));
            return this;
        }

        public Builder<D, L> prefilter(Prefilter<D, L> prefilter) {
            prefilters.add(Objects.requireNonNull(prefilter, "prefilter"));
            return this;
        }

        public Builder<D, L> prefilters(List<? extends Prefilter<D, L>> list) {
            if (list == null) {
                throw new IllegalArgumentException("Prefilters must be given as a list");
            }
            for (Prefilter<D, L> p : list) prefilter(p);
            return this;
        }

        public Builder<D, L> config(DataSourceConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder<D, L> meterRegistry(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder<D, L> memoryMonitor(MemoryMonitor monitor) {
            this.memoryMonitor = monitor;
            return this;
        }

        public Builder<D, L> random(Random random) {
            this.random = random;
            return this;
        }

        /**
         * Thread-name prefix and {@code source} tag of the metrics. Sources sharing a registry
         * need distinct names; unnamed sources get {@code datasource-N}.
         */
        public Builder<D, L> name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * @throws IllegalArgumentException on invalid configuration
         * @throws IllegalStateException if no entity survives loading and prefiltering
         * @throws IOException if the retrieval cannot be listed, read or cached
         */
        public DataSource<D, L> build() throws IOException {
            config.validate();
            Random r = random != null ? random
                    : config.getSeed() != null ? new Random(config.getSeed()) : new Random();
            String sourceName = name != null ? name : "datasource-" + UNNAMED.incrementAndGet();
            Settings<D, L> s = new Settings<>(sourceName, entityFactory, retrieval, controllers, prefilters,
                    config,
                    registry != null ? registry : new SimpleMeterRegistry(),
                    memoryMonitor != null ? memoryMonitor : new RuntimeMemoryMonitor(),
                    r);
            return new DataSource<>(s, null);
        }
    }
}
