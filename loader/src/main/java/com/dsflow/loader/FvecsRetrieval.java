package com.dsflow.loader;

import com.dsflow.common.Entity;
import com.dsflow.common.FsPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Retrieval over an FVECS vector file with optional per-vector labels from an IVECS file.
 * Identifiers are record indices; a vector without a label gets {@code -1}.
 */
public class FvecsRetrieval extends FileCachingRetrieval<double[], Integer> {
    private static final Logger logger = LoggerFactory.getLogger(FvecsRetrieval.class);

    public static final int NO_LABEL = -1;

    private final Path vectors;
    private final int[] labels;
    private final FvecsLoader fvecs = new FvecsLoader();

    public FvecsRetrieval(Path vectors, Path labelFile) throws IOException {
        this(vectors, labelFile, FsPaths.cacheFile(baseName(vectors)));
    }

    public FvecsRetrieval(Path vectors, Path labelFile, Path cacheFile) throws IOException {
        super(cacheFile);
        this.vectors = Objects.requireNonNull(vectors, "vectors").toAbsolutePath().normalize();
        if (!Files.isRegularFile(this.vectors)) {
            throw new IOException("Vector file not found: " + this.vectors);
        }
        long records = fvecs.countRecords(this.vectors);
        if (labelFile != null) {
            this.labels = new IvecsLoader().loadFirstColumn(labelFile);
            if (labels.length < records) {
                throw new IOException("Label file " + labelFile + " has " + labels.length +
                        " rows but " + this.vectors + " has " + records + " vectors");
            }
        } else {
            this.labels = null;
        }
        logger.info("FvecsRetrieval over {} ({} records, labels={})",
                this.vectors, records, labelFile != null);
    }

    @Override
    public List<String> list() throws IOException {
        long n = fvecs.countRecords(vectors);
        List<String> ids = new ArrayList<>((int) n);
        for (long i = 0; i < n; i++) {
            ids.add(Long.toString(i));
        }
        return ids;
    }

    /** Builds the entity for one identifier returned by {@link #list()}. */
    public VectorEntity createEntity(String id) {
        long index = Long.parseLong(id);
        return new VectorEntity(id, index, labelAt(index), this);
    }

    double[] readVector(long index) throws IOException {
        return fvecs.readRecord(vectors, index);
    }

    private int labelAt(long index) {
        if (labels == null || index >= labels.length) return NO_LABEL;
        return labels[(int) index];
    }

    @Override
    protected Set<String> cachedEntityClasses() {
        return Set.of(VectorEntity.class.getName());
    }

    @Override
    protected void attach(Entity<double[], Integer> entity) {
        if (entity instanceof VectorEntity) {
            ((VectorEntity) entity).attach(this);
        }
    }

    private static String baseName(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
