package com.dsflow.loader;

import com.dsflow.common.Entity;
import com.dsflow.common.PersistenceUtils;
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
 * Retrieval whose cache is one serialized entity list on disk.
 * Subclasses name the entity classes allowed back in and re-attach transient collaborators.
 */
public abstract class FileCachingRetrieval<D, L> implements Retrieval<D, L> {
    private static final Logger logger = LoggerFactory.getLogger(FileCachingRetrieval.class);

    private final Path cacheFile;

    protected FileCachingRetrieval(Path cacheFile) {
        this.cacheFile = Objects.requireNonNull(cacheFile, "cacheFile").toAbsolutePath().normalize();
    }

    public Path getCacheFile() {
        return cacheFile;
    }

    /** Fully qualified names of the entity classes stored in the cache. */
    protected abstract Set<String> cachedEntityClasses();

    /** Called for every entity read back from the cache. */
    protected void attach(Entity<D, L> entity) {
    }

    @Override
    public boolean isCached() {
        return Files.isRegularFile(cacheFile) && Files.isReadable(cacheFile);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Entity<D, L>> loadFromCache() throws IOException {
        ArrayList<Entity<D, L>> loaded;
        try {
            loaded = PersistenceUtils.loadObject(
                    cacheFile.toString(), baseDir(), ArrayList.class, cachedEntityClasses());
        } catch (ClassNotFoundException e) {
            throw new IOException("Entity cache " + cacheFile + " references a missing class", e);
        }
        for (Entity<D, L> e : loaded) {
            attach(e);
        }
        logger.info("Loaded {} entities from cache {}", loaded.size(), cacheFile);
        return loaded;
    }

    @Override
    public void cache(List<? extends Entity<D, L>> entities) throws IOException {
        PersistenceUtils.saveObject(new ArrayList<>(entities), cacheFile.toString(), baseDir());
        logger.info("Cached {} entities to {}", entities.size(), cacheFile);
    }

    private String baseDir() {
        Path parent = cacheFile.getParent();
        return parent == null ? cacheFile.toString() : parent.toString();
    }
}
