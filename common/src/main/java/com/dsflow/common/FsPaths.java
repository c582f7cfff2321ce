package com.dsflow.common;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FsPaths {
    // ---- property/env keys (used by tests and code) ----
    public static final String BASE_DIR_PROP  = "dsflow.baseDir";
    public static final String BASE_DIR_ENV   = "DSFLOW_BASE_DIR";
    public static final String CACHE_DIR_PROP = "dsflow.cache.dir";

    private FsPaths() {}

    public static Path baseDir() {
        String prop = System.getProperty(BASE_DIR_PROP);
        if (prop == null || prop.isBlank()) {
            String env = System.getenv(BASE_DIR_ENV);
            if (env != null && !env.isBlank()) prop = env;
        }
        Path base = (prop == null || prop.isBlank())
                ? Paths.get(System.getProperty("user.dir"))
                : Paths.get(prop);
        return base.toAbsolutePath().normalize();
    }

    public static Path cacheDir() {
        String rel = System.getProperty(CACHE_DIR_PROP, "cache");
        Path p = Paths.get(rel);
        return p.isAbsolute() ? p.normalize() : baseDir().resolve(p).normalize();
    }

    /** Cache file for a named retrieval, e.g. {@code cache/<name>.entities}. */
    public static Path cacheFile(String name) {
        return cacheDir().resolve(name + ".entities");
    }
}
