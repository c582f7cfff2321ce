package com.dsflow.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Options recognized by a data source.
 *
 * - Loaded from JSON via {@link #load(String, boolean)} and cached per real path,
 *   or built programmatically with the fluent setters.
 * - {@link #validate()} is called by the data source at construction; nothing is clamped
 *   silently, every violation is a configuration error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DataSourceConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, DataSourceConfig> configCache = new ConcurrentHashMap<>();

    @JsonProperty("batchSize")
    @JsonAlias("batch_size")
    private int batchSize = 30;

    /** Per-sample deadline in milliseconds; null disables it. */
    @JsonProperty("timeoutMs")
    @JsonAlias("timeout")
    private Long timeoutMs;

    @JsonProperty("workers")
    private int workers = 1;

    @JsonProperty("queueSize")
    @JsonAlias("queue_size")
    private Integer queueSize;

    @JsonProperty("maxMemPercent")
    @JsonAlias("max_mem_percent")
    private double maxMemPercent = 0.95;

    @JsonProperty("convertBatchToDense")
    @JsonAlias("convert_batch_to_np")
    private boolean convertBatchToDense = true;

    @JsonProperty("ignoreCache")
    @JsonAlias("ignore_cache")
    private boolean ignoreCache = false;

    @JsonProperty("verbosity")
    private Verbosity verbosity = Verbosity.DEBUG;

    /** Consecutive non-accepted samples tolerated in single-worker mode before giving up. */
    @JsonProperty("maxRejectedAttempts")
    private int maxRejectedAttempts = 1000;

    /** How long the assembler waits on an empty sample queue in multi-worker mode. */
    @JsonProperty("stallTimeoutMs")
    private long stallTimeoutMs = 60_000L;

    @JsonProperty("seed")
    private Long seed;

    /* ======================== Static loading API ======================== */

    public static DataSourceConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            try {
                p = p.toRealPath();
            } catch (IOException ignore) {
                // fall back to normalized absolute path
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            DataSourceConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        DataSourceConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), DataSourceConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse DataSourceConfig from " + key, e);
        }

        configCache.put(key, cfg);
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    /**
     * @throws IllegalArgumentException describing the first violated rule
     */
    public DataSourceConfig validate() {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive integer, got " + batchSize);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("Workers must be a positive integer, got " + workers);
        }
        if (queueSize != null && workers == 1) {
            throw new IllegalArgumentException(
                    "queueSize is only applicable to multiple workers. Try limiting memory with maxMemPercent.");
        }
        if (queueSize != null && queueSize <= 0) {
            throw new IllegalArgumentException("queueSize must be positive, got " + queueSize);
        }
        if (!(maxMemPercent > 0.0 && maxMemPercent <= 1.0)) {
            throw new IllegalArgumentException("maxMemPercent must be in (0, 1], got " + maxMemPercent);
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive when set, got " + timeoutMs);
        }
        if (maxRejectedAttempts <= 0) {
            throw new IllegalArgumentException("maxRejectedAttempts must be positive, got " + maxRejectedAttempts);
        }
        if (stallTimeoutMs <= 0) {
            throw new IllegalArgumentException("stallTimeoutMs must be positive, got " + stallTimeoutMs);
        }
        if (verbosity == null) {
            throw new IllegalArgumentException("verbosity cannot be null");
        }
        return this;
    }

    /** Copy used when one source is re-partitioned into several. */
    public DataSourceConfig copy() {
        DataSourceConfig c = new DataSourceConfig();
        c.batchSize = batchSize;
        c.timeoutMs = timeoutMs;
        c.workers = workers;
        c.queueSize = queueSize;
        c.maxMemPercent = maxMemPercent;
        c.convertBatchToDense = convertBatchToDense;
        c.ignoreCache = ignoreCache;
        c.verbosity = verbosity;
        c.maxRejectedAttempts = maxRejectedAttempts;
        c.stallTimeoutMs = stallTimeoutMs;
        c.seed = seed;
        return c;
    }

    /* ======================== Getters ======================== */

    public int getBatchSize() { return batchSize; }
    public Long getTimeoutMs() { return timeoutMs; }
    public int getWorkers() { return workers; }
    public Integer getQueueSize() { return queueSize; }
    public double getMaxMemPercent() { return maxMemPercent; }
    public boolean isConvertBatchToDense() { return convertBatchToDense; }
    public boolean isIgnoreCache() { return ignoreCache; }
    public Verbosity getVerbosity() { return verbosity; }
    public int getMaxRejectedAttempts() { return maxRejectedAttempts; }
    public long getStallTimeoutMs() { return stallTimeoutMs; }
    public Long getSeed() { return seed; }

    public boolean isMultiWorker() {
        return workers > 1;
    }

    /** Capacity of both pipeline queues; twice the batch size when not configured. */
    public int effectiveQueueSize() {
        return queueSize != null ? queueSize : Math.max(1, 2 * batchSize);
    }

    /* ======================== Fluent setters ======================== */

    public DataSourceConfig batchSize(int v) { this.batchSize = v; return this; }
    public DataSourceConfig timeoutMs(Long v) { this.timeoutMs = v; return this; }
    public DataSourceConfig workers(int v) { this.workers = v; return this; }
    public DataSourceConfig queueSize(Integer v) { this.queueSize = v; return this; }
    public DataSourceConfig maxMemPercent(double v) { this.maxMemPercent = v; return this; }
    public DataSourceConfig convertBatchToDense(boolean v) { this.convertBatchToDense = v; return this; }
    public DataSourceConfig ignoreCache(boolean v) { this.ignoreCache = v; return this; }
    public DataSourceConfig verbosity(Verbosity v) { this.verbosity = v; return this; }
    public DataSourceConfig maxRejectedAttempts(int v) { this.maxRejectedAttempts = v; return this; }
    public DataSourceConfig stallTimeoutMs(long v) { this.stallTimeoutMs = v; return this; }
    public DataSourceConfig seed(Long v) { this.seed = v; return this; }

    @Override
    public String toString() {
        return "DataSourceConfig{batchSize=" + batchSize +
                ", workers=" + workers +
                ", queueSize=" + queueSize +
                ", timeoutMs=" + timeoutMs +
                ", maxMemPercent=" + maxMemPercent +
                ", convertBatchToDense=" + convertBatchToDense +
                ", ignoreCache=" + ignoreCache +
                ", verbosity=" + verbosity + '}';
    }

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
