package com.klrdim.config;

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
 * Configuration for dimension evaluation.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per absolute/real path.
 * - A fresh instance carries the defaults, so a file is optional.
 * - Nested blocks: enumeration, aggregation, output.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KlrConfig {

    private static final long MAX_WITNESSES = 1_000_000_000L;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, KlrConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    /** Verbose default for callers that do not pass the flag explicitly. */
    @JsonProperty("verbose")
    private boolean verbose = false;

    /** Whether MicrometerProfiler should time the evaluation phases. */
    @JsonProperty("profilerEnabled")
    private boolean profilerEnabled = true;

    @JsonProperty("enumeration")
    private EnumerationConfig enumeration = new EnumerationConfig();

    @JsonProperty("aggregation")
    private AggregationConfig aggregation = new AggregationConfig();

    @JsonProperty("output")
    private OutputConfig output = new OutputConfig();

    /* ======================== Static loading API ======================== */

    public static KlrConfig load(String path, boolean refresh) throws ConfigLoadException {
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
            KlrConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        KlrConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), KlrConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse KlrConfig from " + key, e);
        }

        if (cfg.enumeration == null) cfg.enumeration = new EnumerationConfig();
        if (cfg.aggregation == null) cfg.aggregation = new AggregationConfig();
        if (cfg.output == null) cfg.output = new OutputConfig();
        cfg.enumeration.maxWitnesses = clamp(cfg.enumeration.maxWitnesses, 1L, MAX_WITNESSES);

        configCache.put(key, cfg);
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    /* ======================== Getters used by other modules ======================== */

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isProfilerEnabled() {
        return profilerEnabled;
    }

    public EnumerationConfig getEnumeration() {
        return enumeration;
    }

    public AggregationConfig getAggregation() {
        return aggregation;
    }

    public OutputConfig getOutput() {
        return output;
    }

    /* ======================== Nested config types ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnumerationConfig {
        /**
         * Allow swaps of equal-colored base positions separated only by
         * orthogonal colors. When false the base prefix is frozen.
         */
        @JsonProperty("baseTranspositions")
        public boolean baseTranspositions = true;

        /** Refuse calls whose exact witness count exceeds this. */
        @JsonProperty("maxWitnesses")
        public long maxWitnesses = 1_000_000L;

        public boolean isBaseTranspositions() {
            return baseTranspositions;
        }

        public long getMaxWitnesses() {
            return clamp(maxWitnesses, 1L, MAX_WITNESSES);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AggregationConfig {
        /** Pair off witnesses whose contributions are negatives of each other. */
        @JsonProperty("cancelOppositeContributions")
        public boolean cancelOppositeContributions = false;

        public boolean isCancelOppositeContributions() {
            return cancelOppositeContributions;
        }
    }

    /** Output / export behavior. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        @JsonProperty("resultsDir")
        public String resultsDir = "results";

        @JsonProperty("writeCsv")
        public boolean writeCsv = false;

        public String getResultsDir() {
            return (resultsDir == null || resultsDir.isBlank()) ? "results" : resultsDir;
        }

        public boolean isWriteCsv() {
            return writeCsv;
        }
    }

    /* ======================== Helper methods ======================== */

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /* ======================== Exception type ======================== */

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
