package com.klrdim.api;

import com.klrdim.config.KlrConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Loads a {@link KlrConfig} for the entry point and records where it came
 * from (real path and SHA-256 of the file). Set {@code -Dconfig.refresh=true}
 * to bypass the cache.
 */
public class ApiConfig {
    private static final Logger logger = LoggerFactory.getLogger(ApiConfig.class);
    private static final ConcurrentMap<String, KlrConfig> configCache = new ConcurrentHashMap<>();

    private final KlrConfig config;
    private final String resolvedPath;
    private final String sha256;

    public ApiConfig(String configFilePath) throws IOException {
        Objects.requireNonNull(configFilePath, "Config file path cannot be null");
        Path path = Paths.get(configFilePath).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            logger.error("Config file is not readable: {}", configFilePath);
            throw new IOException("Config file is not readable: " + configFilePath);
        }

        String resolved;
        try {
            resolved = path.toRealPath(LinkOption.NOFOLLOW_LINKS).toString();
        } catch (IOException e) {
            resolved = path.toString();
            logger.debug("toRealPath failed for {} (using normalized path): {}", path, e.toString());
        }
        this.resolvedPath = resolved;
        this.sha256 = computeSha256(resolved);

        boolean refresh = Boolean.getBoolean("config.refresh");
        if (!refresh) {
            KlrConfig cached = configCache.get(resolved);
            if (cached != null) {
                logger.debug("Returning cached configuration for: {}", resolved);
                this.config = cached;
                return;
            }
        }

        try {
            logger.info("{} configuration from: {}", refresh ? "Reloading" : "Loading", resolved);
            this.config = KlrConfig.load(resolved, refresh);
            configCache.put(resolved, this.config);
        } catch (KlrConfig.ConfigLoadException e) {
            logger.error("Failed to load configuration: {}", configFilePath, e);
            throw new IOException("Failed to load configuration: " + configFilePath, e);
        }
    }

    public KlrConfig getConfig() {
        return config;
    }

    public String getResolvedPath() {
        return resolvedPath;
    }

    /** Hex SHA-256 of the file as read. */
    public String getSha256() {
        return sha256;
    }

    public static void clearCache() {
        configCache.clear();
        KlrConfig.clearCache();
    }

    private static String computeSha256(String p) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(p))) {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) > 0) md.update(buf, 0, r);
            StringBuilder sb = new StringBuilder(64);
            for (byte b : md.digest()) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
