package com.aiv.organizer.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Central entry point for resolving engine settings: bundled defaults from
 * {@code organizer.properties}, overridden by JVM system properties.
 */
public final class ConfigService {
    static final String RESOURCE_NAME = "organizer.properties";

    static final String KEY_WORKER_MULTIPLIER = "organizer.workers.multiplier";
    static final String KEY_WORKER_CAP = "organizer.workers.cap";
    static final String KEY_CHUNK_BYTES = "organizer.copy.chunkBytes";
    static final String KEY_ERROR_LOG = "organizer.errorLog.path";
    static final String KEY_FAILURE_LOG = "organizer.failureLog.path";
    static final String KEY_JPEG_QUALITY = "organizer.jpeg.quality";

    private static final int DEFAULT_WORKER_MULTIPLIER = 2;
    private static final int DEFAULT_WORKER_CAP = 8;
    private static final int DEFAULT_CHUNK_BYTES = 1024 * 1024;
    private static final String DEFAULT_ERROR_LOG = "logs/error.log";
    private static final String DEFAULT_FAILURE_LOG = "target/organizer-failures.csv";
    private static final float DEFAULT_JPEG_QUALITY = 0.95f;

    private static final ConfigService INSTANCE = new ConfigService(loadBundledDefaults());

    private final Properties defaults;

    ConfigService(Properties defaults) {
        this.defaults = defaults;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Number of worker threads for one batch pool: {@code min(cap, multiplier x cores)}, at least one.
     */
    public int getWorkerPoolSize() {
        return workerPoolSize(Runtime.getRuntime().availableProcessors());
    }

    int workerPoolSize(int availableProcessors) {
        int multiplier = Math.max(1, getInt(KEY_WORKER_MULTIPLIER, DEFAULT_WORKER_MULTIPLIER));
        int cap = Math.max(1, getInt(KEY_WORKER_CAP, DEFAULT_WORKER_CAP));
        return Math.max(1, Math.min(cap, Math.max(1, availableProcessors) * multiplier));
    }

    public int getCopyChunkBytes() {
        return Math.max(1, getInt(KEY_CHUNK_BYTES, DEFAULT_CHUNK_BYTES));
    }

    public Path getErrorLogPath() {
        return Paths.get(getString(KEY_ERROR_LOG, DEFAULT_ERROR_LOG));
    }

    public Path getFailureLogPath() {
        return Paths.get(getString(KEY_FAILURE_LOG, DEFAULT_FAILURE_LOG));
    }

    public float getJpegQuality() {
        String raw = getString(KEY_JPEG_QUALITY, null);
        if (raw == null) {
            return DEFAULT_JPEG_QUALITY;
        }
        try {
            float quality = Float.parseFloat(raw.trim());
            return Math.max(0f, Math.min(1f, quality));
        } catch (NumberFormatException e) {
            return DEFAULT_JPEG_QUALITY;
        }
    }

    private int getInt(String key, int fallback) {
        String raw = getString(key, null);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private String getString(String key, String fallback) {
        String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override;
        }
        String bundled = defaults.getProperty(key);
        if (bundled != null && !bundled.isBlank()) {
            return bundled;
        }
        return fallback;
    }

    private static Properties loadBundledDefaults() {
        Properties properties = new Properties();
        try (InputStream in = ConfigService.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + RESOURCE_NAME + ": " + e.getMessage());
        }
        return properties;
    }
}
