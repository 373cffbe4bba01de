package com.cellactors.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    public static final int DEFAULT_WIDTH = 10;
    public static final int DEFAULT_HEIGHT = 10;
    public static final long DEFAULT_STEP_TIMEOUT_MS = 5_000L;

    private final int width;
    private final int height;
    private final double density;
    private final Long randomSeed;
    private final Path seedFile;
    private final Duration stepTimeout;
    private final int parallelism;

    public AppProperties(Environment environment) {
        this.width = parseInt(environment, "app.width", "LIFE_WIDTH", DEFAULT_WIDTH);
        this.height = parseInt(environment, "app.height", "LIFE_HEIGHT", DEFAULT_HEIGHT);
        this.density = parseDensity(resolveOptional(environment, "app.density", "LIFE_DENSITY"));
        String seedRaw = resolveOptional(environment, "app.random-seed", "LIFE_RANDOM_SEED");
        this.randomSeed = seedRaw == null ? null : parseLong(seedRaw, "LIFE_RANDOM_SEED");
        String seedFileRaw = resolveOptional(environment, "app.seed-file", "LIFE_SEED_FILE");
        this.seedFile = seedFileRaw == null ? null : Path.of(seedFileRaw);
        long timeoutMs = parseLong(environment, "app.step-timeout-ms", "LIFE_STEP_TIMEOUT_MS", DEFAULT_STEP_TIMEOUT_MS);
        if (timeoutMs <= 0) {
            throw new IllegalStateException("LIFE_STEP_TIMEOUT_MS must be positive");
        }
        this.stepTimeout = Duration.ofMillis(timeoutMs);
        this.parallelism = parseInt(environment, "app.parallelism", "LIFE_PARALLELISM",
                Runtime.getRuntime().availableProcessors());
        if (width <= 0 || height <= 0) {
            throw new IllegalStateException("LIFE_WIDTH and LIFE_HEIGHT must be positive");
        }
        if (parallelism <= 0) {
            throw new IllegalStateException("LIFE_PARALLELISM must be positive");
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getDensity() {
        return density;
    }

    public long getRandomSeed() {
        return randomSeed != null ? randomSeed : System.nanoTime();
    }

    public Optional<Path> getSeedFile() {
        return Optional.ofNullable(seedFile);
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public int getParallelism() {
        return parallelism;
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int parseInt(Environment environment, String propertyKey, String envKey, int defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid " + envKey + " value: " + value, ex);
        }
    }

    private long parseLong(Environment environment, String propertyKey, String envKey, long defaultValue) {
        String value = resolveOptional(environment, propertyKey, envKey);
        return value == null ? defaultValue : parseLong(value, envKey);
    }

    private long parseLong(String value, String envKey) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid " + envKey + " value: " + value, ex);
        }
    }

    private double parseDensity(String value) {
        if (value == null) {
            return 0.5d;
        }
        try {
            double density = Double.parseDouble(value);
            if (Double.isNaN(density) || density < 0.0 || density > 1.0) {
                throw new IllegalArgumentException();
            }
            return density;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid LIFE_DENSITY value: " + value, ex);
        }
    }
}
