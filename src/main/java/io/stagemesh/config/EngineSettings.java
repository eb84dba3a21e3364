package io.stagemesh.config;

import io.stagemesh.engine.RunOptions;
import io.stagemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@link RunOptions} from a JSON settings file. Every field is optional;
 * missing values take the defaults and values below their minimum are raised to it.
 */
public final class EngineSettings {
    private EngineSettings() {
    }

    public static RunOptions load(Path file) {
        return load(file, RunOptions.defaults());
    }

    public static RunOptions load(Path file, RunOptions defaults) {
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        EngineSettingsFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), EngineSettingsFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read engine settings: " + file, e);
        }
        return fromFile(parsed, defaults);
    }

    static RunOptions fromFile(EngineSettingsFile file, RunOptions defaults) {
        if (file == null) {
            return defaults;
        }
        int concurrency = sanitizeInt(file.globalConcurrency(), defaults.globalConcurrency(), 1);
        long perUnitTimeout = sanitizeLong(file.perUnitTimeoutMs(), defaults.perUnitTimeoutMs(), 0L);
        long wholeRunTimeout = sanitizeLong(file.wholeRunTimeoutMs(), defaults.wholeRunTimeoutMs(), 0L);
        boolean failFast = sanitizeBoolean(file.failFast(), defaults.failFast());
        Set<String> required = sanitizeIds(file.requiredUnitIds(), defaults.requiredUnitIds());
        boolean allowPartial = sanitizeBoolean(file.allowPartialResults(), defaults.allowPartialResults());
        double minRatio = sanitizeRatio(file.minSuccessRatio(), defaults.minSuccessRatio());

        RunOptions.CircuitBreakerSettings breakerDefaults = defaults.circuitBreaker();
        CircuitBreakerSection breaker = file.circuitBreaker();
        RunOptions.CircuitBreakerSettings breakerSettings = breaker == null
                ? breakerDefaults
                : new RunOptions.CircuitBreakerSettings(
                sanitizeInt(breaker.failureThreshold(), breakerDefaults.failureThreshold(), 1),
                sanitizeLong(breaker.resetTimeoutMs(), breakerDefaults.resetTimeoutMs(), 0L)
        );

        RunOptions.RetrySettings retryDefaults = defaults.retry();
        RetrySection retry = file.retry();
        RunOptions.RetrySettings retrySettings = retryDefaults;
        if (retry != null) {
            long baseDelay = sanitizeLong(retry.baseDelayMs(), retryDefaults.baseDelayMs(), 0L);
            long maxDelay = sanitizeLong(retry.maxDelayMs(), retryDefaults.maxDelayMs(), baseDelay);
            if (maxDelay < baseDelay) {
                maxDelay = baseDelay;
            }
            retrySettings = new RunOptions.RetrySettings(
                    sanitizeInt(retry.maxAttempts(), retryDefaults.maxAttempts(), 1),
                    baseDelay,
                    maxDelay,
                    sanitizeRatio(retry.jitterRatio(), retryDefaults.jitterRatio())
            );
        }

        RunOptions.LockSettings lockDefaults = defaults.lock();
        LockSection lock = file.lock();
        RunOptions.LockSettings lockSettings = lock == null
                ? lockDefaults
                : new RunOptions.LockSettings(
                sanitizeLong(lock.ttlMs(), lockDefaults.ttlMs(), 100L),
                sanitizeLong(lock.waitMs(), lockDefaults.waitMs(), 0L)
        );

        return new RunOptions(
                concurrency,
                perUnitTimeout,
                wholeRunTimeout,
                failFast,
                required,
                allowPartial,
                minRatio,
                breakerSettings,
                retrySettings,
                lockSettings,
                sanitizeLong(file.staleClaimMs(), defaults.staleClaimMs(), 1L),
                sanitizeLong(file.foreignPollMs(), defaults.foreignPollMs(), 1L)
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static double sanitizeRatio(Double raw, double fallback) {
        if (raw == null || raw.isNaN() || raw < 0.0 || raw > 1.0) {
            return fallback;
        }
        return raw;
    }

    private static Set<String> sanitizeIds(List<String> raw, Set<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        Set<String> out = new LinkedHashSet<>();
        for (String id : raw) {
            if (id != null && !id.isBlank()) {
                out.add(id.trim());
            }
        }
        return out;
    }

    record EngineSettingsFile(
            Integer globalConcurrency,
            Long perUnitTimeoutMs,
            Long wholeRunTimeoutMs,
            Boolean failFast,
            List<String> requiredUnitIds,
            Boolean allowPartialResults,
            Double minSuccessRatio,
            CircuitBreakerSection circuitBreaker,
            RetrySection retry,
            LockSection lock,
            Long staleClaimMs,
            Long foreignPollMs
    ) {
    }

    record CircuitBreakerSection(Integer failureThreshold, Long resetTimeoutMs) {
    }

    record RetrySection(Integer maxAttempts, Long baseDelayMs, Long maxDelayMs, Double jitterRatio) {
    }

    record LockSection(Long ttlMs, Long waitMs) {
    }
}
