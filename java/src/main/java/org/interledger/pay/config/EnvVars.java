package org.interledger.pay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Reads numeric {@code STREAM_PAY_*} overrides. Values outside their range are clamped;
 * missing or unparseable values fall back to the default.
 */
final class EnvVars {
    private static final Logger logger = LoggerFactory.getLogger(EnvVars.class);

    private EnvVars() {
    }

    static long clamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not a whole number, using {}", name, raw, defaultValue);
            return defaultValue;
        }
        long bounded = Math.max(min, Math.min(parsed, max));
        if (bounded != parsed) {
            logger.warn("{}={} is outside [{}, {}], using {}", name, parsed, min, max, bounded);
        }
        return bounded;
    }

    static int clamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        return (int) clamped(env, name, (long) defaultValue, min, max);
    }

    static Duration millis(Map<String, String> env, String name, long defaultMillis, long min, long max) {
        return Duration.ofMillis(clamped(env, name, defaultMillis, min, max));
    }
}
