package org.interledger.pay.config;

import java.time.Duration;
import java.util.Map;

/** Timeouts, retry and parallelism policy for probing a payment path. */
public final class ProbeSettings {
    public final Duration probeTimeout;
    public final Duration sessionTimeout;
    public final int probeAttempts;
    public final Duration retryBackoff;
    public final int maxProbes;
    public final int probeThreads;

    public ProbeSettings(Duration probeTimeout, Duration sessionTimeout, int probeAttempts,
                         Duration retryBackoff, int maxProbes, int probeThreads) {
        if (probeAttempts < 1 || maxProbes < 1 || probeThreads < 1) {
            throw new IllegalArgumentException("Attempts, probe budget and threads must be positive");
        }
        this.probeTimeout = probeTimeout;
        this.sessionTimeout = sessionTimeout;
        this.probeAttempts = probeAttempts;
        this.retryBackoff = retryBackoff;
        this.maxProbes = maxProbes;
        this.probeThreads = probeThreads;
    }

    public static ProbeSettings defaults() {
        return new ProbeSettings(
                Duration.ofMillis(PayDefaults.DEFAULT_PROBE_TIMEOUT_MS),
                Duration.ofMillis(PayDefaults.DEFAULT_SESSION_TIMEOUT_MS),
                PayDefaults.DEFAULT_PROBE_ATTEMPTS,
                Duration.ofMillis(PayDefaults.DEFAULT_RETRY_BACKOFF_MS),
                PayDefaults.DEFAULT_MAX_PROBES,
                PayDefaults.DEFAULT_PROBE_THREADS);
    }

    public static ProbeSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ProbeSettings fromEnvironment(Map<String, String> env) {
        return new ProbeSettings(
                EnvVars.millis(env, PayDefaults.ENV_PROBE_TIMEOUT_MS,
                        PayDefaults.DEFAULT_PROBE_TIMEOUT_MS, 100L, 120_000L),
                EnvVars.millis(env, PayDefaults.ENV_SESSION_TIMEOUT_MS,
                        PayDefaults.DEFAULT_SESSION_TIMEOUT_MS, 1_000L, 600_000L),
                EnvVars.clamped(env, PayDefaults.ENV_PROBE_ATTEMPTS,
                        PayDefaults.DEFAULT_PROBE_ATTEMPTS, 1, 10),
                Duration.ofMillis(PayDefaults.DEFAULT_RETRY_BACKOFF_MS),
                EnvVars.clamped(env, PayDefaults.ENV_MAX_PROBES,
                        PayDefaults.DEFAULT_MAX_PROBES, 16, 1_000),
                EnvVars.clamped(env, PayDefaults.ENV_PROBE_THREADS,
                        PayDefaults.DEFAULT_PROBE_THREADS, 1, 256));
    }

    public ProbeSettings withProbeTimeout(Duration timeout) {
        return new ProbeSettings(timeout, sessionTimeout, probeAttempts, retryBackoff, maxProbes, probeThreads);
    }

    public ProbeSettings withSessionTimeout(Duration timeout) {
        return new ProbeSettings(probeTimeout, timeout, probeAttempts, retryBackoff, maxProbes, probeThreads);
    }

    public ProbeSettings withRetryBackoff(Duration backoff) {
        return new ProbeSettings(probeTimeout, sessionTimeout, probeAttempts, backoff, maxProbes, probeThreads);
    }

    public ProbeSettings withMaxProbes(int max) {
        return new ProbeSettings(probeTimeout, sessionTimeout, probeAttempts, retryBackoff, max, probeThreads);
    }
}
