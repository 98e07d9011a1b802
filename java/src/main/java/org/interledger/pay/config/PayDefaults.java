package org.interledger.pay.config;

/**
 * Default timeout, retry and probing constants.
 * <p>
 * Used when {@link ProbeSettings} is built without overrides.
 */
public final class PayDefaults {

    // ---- Probing ----
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_SESSION_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_PROBE_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 100L;
    public static final int DEFAULT_MAX_PROBES = 64;
    public static final int DEFAULT_PROBE_THREADS = 16;

    // ---- Rate probe ladder: 10^12 down to 10^0 ----
    public static final int RATE_PROBE_MAX_EXPONENT = 12;

    // ---- Quoting ----
    public static final double DEFAULT_SLIPPAGE = 0.01;

    // ---- Destination resolution ----
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 6_000L;

    // ---- Environment keys ----
    public static final String ENV_PROBE_TIMEOUT_MS = "STREAM_PAY_PROBE_TIMEOUT_MS";
    public static final String ENV_SESSION_TIMEOUT_MS = "STREAM_PAY_SESSION_TIMEOUT_MS";
    public static final String ENV_PROBE_ATTEMPTS = "STREAM_PAY_PROBE_ATTEMPTS";
    public static final String ENV_MAX_PROBES = "STREAM_PAY_MAX_PROBES";
    public static final String ENV_PROBE_THREADS = "STREAM_PAY_PROBE_THREADS";

    private PayDefaults() {
    }
}
