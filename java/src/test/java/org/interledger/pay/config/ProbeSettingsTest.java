package org.interledger.pay.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProbeSettingsTest {

    @Test
    void defaultsMatchPayDefaults() {
        ProbeSettings settings = ProbeSettings.defaults();
        assertEquals(Duration.ofMillis(PayDefaults.DEFAULT_PROBE_TIMEOUT_MS), settings.probeTimeout);
        assertEquals(Duration.ofMillis(PayDefaults.DEFAULT_SESSION_TIMEOUT_MS), settings.sessionTimeout);
        assertEquals(PayDefaults.DEFAULT_PROBE_ATTEMPTS, settings.probeAttempts);
        assertEquals(PayDefaults.DEFAULT_MAX_PROBES, settings.maxProbes);
        assertEquals(PayDefaults.DEFAULT_PROBE_THREADS, settings.probeThreads);
    }

    @Test
    void emptyEnvironmentGivesDefaults() {
        ProbeSettings settings = ProbeSettings.fromEnvironment(Map.of());
        assertEquals(ProbeSettings.defaults().probeTimeout, settings.probeTimeout);
        assertEquals(ProbeSettings.defaults().maxProbes, settings.maxProbes);
    }

    @Test
    void environmentOverridesAreClamped() {
        ProbeSettings settings = ProbeSettings.fromEnvironment(Map.of(
                PayDefaults.ENV_PROBE_TIMEOUT_MS, "2500",
                PayDefaults.ENV_SESSION_TIMEOUT_MS, "5",
                PayDefaults.ENV_PROBE_ATTEMPTS, "99",
                PayDefaults.ENV_MAX_PROBES, "not-a-number",
                PayDefaults.ENV_PROBE_THREADS, " 8 "));

        assertEquals(Duration.ofMillis(2500), settings.probeTimeout);
        assertEquals(Duration.ofSeconds(1), settings.sessionTimeout);
        assertEquals(10, settings.probeAttempts);
        assertEquals(PayDefaults.DEFAULT_MAX_PROBES, settings.maxProbes);
        assertEquals(8, settings.probeThreads);
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> ProbeSettings.defaults().withMaxProbes(0));
    }
}
