package org.interledger.pay.probe;

import org.interledger.pay.SimulatedPath;
import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Amount;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ProbeRoundTest {

    ExecutorService executor;
    ProbeSettings settings;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        settings = ProbeSettings.defaults()
                .withRetryBackoff(Duration.ofMillis(1))
                .withProbeTimeout(Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Instant inSeconds(long seconds) {
        return Instant.now().plusSeconds(seconds);
    }

    @Test
    void returnsOneResultPerDistinctAmountInOrder() throws Exception {
        SimulatedPath path = new SimulatedPath().maxPacket(100);
        ProbeRound round = new ProbeRound(path, executor, settings);

        List<ProbeResult> results = round.send(
                List.of(Amount.fromLong(10), Amount.fromLong(1000), Amount.fromLong(10)), inSeconds(5));

        assertEquals(2, results.size());
        assertEquals(Amount.fromLong(10), results.get(0).amountSent);
        assertEquals(ProbeResult.Outcome.CARRIED, results.get(0).outcome);
        assertEquals(Amount.fromLong(10), results.get(0).getDestinationAmount().orElseThrow());
        assertEquals(ProbeResult.Outcome.TOO_LARGE, results.get(1).outcome);
        assertEquals(2, path.getPacketCount());
    }

    @Test
    void retriesTemporaryRejectsUpToAttemptLimit() throws Exception {
        SimulatedPath path = new SimulatedPath().rejectingWith(IlpErrorCode.T04_INSUFFICIENT_LIQUIDITY);
        ProbeRound round = new ProbeRound(path, executor, settings);

        List<ProbeResult> results = round.send(List.of(Amount.ONE), inSeconds(5));

        assertEquals(ProbeResult.Outcome.REJECTED, results.get(0).outcome);
        assertTrue(results.get(0).isRetryable());
        assertEquals(settings.probeAttempts, path.getPacketCount());
    }

    @Test
    void finalRejectsAreNotRetried() throws Exception {
        SimulatedPath path = new SimulatedPath().rejectingWith(IlpErrorCode.F06_UNEXPECTED_PAYMENT);
        List<ProbeResult> results = new ProbeRound(path, executor, settings).send(List.of(Amount.ONE), inSeconds(5));

        assertEquals(ProbeResult.Outcome.REJECTED, results.get(0).outcome);
        assertFalse(results.get(0).isRetryable());
        assertEquals(1, path.getPacketCount());
    }

    @Test
    void peerUnreachableIsUnreachable() throws Exception {
        SimulatedPath path = new SimulatedPath().rejectingWith(IlpErrorCode.T01_PEER_UNREACHABLE);
        List<ProbeResult> results = new ProbeRound(path, executor, settings).send(List.of(Amount.ONE), inSeconds(5));

        assertEquals(ProbeResult.Outcome.UNREACHABLE, results.get(0).outcome);
        assertEquals(settings.probeAttempts, path.getPacketCount());
    }

    @Test
    void transportFailureBecomesUnreachable() throws Exception {
        SimulatedPath path = new SimulatedPath().failingWith(new IOException("connection reset"));
        List<ProbeResult> results = new ProbeRound(path, executor, settings).send(List.of(Amount.ONE), inSeconds(5));

        assertEquals(ProbeResult.Outcome.UNREACHABLE, results.get(0).outcome);
        assertNull(results.get(0).rejectCode);
    }

    @Test
    void slowProbeTimesOut() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        ProbeChannel stuck = new ProbeChannel() {
            @Override
            public ProbeReply sendProbe(Amount amount) throws InterruptedException {
                never.await();
                return ProbeReply.reject(IlpErrorCode.F99_APPLICATION_ERROR);
            }

            @Override
            public void close() {
            }
        };
        ProbeSettings oneAttempt = new ProbeSettings(Duration.ofMillis(100), Duration.ofSeconds(5), 1,
                Duration.ofMillis(1), 16, 4);

        long start = System.nanoTime();
        List<ProbeResult> results = new ProbeRound(stuck, executor, oneAttempt).send(List.of(Amount.ONE), inSeconds(5));

        assertEquals(ProbeResult.Outcome.UNREACHABLE, results.get(0).outcome);
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 2000);
    }

    @Test
    void unknownRejectCodesMapToF00() {
        assertEquals(IlpErrorCode.T04_INSUFFICIENT_LIQUIDITY, IlpErrorCode.fromCode("T04"));
        assertEquals(IlpErrorCode.F00_BAD_REQUEST, IlpErrorCode.fromCode("F05"));
        assertTrue(IlpErrorCode.T00_INTERNAL_ERROR.isTemporary());
        assertFalse(IlpErrorCode.R00_TRANSFER_TIMED_OUT.isTemporary());
    }

    @Test
    void passedDeadlineSendsNothing() throws Exception {
        SimulatedPath path = new SimulatedPath();
        List<ProbeResult> results = new ProbeRound(path, executor, settings)
                .send(List.of(Amount.ONE), Instant.now().minusSeconds(1));

        assertEquals(ProbeResult.Outcome.UNREACHABLE, results.get(0).outcome);
        assertEquals(0, path.getPacketCount());
    }
}
