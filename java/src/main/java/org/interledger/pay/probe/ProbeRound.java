package org.interledger.pay.probe;

import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Amount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends a batch of distinct probe amounts concurrently and collects one
 * {@link ProbeResult} per amount.
 *
 * <p>Each attempt is bounded by the per-probe timeout and the session deadline. Amounts
 * whose result is retryable are sent again with exponential backoff, up to the configured
 * number of attempts. Transport exceptions never escape: they become
 * {@link ProbeResult.Outcome#UNREACHABLE} results. Results are handed back to the caller's
 * thread, which is the only writer of probing state.</p>
 */
public class ProbeRound {
    private static final Logger logger = LoggerFactory.getLogger(ProbeRound.class);

    private final ProbeChannel channel;
    private final ExecutorService executor;
    private final ProbeSettings settings;

    public ProbeRound(ProbeChannel channel, ExecutorService executor, ProbeSettings settings) {
        this.channel = channel;
        this.executor = executor;
        this.settings = settings;
    }

    /**
     * Probes every distinct amount in {@code amounts}.
     *
     * @param amounts amounts to send; duplicates are sent once
     * @param deadline session deadline; attempts stop once it passes
     * @return one result per distinct amount, in the order given
     * @throws InterruptedException if the calling thread is interrupted; in-flight probes are cancelled
     */
    public List<ProbeResult> send(List<Amount> amounts, Instant deadline) throws InterruptedException {
        Map<Amount, ProbeResult> results = new LinkedHashMap<>();
        List<Amount> pending = new ArrayList<>(new LinkedHashSet<>(amounts));
        for (Amount amount : pending) {
            results.put(amount, ProbeResult.unreachable(amount));
        }

        long backoffMs = settings.retryBackoff.toMillis();
        for (int attempt = 1; attempt <= settings.probeAttempts && !pending.isEmpty(); attempt++) {
            if (attempt > 1) {
                long sleepMs = Math.min(backoffMs, remainingMillis(deadline));
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
                backoffMs *= 2;
            }
            if (remainingMillis(deadline) <= 0) {
                logger.debug("Session deadline passed, {} probe(s) left unanswered", pending.size());
                break;
            }

            Map<Amount, Future<ProbeReply>> inFlight = submit(pending, results);
            long attemptDeadline = System.nanoTime()
                    + TimeUnit.MILLISECONDS.toNanos(Math.min(settings.probeTimeout.toMillis(), remainingMillis(deadline)));

            List<Amount> retry = new ArrayList<>();
            try {
                for (Map.Entry<Amount, Future<ProbeReply>> entry : inFlight.entrySet()) {
                    ProbeResult result = await(entry.getKey(), entry.getValue(), attemptDeadline);
                    results.put(entry.getKey(), result);
                    if (result.isRetryable()) {
                        retry.add(entry.getKey());
                    }
                }
            } catch (InterruptedException e) {
                inFlight.values().forEach(f -> f.cancel(true));
                throw e;
            }

            if (!retry.isEmpty() && attempt < settings.probeAttempts) {
                logger.debug("Retrying {} probe(s) after attempt {}", retry.size(), attempt);
            }
            pending = retry;
        }
        return new ArrayList<>(results.values());
    }

    private Map<Amount, Future<ProbeReply>> submit(List<Amount> amounts, Map<Amount, ProbeResult> results) {
        Map<Amount, Future<ProbeReply>> inFlight = new LinkedHashMap<>();
        for (Amount amount : amounts) {
            try {
                inFlight.put(amount, executor.submit(() -> channel.sendProbe(amount)));
            } catch (RejectedExecutionException e) {
                logger.debug("Probe executor rejected {}: {}", amount, e.getMessage());
                results.put(amount, ProbeResult.unreachable(amount));
            }
        }
        return inFlight;
    }

    private ProbeResult await(Amount amount, Future<ProbeReply> future, long deadlineNanos) throws InterruptedException {
        long waitNanos = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            ProbeReply reply = future.get(waitNanos, TimeUnit.NANOSECONDS);
            ProbeResult result = ProbeResult.of(amount, reply);
            logger.debug("Probe {}", result);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.debug("Probe of {} timed out", amount);
            return ProbeResult.unreachable(amount);
        } catch (CancellationException e) {
            return ProbeResult.unreachable(amount);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                logger.debug("Probe of {} failed on transport: {}", amount, cause.getMessage());
            } else {
                logger.warn("Probe channel failed for {}", amount, cause);
            }
            return ProbeResult.unreachable(amount);
        }
    }

    private static long remainingMillis(Instant deadline) {
        return Duration.between(Instant.now(), deadline).toMillis();
    }
}
