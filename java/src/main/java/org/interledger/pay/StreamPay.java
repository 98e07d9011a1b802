package org.interledger.pay;

import org.interledger.pay.client.DestinationResolver;
import org.interledger.pay.client.HttpDestinationResolver;
import org.interledger.pay.client.PaymentTarget;
import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Destination;
import org.interledger.pay.probe.DestinationAssetResolver;
import org.interledger.pay.probe.ProbeChannel;
import org.interledger.pay.probe.ProbeRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Entry point: resolve a destination, connect, and learn its asset. */
public final class StreamPay {
    private static final Logger logger = LoggerFactory.getLogger(StreamPay.class);

    private StreamPay() {
    }

    /**
     * Resolves the destination in {@code options}, opens a probe channel to it and, unless
     * the asset is already known, asks the receiver for its asset.
     *
     * @throws PaymentException {@code InvalidCredentials}, {@code InvalidPaymentPointer},
     *     {@code QueryFailed}, {@code EstablishmentFailed}, {@code UnknownDestinationAsset}
     *     or {@code DestinationAssetConflict}
     * @throws InterruptedException if interrupted while resolving or probing
     */
    public static PaymentSetup setupPayment(SetupOptions options) throws PaymentException, InterruptedException {
        Objects.requireNonNull(options.channelFactory, "channelFactory");
        PaymentTarget target = options.target();
        if (target == null) {
            throw new PaymentException(PaymentError.InvalidCredentials, "no payment pointer, invoice or credentials");
        }
        DestinationResolver resolver = options.resolver != null ? options.resolver : new HttpDestinationResolver();
        ProbeSettings settings = options.probeSettings != null
                ? options.probeSettings
                : ProbeSettings.fromEnvironment();

        Destination destination = resolver.resolve(target);
        if (destination.getDestinationAsset().isEmpty() && options.destinationAsset != null) {
            destination = destination.withDestinationAsset(options.destinationAsset);
        }

        ProbeChannel channel;
        try {
            channel = options.channelFactory.open(destination);
        } catch (IOException e) {
            logger.warn("Could not open STREAM connection to {}: {}", destination.getDestinationAddress(), e.getMessage());
            throw new PaymentException(PaymentError.EstablishmentFailed, "could not connect: " + e.getMessage());
        }
        ExecutorService executor = Executors.newFixedThreadPool(settings.probeThreads, probeThreadFactory());
        if (destination.getDestinationAsset().isPresent()) {
            return new PaymentSetup(destination, false, channel, executor, settings);
        }

        try {
            ProbeRound round = new ProbeRound(channel, executor, settings);
            Asset asset = new DestinationAssetResolver(null).resolve(round, Instant.now().plus(settings.sessionTimeout));
            logger.info("Connected to {} paying in {}", destination.getDestinationAddress(), asset);
            return new PaymentSetup(destination.withDestinationAsset(asset), true, channel, executor, settings);
        } catch (PaymentException | InterruptedException e) {
            release(channel, executor);
            throw e;
        }
    }

    private static void release(ProbeChannel channel, ExecutorService executor) {
        executor.shutdownNow();
        try {
            channel.close();
        } catch (IOException e) {
            logger.debug("Failed to close probe channel: {}", e.getMessage());
        }
    }

    private static ThreadFactory probeThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "stream-pay-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
