package org.interledger.pay;

import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Destination;
import org.interledger.pay.model.Invoice;
import org.interledger.pay.model.Quote;
import org.interledger.pay.probe.ProbeChannel;
import org.interledger.pay.probe.ProbeRound;
import org.interledger.pay.quote.QuoteOptions;
import org.interledger.pay.quote.QuoteOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An established connection to a resolved destination, ready to quote against.
 * Closing it releases the probe channel and its threads; closing twice is a no-op.
 */
public class PaymentSetup implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(PaymentSetup.class);

    private final Destination destination;
    private final boolean assetProbeLearned;
    private final ProbeChannel channel;
    private final ExecutorService executor;
    private final ProbeSettings settings;
    private final AtomicBoolean closed = new AtomicBoolean();

    PaymentSetup(Destination destination, boolean assetProbeLearned, ProbeChannel channel,
                 ExecutorService executor, ProbeSettings settings) {
        this.destination = destination;
        this.assetProbeLearned = assetProbeLearned;
        this.channel = channel;
        this.executor = executor;
        this.settings = settings;
    }

    public Destination getDestination() {
        return destination;
    }

    public String getDestinationAddress() {
        return destination.getDestinationAddress();
    }

    public byte[] getSharedSecret() {
        return destination.getSharedSecret();
    }

    /** Always present once setup succeeded. */
    public Asset getDestinationAsset() {
        return destination.getDestinationAsset().orElseThrow();
    }

    public Optional<Invoice> getInvoice() {
        return destination.getInvoice();
    }

    public Optional<String> getAccountUrl() {
        return destination.getAccountUrl();
    }

    /**
     * Probes the path and prices the payment. Each call is an independent session.
     *
     * @throws PaymentException with the outcome that ended the quote
     * @throws InterruptedException if interrupted while probing
     * @throws IllegalStateException if this setup was closed
     */
    public Quote startQuote(QuoteOptions options) throws PaymentException, InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("Payment setup is closed");
        }
        ProbeRound round = new ProbeRound(channel, executor, settings);
        return new QuoteOrchestrator(destination, assetProbeLearned, round, settings).quote(options);
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.debug("Closing connection to {}", destination.getDestinationAddress());
        executor.shutdownNow();
        channel.close();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
