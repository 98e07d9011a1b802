package org.interledger.pay;

import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Ratio;
import org.interledger.pay.probe.AssetDetailsFrame;
import org.interledger.pay.probe.IlpErrorCode;
import org.interledger.pay.probe.ProbeChannel;
import org.interledger.pay.probe.ProbeReply;
import org.interledger.pay.probe.StreamFrame;

import java.io.IOException;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory payment path for tests: a chain of connectors with packet limits, an exchange
 * rate, and a STREAM receiver that rejects every packet with F99 and reports what arrived.
 */
public class SimulatedPath implements ProbeChannel {

    private static final class Hop {
        final Amount maxPacket;
        final boolean sendsMetadata;

        Hop(Amount maxPacket, boolean sendsMetadata) {
            this.maxPacket = maxPacket;
            this.sendsMetadata = sendsMetadata;
        }
    }

    private final List<Hop> hops = new ArrayList<>();
    private final List<Asset> declaredAssets = new ArrayList<>();
    private final List<Asset> laterAssets = new ArrayList<>();
    private final List<Amount> sent = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger packets = new AtomicInteger();
    private Ratio rate = Ratio.ONE;
    private IlpErrorCode rejectEverything;
    private IOException transportFailure;
    private long latencyMillis;
    private Amount largestArrived = Amount.ZERO;
    private volatile boolean closed;

    /** Exchange rate applied after every hop, rounded down. */
    public SimulatedPath rate(Ratio rate) {
        this.rate = rate;
        return this;
    }

    /** Adds a connector that rejects larger packets with F08 and its maximum as metadata. */
    public SimulatedPath maxPacket(long max) {
        hops.add(new Hop(Amount.fromLong(max), true));
        return this;
    }

    /** Adds a connector that rejects larger packets with a bare F08. */
    public SimulatedPath maxPacketWithoutMetadata(long max) {
        hops.add(new Hop(Amount.fromLong(max), false));
        return this;
    }

    /** Receiver declares these assets on every reply. */
    public SimulatedPath declaring(Asset... assets) {
        Collections.addAll(declaredAssets, assets);
        return this;
    }

    /** Receiver declares these assets instead on every packet after the first. */
    public SimulatedPath thenDeclaring(Asset... assets) {
        Collections.addAll(laterAssets, assets);
        return this;
    }

    /** First hop rejects every packet with {@code code}. */
    public SimulatedPath rejectingWith(IlpErrorCode code) {
        this.rejectEverything = code;
        return this;
    }

    /** Every send fails on the transport. */
    public SimulatedPath failingWith(IOException failure) {
        this.transportFailure = failure;
        return this;
    }

    /** Every reply takes this long to arrive. */
    public SimulatedPath latency(Duration latency) {
        this.latencyMillis = latency.toMillis();
        return this;
    }

    @Override
    public ProbeReply sendProbe(Amount amount) throws IOException, InterruptedException {
        int packet = packets.incrementAndGet();
        sent.add(amount);
        if (latencyMillis > 0) {
            Thread.sleep(latencyMillis);
        }
        if (transportFailure != null) {
            throw transportFailure;
        }
        if (rejectEverything != null) {
            return ProbeReply.reject(rejectEverything);
        }
        for (Hop hop : hops) {
            if (amount.isGreaterThan(hop.maxPacket)) {
                return hop.sendsMetadata
                        ? ProbeReply.amountTooLarge(amount, hop.maxPacket)
                        : ProbeReply.reject(IlpErrorCode.F08_AMOUNT_TOO_LARGE);
            }
        }
        synchronized (this) {
            largestArrived = largestArrived.max(amount);
        }
        Amount delivered = amount.multiplyByRatio(rate, RoundingMode.FLOOR).orElse(Amount.MAX_U64);
        List<Asset> assets = packet > 1 && !laterAssets.isEmpty() ? laterAssets : declaredAssets;
        List<StreamFrame> frames = assets.stream()
                .map(a -> new AssetDetailsFrame(a.code, a.scale))
                .collect(Collectors.toList());
        return ProbeReply.receiverReject(delivered, frames);
    }

    public int getPacketCount() {
        return packets.get();
    }

    public List<Amount> getAmountsSent() {
        synchronized (sent) {
            return new ArrayList<>(sent);
        }
    }

    /** Largest amount that got past every connector. */
    public synchronized Amount getLargestArrived() {
        return largestArrived;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}
