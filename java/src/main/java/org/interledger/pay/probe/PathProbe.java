package org.interledger.pay.probe;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Ratio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * One quoting session's probe traffic: drives rounds of {@link ProbeRound} and feeds every
 * result to the max-packet search, the rate bounds and the asset guard.
 */
public class PathProbe {
    private static final Logger logger = LoggerFactory.getLogger(PathProbe.class);

    /** What probing established about the path. */
    public static final class Estimate {
        public final Amount maxPacketAmount;
        /** True if the search converged rather than stopping on budget or deadline. */
        public final boolean maxPacketVerified;
        public final Ratio lowerBoundRate;
        public final Ratio upperBoundRate;
        public final int probesSent;

        public Estimate(Amount maxPacketAmount, boolean maxPacketVerified,
                        Ratio lowerBoundRate, Ratio upperBoundRate, int probesSent) {
            this.maxPacketAmount = maxPacketAmount;
            this.maxPacketVerified = maxPacketVerified;
            this.lowerBoundRate = lowerBoundRate;
            this.upperBoundRate = upperBoundRate;
            this.probesSent = probesSent;
        }
    }

    private final ProbeRound round;
    private final DestinationAssetResolver assetResolver;
    private final int maxProbes;
    private final MaxPacketDiscoverer discoverer = new MaxPacketDiscoverer();
    private final RateProbe rateProbe = new RateProbe();

    public PathProbe(ProbeRound round, DestinationAssetResolver assetResolver, int maxProbes) {
        this.round = round;
        this.assetResolver = assetResolver;
        this.maxProbes = maxProbes;
    }

    /**
     * Probes until the max packet amount converges, the probe budget is spent or the
     * deadline passes.
     *
     * @throws PaymentException {@code ConnectorError} if the path carries no positive amount,
     *     {@code RateProbeFailed} if no probe delivered anything measurable,
     *     {@code DestinationAssetConflict} if the receiver's asset declarations disagree
     * @throws InterruptedException if interrupted while probing
     */
    public Estimate run(Instant deadline) throws PaymentException, InterruptedException {
        int sent = 0;
        boolean firstRound = true;
        while (sent < maxProbes && Instant.now().isBefore(deadline)) {
            List<Amount> next = discoverer.nextAmounts();
            if (next.isEmpty()) {
                break;
            }
            List<ProbeResult> results = round.send(next, deadline);
            sent += next.size();

            assetResolver.observe(results);
            discoverer.apply(results);
            rateProbe.apply(results);

            if (discoverer.isZeroCapacity() || discoverer.isConverged()) {
                break;
            }
            if (firstRound && !discoverer.hasCarried() && !discoverer.hasSizeEvidence()) {
                logger.debug("No probe reached the receiver in the first round");
                break;
            }
            firstRound = false;
        }

        if (discoverer.isZeroCapacity()) {
            throw new PaymentException(PaymentError.ConnectorError, "path max packet amount is 0");
        }
        if (!discoverer.hasCarried() || !rateProbe.hasRate() || discoverer.getMaxPacketAmount().isEmpty()) {
            throw new PaymentException(PaymentError.RateProbeFailed,
                    "no test packet was delivered after " + sent + " probe(s)");
        }

        Amount maxPacket = discoverer.getMaxPacketAmount().get();
        boolean verified = discoverer.isConverged();
        if (!verified) {
            logger.info("Max packet search stopped before converging: using {} (ceiling {})",
                    maxPacket, discoverer.getCeiling());
        }
        return new Estimate(maxPacket, verified,
                rateProbe.getLowerBound().get(), rateProbe.getUpperBound().get(), sent);
    }
}
