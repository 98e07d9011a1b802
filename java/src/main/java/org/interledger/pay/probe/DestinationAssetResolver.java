package org.interledger.pay.probe;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Learns and guards the receiver's asset.
 *
 * <p>The first asset bound, whether supplied by the caller or declared by the receiver,
 * stays fixed for the session. Disagreeing declarations within one round always abort.
 * A later declaration that differs from a probe-learned asset aborts too; one that
 * differs from a caller-supplied asset is ignored.</p>
 */
public class DestinationAssetResolver {
    private static final Logger logger = LoggerFactory.getLogger(DestinationAssetResolver.class);

    private final boolean callerSupplied;
    private Asset boundAsset;

    /**
     * @param knownAsset asset supplied by the caller or by destination resolution; may be null
     */
    public DestinationAssetResolver(Asset knownAsset) {
        this(knownAsset, false);
    }

    /**
     * @param knownAsset asset already bound for this destination; may be null
     * @param probeLearned whether {@code knownAsset} was declared by the receiver on an earlier probe
     */
    public DestinationAssetResolver(Asset knownAsset, boolean probeLearned) {
        this.boundAsset = knownAsset;
        this.callerSupplied = knownAsset != null && !probeLearned;
    }

    /**
     * Sends a zero-amount probe and binds the asset the receiver declares.
     *
     * @throws PaymentException {@code EstablishmentFailed} if no probe reached the receiver,
     *     {@code DestinationAssetConflict} on disagreeing declarations,
     *     {@code UnknownDestinationAsset} if the receiver declared nothing
     * @throws InterruptedException if interrupted while probing
     */
    public Asset resolve(ProbeRound round, Instant deadline) throws PaymentException, InterruptedException {
        List<ProbeResult> results = round.send(List.of(Amount.ZERO), deadline);
        boolean reachedReceiver = results.stream().anyMatch(ProbeResult::isCarried);
        if (!reachedReceiver) {
            logger.warn("Asset probe never reached the receiver: {}", results);
            throw new PaymentException(PaymentError.EstablishmentFailed, "no test packet reached the receiver");
        }
        observe(results);
        if (boundAsset == null) {
            throw new PaymentException(PaymentError.UnknownDestinationAsset, "receiver did not share its asset details");
        }
        return boundAsset;
    }

    /**
     * Applies the asset declarations from one round of probes.
     *
     * @throws PaymentException {@code DestinationAssetConflict} if the declarations disagree
     */
    public void observe(List<ProbeResult> results) throws PaymentException {
        Set<Asset> declared = new LinkedHashSet<>();
        for (ProbeResult result : results) {
            declared.addAll(result.assetDeclarations);
        }
        if (declared.isEmpty()) {
            return;
        }
        if (declared.size() > 1) {
            logger.warn("Receiver declared conflicting assets in one round: {}", declared);
            throw new PaymentException(PaymentError.DestinationAssetConflict, "conflicting assets " + declared);
        }

        Asset asset = declared.iterator().next();
        if (boundAsset == null) {
            logger.debug("Receiver declared asset {}", asset);
            boundAsset = asset;
        } else if (!boundAsset.equals(asset)) {
            if (callerSupplied) {
                logger.warn("Ignoring receiver asset {}, keeping supplied {}", asset, boundAsset);
            } else {
                logger.warn("Receiver changed its asset from {} to {}", boundAsset, asset);
                throw new PaymentException(PaymentError.DestinationAssetConflict,
                        "asset changed from " + boundAsset + " to " + asset);
            }
        }
    }

    public Optional<Asset> getBoundAsset() {
        return Optional.ofNullable(boundAsset);
    }
}
