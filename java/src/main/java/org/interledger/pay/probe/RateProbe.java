package org.interledger.pay.probe;

import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Ratio;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Exchange-rate bounds from amounts the receiver reported as arrived.
 *
 * <p>A probe of {@code s} source units that delivered {@code d} destination units, after
 * the path rounded down, implies a real rate in {@code [d/s, (d+1)/s)}. The bounds kept
 * here are the intersection over every such probe.</p>
 */
public class RateProbe {
    private Ratio lowerBound;
    private Ratio upperBound;

    public void apply(List<ProbeResult> results) {
        for (ProbeResult result : results) {
            if (!result.isCarried() || !result.amountSent.isPositive()) {
                continue;
            }
            result.getDestinationAmount().ifPresent(delivered -> record(result.amountSent, delivered));
        }
    }

    private void record(Amount sent, Amount delivered) {
        Ratio low = Ratio.of(delivered.value(), sent.value());
        Ratio high = Ratio.of(delivered.value().add(BigInteger.ONE), sent.value());
        lowerBound = lowerBound == null ? low : lowerBound.max(low);
        upperBound = upperBound == null ? high : upperBound.min(high);
    }

    public boolean hasRate() {
        return lowerBound != null;
    }

    /** Largest rate the evidence guarantees. */
    public Optional<Ratio> getLowerBound() {
        return Optional.ofNullable(lowerBound);
    }

    public Optional<Ratio> getUpperBound() {
        return Optional.ofNullable(upperBound);
    }
}
