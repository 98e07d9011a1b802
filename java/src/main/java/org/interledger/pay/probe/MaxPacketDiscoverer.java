package org.interledger.pay.probe;

import org.interledger.pay.config.PayDefaults;
import org.interledger.pay.model.Amount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Searches for the largest packet amount the path carries.
 *
 * <p>The first round sends {@link Amount#MAX_U64} together with a ladder of powers of ten,
 * which brackets the maximum within one decade. Later rounds send one amount at a time:
 * the stated maximum from F08 metadata when one is known and untested, otherwise a point
 * between the largest carried amount and the ceiling (geometric while the bracket spans
 * more than a decade, then bisection). No amount is ever sent twice.</p>
 *
 * <p>All bounds are recomputed from the accumulated evidence after each round, so the
 * result does not depend on the order replies arrive in. A maximum stated in F08 metadata
 * is authoritative; an F08 without metadata only proves that amount too large, and an
 * amount the path carried overrides such a best-effort bound. A reject for any reason other
 * than size proves the amount fits just as a carried one does; an unreachable probe proves
 * nothing.</p>
 *
 * <p>Not thread-safe: a single session thread applies every result.</p>
 */
public class MaxPacketDiscoverer {
    private static final Logger logger = LoggerFactory.getLogger(MaxPacketDiscoverer.class);

    private static final BigInteger TEN = BigInteger.TEN;

    private final Set<Amount> attempted = new HashSet<>();
    private boolean started;
    private boolean stalled;

    private Amount largestFitting = Amount.ZERO;
    private boolean anyCarried;
    private Amount smallestTooLarge;
    private Amount statedMaximum;

    private Amount knownGood = Amount.ZERO;
    private Amount ceiling = Amount.MAX_U64;
    private boolean precise;

    /**
     * Amounts to probe next, all distinct and never sent before.
     * Empty once the search has converged or cannot make progress.
     */
    public List<Amount> nextAmounts() {
        if (!started) {
            started = true;
            List<Amount> ladder = new ArrayList<>();
            ladder.add(Amount.MAX_U64);
            for (int exp = PayDefaults.RATE_PROBE_MAX_EXPONENT; exp >= 0; exp--) {
                ladder.add(Amount.from(TEN.pow(exp)));
            }
            attempted.addAll(ladder);
            return ladder;
        }
        if (isConverged() || stalled) {
            return List.of();
        }

        Amount candidate = precise && !attempted.contains(ceiling) ? ceiling : splitPoint();
        if (attempted.contains(candidate)) {
            logger.debug("Max packet search stalled at {} (bounds {}..{})", candidate, knownGood, ceiling);
            stalled = true;
            return List.of();
        }
        attempted.add(candidate);
        return List.of(candidate);
    }

    private Amount splitPoint() {
        BigInteger low = knownGood.value();
        BigInteger high = ceiling.value();
        if (low.signum() > 0 && high.compareTo(low.multiply(TEN)) > 0) {
            BigInteger geometric = low.multiply(high).sqrt();
            return Amount.from(geometric.max(low.add(BigInteger.ONE)).min(high));
        }
        // upper midpoint, always in (low, high]
        BigInteger mid = low.add(high.subtract(low).add(BigInteger.ONE).shiftRight(1));
        return Amount.from(mid);
    }

    /** Folds one round of results into the bounds. */
    public void apply(List<ProbeResult> results) {
        for (ProbeResult result : results) {
            attempted.add(result.amountSent);
            switch (result.outcome) {
                case CARRIED:
                    anyCarried = true;
                    largestFitting = largestFitting.max(result.amountSent);
                    break;
                case REJECTED:
                    // any reject other than F08 means the amount was not too large
                    largestFitting = largestFitting.max(result.amountSent);
                    break;
                case TOO_LARGE:
                    result.getMaxAmountHint().ifPresent(hint -> {
                        if (hint.exact) {
                            statedMaximum = statedMaximum == null ? hint.amount : statedMaximum.min(hint.amount);
                        }
                    });
                    smallestTooLarge = smallestTooLarge == null
                            ? result.amountSent
                            : smallestTooLarge.min(result.amountSent);
                    break;
                default:
                    break;
            }
        }
        recompute();
    }

    private void recompute() {
        Amount newCeiling = Amount.MAX_U64;
        boolean newPrecise = false;
        if (statedMaximum != null) {
            newCeiling = statedMaximum;
            newPrecise = true;
        }
        if (smallestTooLarge != null) {
            Amount belowFailure = smallestTooLarge.checkedSubtract(Amount.ONE).orElse(Amount.ZERO);
            if (belowFailure.isLessThan(newCeiling)) {
                newCeiling = belowFailure;
                newPrecise = false;
            }
        }

        Amount newKnownGood = largestFitting;
        if (newKnownGood.isGreaterThan(newCeiling)) {
            if (newPrecise) {
                newKnownGood = newCeiling;
            } else {
                logger.debug("Carried {} above best-effort ceiling {}", newKnownGood, newCeiling);
                newCeiling = newKnownGood;
            }
        }

        if (!newCeiling.equals(ceiling) || !newKnownGood.equals(knownGood)) {
            logger.debug("Max packet bounds {}..{} ({})", newKnownGood, newCeiling, newPrecise ? "precise" : "imprecise");
        }
        ceiling = newCeiling;
        knownGood = newKnownGood;
        precise = newPrecise;
    }

    /** True once the largest amount proven to fit meets the ceiling. */
    public boolean isConverged() {
        return knownGood.equals(ceiling);
    }

    /** True if the path was shown to carry no positive amount at all. */
    public boolean isZeroCapacity() {
        return ceiling.isZero();
    }

    public boolean hasCarried() {
        return anyCarried;
    }

    /** True if any hop rejected a probe as too large. */
    public boolean hasSizeEvidence() {
        return smallestTooLarge != null;
    }

    public Amount getKnownGood() {
        return knownGood;
    }

    public Amount getCeiling() {
        return ceiling;
    }

    public boolean isPrecise() {
        return precise;
    }

    /** Best proven maximum; empty if nothing positive was carried. */
    public Optional<Amount> getMaxPacketAmount() {
        return knownGood.isPositive() ? Optional.of(knownGood) : Optional.empty();
    }
}
