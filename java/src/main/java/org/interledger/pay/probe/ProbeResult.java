package org.interledger.pay.probe;

import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;

import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Classified outcome of one probe amount within a round, after retries.
 */
public final class ProbeResult {

    public enum Outcome {
        /** Fulfilled, or rejected by the receiver after arriving: the path carried the amount. */
        CARRIED,
        /** F08: some hop considers the amount too large. */
        TOO_LARGE,
        /** Rejected for a reason that says nothing about packet size. */
        REJECTED,
        /** Transport failure, timeout, or peer unreachable. */
        UNREACHABLE
    }

    /** Upper bound on the packet size a F08 implies, in source units. */
    public static final class MaxAmountHint {
        /** True if derived from the rejecting hop's own stated maximum. */
        public final boolean exact;
        public final Amount amount;

        public MaxAmountHint(boolean exact, Amount amount) {
            this.exact = exact;
            this.amount = amount;
        }
    }

    public final Amount amountSent;
    public final Outcome outcome;
    public final boolean fulfilled;
    /** Null if fulfilled or the transport failed before any reply. */
    public final IlpErrorCode rejectCode;
    public final List<Asset> assetDeclarations;
    private final MaxAmountHint maxAmountHint;
    private final Amount destinationAmount;

    private ProbeResult(Amount amountSent, Outcome outcome, boolean fulfilled, IlpErrorCode rejectCode,
                        List<Asset> assetDeclarations, MaxAmountHint maxAmountHint, Amount destinationAmount) {
        this.amountSent = amountSent;
        this.outcome = outcome;
        this.fulfilled = fulfilled;
        this.rejectCode = rejectCode;
        this.assetDeclarations = assetDeclarations;
        this.maxAmountHint = maxAmountHint;
        this.destinationAmount = destinationAmount;
    }

    public static ProbeResult unreachable(Amount amountSent) {
        return new ProbeResult(amountSent, Outcome.UNREACHABLE, false, null, List.of(), null, null);
    }

    public static ProbeResult of(Amount amountSent, ProbeReply reply) {
        List<Asset> declarations = reply.frames.stream()
                .filter(f -> f instanceof AssetDetailsFrame)
                .map(f -> ((AssetDetailsFrame) f).asset())
                .collect(Collectors.toUnmodifiableList());

        if (reply.fulfilled || reply.rejectCode == IlpErrorCode.F99_APPLICATION_ERROR) {
            return new ProbeResult(amountSent, Outcome.CARRIED, reply.fulfilled, reply.rejectCode,
                    declarations, null, reply.getDestinationAmount().orElse(null));
        }
        if (reply.rejectCode == IlpErrorCode.F08_AMOUNT_TOO_LARGE) {
            return new ProbeResult(amountSent, Outcome.TOO_LARGE, false, reply.rejectCode,
                    declarations, hintFor(amountSent, reply), null);
        }
        Outcome outcome = reply.rejectCode == IlpErrorCode.T01_PEER_UNREACHABLE
                || reply.rejectCode == IlpErrorCode.F02_UNREACHABLE
                ? Outcome.UNREACHABLE
                : Outcome.REJECTED;
        return new ProbeResult(amountSent, outcome, false, reply.rejectCode, declarations, null, null);
    }

    /*
     * The rejecting hop may count in a different asset, so its maximum is scaled back to
     * source units by the ratio of what was sent to what it received. Metadata that claims
     * the received amount was within the maximum is inconsistent and is ignored.
     */
    private static MaxAmountHint hintFor(Amount amountSent, ProbeReply reply) {
        Optional<ProbeReply.MaxAmountMetadata> metadata = reply.getMaxAmountMetadata();
        if (metadata.isPresent()) {
            Amount received = metadata.get().receivedAmount;
            Amount maximum = metadata.get().maximumAmount;
            if (received.isPositive() && maximum.isLessThan(received)) {
                Amount scaled = amountSent
                        .multiplyByRatio(maximum.value(), received.value(), RoundingMode.FLOOR)
                        .orElse(Amount.MAX_U64);
                return new MaxAmountHint(true, scaled);
            }
        }
        Amount belowSent = amountSent.checkedSubtract(Amount.ONE).orElse(Amount.ZERO);
        return new MaxAmountHint(false, belowSent);
    }

    /** Worth sending again: the failure may be transient. */
    public boolean isRetryable() {
        return outcome == Outcome.UNREACHABLE
                || (outcome == Outcome.REJECTED && rejectCode != null && rejectCode.isTemporary());
    }

    public boolean isCarried() {
        return outcome == Outcome.CARRIED;
    }

    public Optional<MaxAmountHint> getMaxAmountHint() {
        return Optional.ofNullable(maxAmountHint);
    }

    /** Amount the receiver reported as arrived. */
    public Optional<Amount> getDestinationAmount() {
        return Optional.ofNullable(destinationAmount);
    }

    @Override
    public String toString() {
        return "ProbeResult{" + amountSent + " " + outcome
                + (rejectCode != null ? " " + rejectCode.code() : "")
                + (destinationAmount != null ? " delivered=" + destinationAmount : "") + "}";
    }
}
