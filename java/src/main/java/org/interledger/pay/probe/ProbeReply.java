package org.interledger.pay.probe;

import org.interledger.pay.model.Amount;

import java.util.List;
import java.util.Optional;

/** What a {@link ProbeChannel} got back for one test packet. */
public final class ProbeReply {
    /** F08 reject metadata: amount the rejecting hop received and the most it accepts. */
    public static final class MaxAmountMetadata {
        public final Amount receivedAmount;
        public final Amount maximumAmount;

        public MaxAmountMetadata(Amount receivedAmount, Amount maximumAmount) {
            this.receivedAmount = receivedAmount;
            this.maximumAmount = maximumAmount;
        }
    }

    public final boolean fulfilled;
    /** Null when fulfilled. */
    public final IlpErrorCode rejectCode;
    public final List<StreamFrame> frames;
    private final Amount destinationAmount;
    private final MaxAmountMetadata maxAmountMetadata;

    public ProbeReply(boolean fulfilled, IlpErrorCode rejectCode, List<StreamFrame> frames,
                      Amount destinationAmount, MaxAmountMetadata maxAmountMetadata) {
        this.fulfilled = fulfilled;
        this.rejectCode = rejectCode;
        this.frames = frames == null ? List.of() : List.copyOf(frames);
        this.destinationAmount = destinationAmount;
        this.maxAmountMetadata = maxAmountMetadata;
    }

    public static ProbeReply fulfilled(Amount destinationAmount, List<StreamFrame> frames) {
        return new ProbeReply(true, null, frames, destinationAmount, null);
    }

    /** Reject from the STREAM receiver, carrying the amount that arrived. */
    public static ProbeReply receiverReject(Amount destinationAmount, List<StreamFrame> frames) {
        return new ProbeReply(false, IlpErrorCode.F99_APPLICATION_ERROR, frames, destinationAmount, null);
    }

    public static ProbeReply reject(IlpErrorCode code) {
        return new ProbeReply(false, code, List.of(), null, null);
    }

    public static ProbeReply amountTooLarge(Amount receivedAmount, Amount maximumAmount) {
        return new ProbeReply(false, IlpErrorCode.F08_AMOUNT_TOO_LARGE, List.of(), null,
                new MaxAmountMetadata(receivedAmount, maximumAmount));
    }

    /** Amount the receiver reports as arrived, if the reply came from the receiver. */
    public Optional<Amount> getDestinationAmount() {
        return Optional.ofNullable(destinationAmount);
    }

    public Optional<MaxAmountMetadata> getMaxAmountMetadata() {
        return Optional.ofNullable(maxAmountMetadata);
    }
}
