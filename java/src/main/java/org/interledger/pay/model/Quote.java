package org.interledger.pay.model;

import java.util.Objects;

/** Immutable terms under which a payment can be executed. */
public final class Quote {

    /** Which side of the payment the caller fixed. */
    public enum PaymentType {
        FIXED_SEND,
        FIXED_DELIVERY
    }

    public final PaymentType paymentType;
    public final Asset sourceAsset;
    public final Asset destinationAsset;
    /** Largest packet, in source units, the path carried. */
    public final Amount maxPacketAmount;
    /** Destination units per source unit the execution must never go below. */
    public final Ratio minExchangeRate;
    public final Amount minDeliveryAmount;
    /** Most the payment may send. */
    public final Amount maxSourceAmount;
    public final Ratio lowEstimatedExchangeRate;
    public final Ratio highEstimatedExchangeRate;

    public Quote(PaymentType paymentType, Asset sourceAsset, Asset destinationAsset,
                 Amount maxPacketAmount, Ratio minExchangeRate, Amount minDeliveryAmount,
                 Amount maxSourceAmount, Ratio lowEstimatedExchangeRate, Ratio highEstimatedExchangeRate) {
        this.paymentType = Objects.requireNonNull(paymentType, "paymentType");
        this.sourceAsset = Objects.requireNonNull(sourceAsset, "sourceAsset");
        this.destinationAsset = Objects.requireNonNull(destinationAsset, "destinationAsset");
        this.maxPacketAmount = Objects.requireNonNull(maxPacketAmount, "maxPacketAmount");
        this.minExchangeRate = Objects.requireNonNull(minExchangeRate, "minExchangeRate");
        this.minDeliveryAmount = Objects.requireNonNull(minDeliveryAmount, "minDeliveryAmount");
        this.maxSourceAmount = Objects.requireNonNull(maxSourceAmount, "maxSourceAmount");
        this.lowEstimatedExchangeRate = Objects.requireNonNull(lowEstimatedExchangeRate, "lowEstimatedExchangeRate");
        this.highEstimatedExchangeRate = Objects.requireNonNull(highEstimatedExchangeRate, "highEstimatedExchangeRate");
    }

    @Override
    public String toString() {
        return "Quote{" + paymentType
                + ", maxPacketAmount=" + maxPacketAmount
                + ", minExchangeRate=" + minExchangeRate
                + ", minDeliveryAmount=" + minDeliveryAmount
                + ", maxSourceAmount=" + maxSourceAmount
                + ", destinationAsset=" + destinationAsset + "}";
    }
}
