package org.interledger.pay.quote;

import org.interledger.pay.model.Asset;

import java.util.Map;

/**
 * Parameters of one quote request.
 *
 * <p>Amounts are taken as given by the caller and parsed at quote time, so they may be a
 * {@link java.math.BigInteger}, a {@link Long} or {@link Integer}, an integral
 * {@link Double}, or a decimal-integer {@link String}. Give exactly one of
 * {@link #amountToSend} and {@link #amountToDeliver}, or neither when paying an invoice.</p>
 */
public class QuoteOptions {
    /** Asset the sender pays in. Required unless the quote fails earlier. */
    public Asset sourceAsset;

    /** Fixed amount to send, in raw source units. */
    public Object amountToSend;

    /** Fixed amount to deliver, in raw destination units. */
    public Object amountToDeliver;

    /** Tolerated fraction below the reference rate, in {@code [0, 1)}. Null means 1%. */
    public Double slippage;

    /** Asset code to price in a common reference unit; optional when both assets share a code. */
    public Map<String, ? extends Number> prices;

    public QuoteOptions() {}

    public QuoteOptions(Asset sourceAsset) {
        this.sourceAsset = sourceAsset;
    }

    public QuoteOptions amountToSend(Object amount) {
        this.amountToSend = amount;
        return this;
    }

    public QuoteOptions amountToDeliver(Object amount) {
        this.amountToDeliver = amount;
        return this;
    }

    public QuoteOptions slippage(double slippage) {
        this.slippage = slippage;
        return this;
    }

    public QuoteOptions prices(Map<String, ? extends Number> prices) {
        this.prices = prices;
        return this;
    }
}
