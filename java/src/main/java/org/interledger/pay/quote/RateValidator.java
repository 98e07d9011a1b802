package org.interledger.pay.quote;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.PriceTable;
import org.interledger.pay.model.Ratio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a probed exchange rate is good enough to pay at.
 *
 * <p>The minimum rate is the reference rate less the slippage tolerance. A probed rate
 * passes only if it is at or above that minimum <em>and</em> the largest packet leaves room
 * for one destination unit of rounding: connectors floor every packet, so a packet of
 * {@code n} source units may deliver up to one unit less than {@code n * rate}. If
 * {@code maxPacket * (probed - minimum) < 1}, packets cannot reliably clear the minimum.</p>
 */
public final class RateValidator {
    private static final Logger logger = LoggerFactory.getLogger(RateValidator.class);

    private RateValidator() {
    }

    /**
     * @throws PaymentException {@code InvalidSlippage} unless finite and in {@code [0, 1)}
     */
    public static Ratio checkSlippage(double slippage) throws PaymentException {
        if (Double.isNaN(slippage) || Double.isInfinite(slippage) || slippage < 0 || slippage >= 1) {
            throw new PaymentException(PaymentError.InvalidSlippage, "slippage must be in [0, 1): " + slippage);
        }
        return Ratio.fromDouble(slippage);
    }

    /**
     * Reference rate in raw destination units per raw source unit. Uses the price table when
     * it prices both assets; without prices, assets sharing a code convert 1:1 after scaling.
     *
     * @param prices may be null
     * @throws PaymentException {@code ExternalRateUnavailable} if no usable reference exists
     */
    public static Ratio referenceRate(Asset source, Asset destination, PriceTable prices) throws PaymentException {
        if (prices != null && !prices.asMap().isEmpty()) {
            Optional<Ratio> rate = prices.exchangeRate(source, destination);
            if (rate.isPresent()) {
                return rate.get();
            }
            if (!Objects.equals(source.code, destination.code)) {
                throw new PaymentException(PaymentError.ExternalRateUnavailable,
                        "no usable price for " + source.code + " or " + destination.code);
            }
        }
        if (Objects.equals(source.code, destination.code)) {
            return Ratio.powerOfTen(destination.scale - source.scale);
        }
        throw new PaymentException(PaymentError.ExternalRateUnavailable,
                "no prices to convert " + source.code + " to " + destination.code);
    }

    /** {@code reference * (1 - slippage)}. */
    public static Ratio minExchangeRate(Ratio referenceRate, Ratio slippage) {
        return referenceRate.multiply(Ratio.ONE.subtract(slippage));
    }

    /**
     * @throws PaymentException {@code InsufficientExchangeRate} if the probed rate or the
     *     packet precision cannot honour {@code minExchangeRate}
     */
    public static void validate(Ratio probedRate, Ratio minExchangeRate, Amount maxPacketAmount) throws PaymentException {
        if (probedRate.isLessThan(minExchangeRate)) {
            logger.warn("Probed rate {} is below minimum {}", probedRate, minExchangeRate);
            throw new PaymentException(PaymentError.InsufficientExchangeRate,
                    "probed rate " + probedRate + " below minimum " + minExchangeRate);
        }
        Ratio margin = probedRate.subtract(minExchangeRate);
        Ratio worstCaseSlack = margin.multiply(Ratio.of(maxPacketAmount.value(), BigInteger.ONE));
        if (worstCaseSlack.isLessThan(Ratio.ONE)) {
            logger.warn("Max packet {} too small to absorb rounding between {} and {}",
                    maxPacketAmount, probedRate, minExchangeRate);
            throw new PaymentException(PaymentError.InsufficientExchangeRate,
                    "rounding could break minimum rate " + minExchangeRate + " with max packet " + maxPacketAmount);
        }
    }
}
