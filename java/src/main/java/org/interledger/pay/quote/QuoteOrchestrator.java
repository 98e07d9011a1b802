package org.interledger.pay.quote;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.config.PayDefaults;
import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Destination;
import org.interledger.pay.model.Invoice;
import org.interledger.pay.model.PriceTable;
import org.interledger.pay.model.Quote;
import org.interledger.pay.model.Ratio;
import org.interledger.pay.probe.DestinationAssetResolver;
import org.interledger.pay.probe.PathProbe;
import org.interledger.pay.probe.ProbeRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Runs one quoting session from input validation to a {@link Quote}.
 *
 * <p>Stages: validate input, resolve the destination asset, probe the path, validate the
 * rate. Everything up to the reference-rate lookup is local, so bad input fails before any
 * probe is sent. Each call builds its own probing state; nothing carries over between
 * quotes.</p>
 */
public class QuoteOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(QuoteOrchestrator.class);

    /** Session stages, in order. */
    public enum Stage {
        INIT,
        VALIDATE_INPUT,
        RESOLVE_ASSET,
        PROBE,
        VALIDATE_RATE,
        DONE
    }

    private final Destination destination;
    private final boolean assetProbeLearned;
    private final ProbeRound round;
    private final ProbeSettings settings;

    public QuoteOrchestrator(Destination destination, ProbeRound round, ProbeSettings settings) {
        this(destination, false, round, settings);
    }

    /**
     * @param assetProbeLearned whether the destination's asset was declared by the receiver
     *     during setup, so a different declaration while quoting is a conflict
     */
    public QuoteOrchestrator(Destination destination, boolean assetProbeLearned, ProbeRound round,
                             ProbeSettings settings) {
        this.destination = destination;
        this.assetProbeLearned = assetProbeLearned;
        this.round = round;
        this.settings = settings;
    }

    /**
     * @throws PaymentException with the outcome that ended the session
     * @throws InterruptedException if the calling thread was interrupted while probing
     */
    public Quote quote(QuoteOptions options) throws PaymentException, InterruptedException {
        Stage stage = Stage.INIT;
        try {
            stage = Stage.VALIDATE_INPUT;
            Target target = validate(options);
            Ratio slippage = RateValidator.checkSlippage(
                    options.slippage == null ? PayDefaults.DEFAULT_SLIPPAGE : options.slippage);
            Instant deadline = Instant.now().plus(settings.sessionTimeout);

            stage = Stage.RESOLVE_ASSET;
            DestinationAssetResolver assetResolver =
                    new DestinationAssetResolver(destination.getDestinationAsset().orElse(null), assetProbeLearned);
            Asset destinationAsset = assetResolver.getBoundAsset().isPresent()
                    ? assetResolver.getBoundAsset().get()
                    : assetResolver.resolve(round, deadline);

            PriceTable prices = options.prices == null ? null : new PriceTable(options.prices);
            Ratio referenceRate = RateValidator.referenceRate(options.sourceAsset, destinationAsset, prices);
            Ratio minExchangeRate = RateValidator.minExchangeRate(referenceRate, slippage);

            stage = Stage.PROBE;
            PathProbe.Estimate estimate = new PathProbe(round, assetResolver, settings.maxProbes).run(deadline);
            logger.debug("Probed {} packet(s): max packet {}{}, rate {}..{}", estimate.probesSent,
                    estimate.maxPacketAmount, estimate.maxPacketVerified ? "" : " (unverified)",
                    estimate.lowerBoundRate, estimate.upperBoundRate);

            stage = Stage.VALIDATE_RATE;
            RateValidator.validate(estimate.lowerBoundRate, minExchangeRate, estimate.maxPacketAmount);
            Quote quote = assemble(target, options.sourceAsset, destinationAsset, minExchangeRate, estimate);

            stage = Stage.DONE;
            logger.info("Quoted payment to {}: {}", destination.getDestinationAddress(), quote);
            return quote;
        } catch (PaymentException e) {
            if (e.getError().isValidationError()) {
                logger.debug("Quote rejected during {}: {}", stage, e.getMessage());
            } else {
                logger.warn("Quote failed during {}: {}", stage, e.getError());
            }
            throw e;
        }
    }

    /** Fixed side of the payment after validation. */
    private static final class Target {
        final Quote.PaymentType type;
        final Amount amount;

        Target(Quote.PaymentType type, Amount amount) {
            this.type = type;
            this.amount = amount;
        }
    }

    private Target validate(QuoteOptions options) throws PaymentException {
        Optional<Invoice> invoice = destination.getInvoice();
        if (invoice.isPresent() && invoice.get().isPaid()) {
            throw new PaymentException(PaymentError.InvoiceAlreadyPaid,
                    "delivered " + invoice.get().amountDelivered + " of " + invoice.get().amountToDeliver);
        }
        if (options.sourceAsset == null || !options.sourceAsset.isValid()) {
            throw new PaymentException(PaymentError.UnknownSourceAsset, "invalid source asset " + options.sourceAsset);
        }

        Amount amountToSend = null;
        if (options.amountToSend != null) {
            amountToSend = Amount.parse(options.amountToSend)
                    .filter(Amount::isPositive)
                    .orElseThrow(() -> new PaymentException(PaymentError.InvalidSourceAmount,
                            "amount to send must be a positive u64 integer: " + options.amountToSend));
        }
        Amount amountToDeliver = null;
        if (options.amountToDeliver != null) {
            amountToDeliver = Amount.parse(options.amountToDeliver)
                    .filter(Amount::isPositive)
                    .orElseThrow(() -> new PaymentException(PaymentError.InvalidDestinationAmount,
                            "amount to deliver must be a positive u64 integer: " + options.amountToDeliver));
        }

        if (invoice.isPresent()) {
            if (amountToSend != null || amountToDeliver != null) {
                logger.warn("Ignoring amounts given for an invoice payment");
            }
            return new Target(Quote.PaymentType.FIXED_DELIVERY, invoice.get().remainingToDeliver());
        }
        if (amountToSend != null && amountToDeliver != null) {
            throw new PaymentException(PaymentError.UnknownPaymentTarget,
                    "give either an amount to send or an amount to deliver, not both");
        }
        if (amountToSend != null) {
            return new Target(Quote.PaymentType.FIXED_SEND, amountToSend);
        }
        if (amountToDeliver != null) {
            return new Target(Quote.PaymentType.FIXED_DELIVERY, amountToDeliver);
        }
        throw new PaymentException(PaymentError.UnknownPaymentTarget, "no invoice, amount to send or amount to deliver");
    }

    private static Quote assemble(Target target, Asset sourceAsset, Asset destinationAsset,
                                  Ratio minExchangeRate, PathProbe.Estimate estimate) throws PaymentException {
        Amount minDeliveryAmount;
        Amount maxSourceAmount;
        if (target.type == Quote.PaymentType.FIXED_SEND) {
            maxSourceAmount = target.amount;
            minDeliveryAmount = target.amount.multiplyByRatio(minExchangeRate, RoundingMode.FLOOR)
                    .orElse(Amount.MAX_U64);
        } else {
            minDeliveryAmount = target.amount;
            maxSourceAmount = target.amount.multiplyByRatio(minExchangeRate.reciprocal(), RoundingMode.CEILING)
                    .orElseThrow(() -> new PaymentException(PaymentError.InvalidDestinationAmount,
                            "source amount to deliver " + target.amount + " exceeds u64"));
        }
        return new Quote(target.type, sourceAsset, destinationAsset, estimate.maxPacketAmount, minExchangeRate,
                minDeliveryAmount, maxSourceAmount, estimate.lowerBoundRate, estimate.upperBoundRate);
    }
}
