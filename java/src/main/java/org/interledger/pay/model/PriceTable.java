package org.interledger.pay.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prices of assets in a common reference unit, keyed by asset code.
 * A missing code, or a zero, negative, NaN or infinite price, is reported as absent
 * rather than as a zero price.
 */
public final class PriceTable {
    private final Map<String, Double> prices;

    public PriceTable(Map<String, ? extends Number> prices) {
        Map<String, Double> copy = new HashMap<>();
        if (prices != null) {
            prices.forEach((code, price) -> {
                if (code != null && price != null) {
                    copy.put(code, price.doubleValue());
                }
            });
        }
        this.prices = Collections.unmodifiableMap(copy);
    }

    /** Exact price of one whole unit of {@code code}, if usable. */
    public Optional<Ratio> priceOf(String code) {
        Double price = prices.get(code);
        if (price == null || price.isNaN() || price.isInfinite() || price <= 0) {
            return Optional.empty();
        }
        return Optional.of(Ratio.fromDouble(price));
    }

    /**
     * Reference exchange rate in raw units: how many raw destination units one raw source
     * unit is worth, {@code price(source) / price(destination) * 10^(destScale - sourceScale)}.
     */
    public Optional<Ratio> exchangeRate(Asset source, Asset destination) {
        Optional<Ratio> sourcePrice = priceOf(source.code);
        Optional<Ratio> destinationPrice = priceOf(destination.code);
        if (sourcePrice.isEmpty() || destinationPrice.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(sourcePrice.get()
                .divide(destinationPrice.get())
                .multiply(Ratio.powerOfTen(destination.scale - source.scale)));
    }

    public Map<String, Double> asMap() {
        return prices;
    }
}
