package org.interledger.pay.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-negative integer amount bounded to the unsigned 64-bit range used by ILP packets.
 *
 * <p>Instances are immutable. Every public way of building one checks the
 * {@code [0, 2^64-1]} bounds, so arithmetic never wraps around silently: operations that
 * would leave the range either throw {@link ArithmeticException} or, for the
 * {@code checked*} variants, return {@link Optional#empty()}.</p>
 */
public final class Amount implements Comparable<Amount> {

    private static final BigInteger U64_MAX_VALUE = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public static final Amount ZERO = new Amount(BigInteger.ZERO);
    public static final Amount ONE = new Amount(BigInteger.ONE);
    public static final Amount MAX_U64 = new Amount(U64_MAX_VALUE);

    private final BigInteger value;

    private Amount(BigInteger value) {
        this.value = value;
    }

    /** True if the value fits in {@code [0, 2^64-1]}. */
    public static boolean isU64(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(U64_MAX_VALUE) <= 0;
    }

    /**
     * Wraps a big integer.
     *
     * @throws ArithmeticException if the value is negative or exceeds {@code 2^64-1}
     */
    public static Amount from(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (!isU64(value)) {
            throw new ArithmeticException("Amount out of u64 range: " + value);
        }
        return new Amount(value);
    }

    /**
     * @throws ArithmeticException if the value is negative
     */
    public static Amount fromLong(long value) {
        return from(BigInteger.valueOf(value));
    }

    /**
     * Parses a decimal integer string such as {@code "45601"}.
     *
     * @throws NumberFormatException if the string is not a plain non-negative integer in u64 range
     */
    public static Amount fromString(String value) {
        return parse(value).orElseThrow(() -> new NumberFormatException("Not a u64 amount: " + value));
    }

    /**
     * Single parsing boundary for caller-supplied amounts.
     *
     * <p>Accepts a {@link BigInteger}, any integral boxed primitive, an integral finite
     * {@link Double}, {@link Float} or {@link BigDecimal}, or a decimal-integer string.
     * Fractional, negative, NaN, infinite and out-of-range inputs yield empty.</p>
     */
    public static Optional<Amount> parse(Object input) {
        if (input == null) {
            return Optional.empty();
        }
        if (input instanceof Amount) {
            return Optional.of((Amount) input);
        }
        if (input instanceof BigInteger) {
            return ofChecked((BigInteger) input);
        }
        if (input instanceof Long || input instanceof Integer || input instanceof Short || input instanceof Byte) {
            return ofChecked(BigInteger.valueOf(((Number) input).longValue()));
        }
        if (input instanceof Double || input instanceof Float) {
            double d = ((Number) input).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return integral(new BigDecimal(d));
        }
        if (input instanceof BigDecimal) {
            return integral((BigDecimal) input);
        }
        if (input instanceof String) {
            String s = ((String) input).trim();
            if (s.isEmpty() || !s.chars().allMatch(c -> c >= '0' && c <= '9')) {
                return Optional.empty();
            }
            return ofChecked(new BigInteger(s));
        }
        return Optional.empty();
    }

    private static Optional<Amount> integral(BigDecimal d) {
        try {
            return ofChecked(d.toBigIntegerExact());
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    private static Optional<Amount> ofChecked(BigInteger value) {
        return isU64(value) ? Optional.of(new Amount(value)) : Optional.empty();
    }

    public BigInteger value() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    /**
     * @throws ArithmeticException on u64 overflow
     */
    public Amount add(Amount other) {
        return checkedAdd(other).orElseThrow(() -> new ArithmeticException("u64 overflow: " + this + " + " + other));
    }

    public Optional<Amount> checkedAdd(Amount other) {
        return ofChecked(value.add(other.value));
    }

    /**
     * @throws ArithmeticException if the result would be negative
     */
    public Amount subtract(Amount other) {
        return checkedSubtract(other).orElseThrow(() -> new ArithmeticException("Negative amount: " + this + " - " + other));
    }

    public Optional<Amount> checkedSubtract(Amount other) {
        return ofChecked(value.subtract(other.value));
    }

    /**
     * Computes {@code this * numerator / denominator}, rounded with {@code mode}.
     * Only {@link RoundingMode#FLOOR} and {@link RoundingMode#CEILING} are supported.
     *
     * @return empty if the result exceeds {@code 2^64-1}
     */
    public Optional<Amount> multiplyByRatio(BigInteger numerator, BigInteger denominator, RoundingMode mode) {
        if (denominator.signum() <= 0 || numerator.signum() < 0) {
            throw new ArithmeticException("Ratio must be non-negative with a positive denominator");
        }
        BigInteger product = value.multiply(numerator);
        BigInteger[] qr = product.divideAndRemainder(denominator);
        BigInteger result = qr[0];
        if (mode == RoundingMode.CEILING) {
            if (qr[1].signum() != 0) {
                result = result.add(BigInteger.ONE);
            }
        } else if (mode != RoundingMode.FLOOR) {
            throw new IllegalArgumentException("Unsupported rounding mode: " + mode);
        }
        return ofChecked(result);
    }

    public Optional<Amount> multiplyByRatio(Ratio ratio, RoundingMode mode) {
        return multiplyByRatio(ratio.numerator(), ratio.denominator(), mode);
    }

    public Amount min(Amount other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Amount max(Amount other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isGreaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Amount other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Amount)) return false;
        return value.equals(((Amount) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
