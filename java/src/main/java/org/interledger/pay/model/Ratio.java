package org.interledger.pay.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/**
 * Exact non-negative rational number. Used for exchange rates (destination units per
 * source unit) and slippage factors so rate comparisons never depend on floating-point
 * rounding.
 */
public final class Ratio implements Comparable<Ratio> {

    public static final Ratio ZERO = new Ratio(BigInteger.ZERO, BigInteger.ONE);
    public static final Ratio ONE = new Ratio(BigInteger.ONE, BigInteger.ONE);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Ratio(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * @throws ArithmeticException if the numerator is negative or the denominator is not positive
     */
    public static Ratio of(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (numerator.signum() < 0 || denominator.signum() <= 0) {
            throw new ArithmeticException("Invalid ratio " + numerator + "/" + denominator);
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (gcd.signum() == 0 || gcd.equals(BigInteger.ONE)) {
            return new Ratio(numerator, denominator);
        }
        return new Ratio(numerator.divide(gcd), denominator.divide(gcd));
    }

    public static Ratio of(Amount numerator, Amount denominator) {
        return of(numerator.value(), denominator.value());
    }

    public static Ratio of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /** Exact value of a non-negative decimal. */
    public static Ratio of(BigDecimal value) {
        if (value.signum() < 0) {
            throw new ArithmeticException("Negative ratio: " + value);
        }
        if (value.scale() <= 0) {
            return of(value.toBigIntegerExact(), BigInteger.ONE);
        }
        return of(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
    }

    /**
     * Exact value of a finite non-negative double (no decimal string round trip).
     *
     * @throws ArithmeticException for NaN, infinite or negative input
     */
    public static Ratio fromDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new ArithmeticException("Not a finite non-negative number: " + value);
        }
        return of(new BigDecimal(value));
    }

    /** {@code 10^exponent}, where a negative exponent gives {@code 1/10^-exponent}. */
    public static Ratio powerOfTen(int exponent) {
        BigInteger p = BigInteger.TEN.pow(Math.abs(exponent));
        return exponent >= 0 ? new Ratio(p, BigInteger.ONE) : new Ratio(BigInteger.ONE, p);
    }

    public BigInteger numerator() {
        return numerator;
    }

    public BigInteger denominator() {
        return denominator;
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isPositive() {
        return numerator.signum() > 0;
    }

    public Ratio multiply(Ratio other) {
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException if {@code other} is zero
     */
    public Ratio divide(Ratio other) {
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero ratio");
        }
        return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /**
     * @throws ArithmeticException if the result would be negative
     */
    public Ratio subtract(Ratio other) {
        BigInteger n = numerator.multiply(other.denominator).subtract(other.numerator.multiply(denominator));
        return of(n, denominator.multiply(other.denominator));
    }

    /** {@code 1/this}. */
    public Ratio reciprocal() {
        if (isZero()) {
            throw new ArithmeticException("Reciprocal of zero");
        }
        return new Ratio(denominator, numerator);
    }

    public Ratio max(Ratio other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public Ratio min(Ratio other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isLessThan(Ratio other) {
        return compareTo(other) < 0;
    }

    /** Approximate decimal form, for logs and display only. */
    public BigDecimal toBigDecimal() {
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64);
    }

    @Override
    public int compareTo(Ratio other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ratio)) return false;
        Ratio r = (Ratio) o;
        return numerator.equals(r.numerator) && denominator.equals(r.denominator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return toBigDecimal().toPlainString();
    }
}
