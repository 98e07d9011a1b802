package org.interledger.pay.model;

import java.util.Objects;

/** Open Payments invoice that constrains how much the payment must deliver. */
public final class Invoice {
    public final String invoiceUrl;
    public final String accountUrl;
    /** Expiry as epoch milliseconds. */
    public final long expiresAt;
    public final String description;
    public final Amount amountDelivered;
    public final Amount amountToDeliver;

    public Invoice(String invoiceUrl, String accountUrl, long expiresAt, String description,
                   Amount amountDelivered, Amount amountToDeliver) {
        this.invoiceUrl = invoiceUrl;
        this.accountUrl = accountUrl;
        this.expiresAt = expiresAt;
        this.description = description;
        this.amountDelivered = Objects.requireNonNull(amountDelivered, "amountDelivered");
        this.amountToDeliver = Objects.requireNonNull(amountToDeliver, "amountToDeliver");
    }

    /** True once at least the full invoice amount was received. */
    public boolean isPaid() {
        return !amountDelivered.isLessThan(amountToDeliver);
    }

    /** Amount still owed; zero if already paid. */
    public Amount remainingToDeliver() {
        return amountToDeliver.checkedSubtract(amountDelivered).orElse(Amount.ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Invoice)) return false;
        Invoice that = (Invoice) o;
        return expiresAt == that.expiresAt
                && Objects.equals(invoiceUrl, that.invoiceUrl)
                && Objects.equals(accountUrl, that.accountUrl)
                && Objects.equals(description, that.description)
                && amountDelivered.equals(that.amountDelivered)
                && amountToDeliver.equals(that.amountToDeliver);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invoiceUrl, accountUrl, expiresAt, description, amountDelivered, amountToDeliver);
    }
}
