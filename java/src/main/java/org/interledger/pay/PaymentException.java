package org.interledger.pay;

import java.util.Objects;

/** Thrown when a payment setup or quote ends in one of the {@link PaymentError} outcomes. */
public class PaymentException extends Exception {
    private final PaymentError error;

    public PaymentException(PaymentError error, String message) {
        super(error + ": " + message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public PaymentError getError() {
        return error;
    }
}
