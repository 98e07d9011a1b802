package org.interledger.pay.client;

import org.interledger.pay.PaymentException;
import org.interledger.pay.model.Destination;

/** Contract for turning a payment target into STREAM credentials (HTTP, static, mock, etc.). */
public interface DestinationResolver {
    /**
     * Resolves a target into a destination.
     *
     * @param target the payment pointer, invoice or credentials to resolve
     * @return validated credentials plus any asset and invoice details the target carries
     * @throws PaymentException {@code InvalidPaymentPointer}, {@code InvalidCredentials} or {@code QueryFailed}
     * @throws InterruptedException if the query is interrupted
     */
    Destination resolve(PaymentTarget target) throws PaymentException, InterruptedException;
}
