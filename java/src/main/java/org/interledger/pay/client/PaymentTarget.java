package org.interledger.pay.client;

import org.interledger.pay.model.Asset;

/** What the sender wants to pay: a payment pointer, an invoice, or raw STREAM credentials. */
public final class PaymentTarget {

    public enum Kind {
        PAYMENT_POINTER,
        INVOICE,
        CREDENTIALS
    }

    public final Kind kind;
    public final String paymentPointer;
    public final String invoiceUrl;
    public final String destinationAddress;
    private final byte[] sharedSecret;
    public final Asset destinationAsset;

    private PaymentTarget(Kind kind, String paymentPointer, String invoiceUrl,
                          String destinationAddress, byte[] sharedSecret, Asset destinationAsset) {
        this.kind = kind;
        this.paymentPointer = paymentPointer;
        this.invoiceUrl = invoiceUrl;
        this.destinationAddress = destinationAddress;
        this.sharedSecret = sharedSecret == null ? null : sharedSecret.clone();
        this.destinationAsset = destinationAsset;
    }

    public static PaymentTarget paymentPointer(String paymentPointer) {
        return new PaymentTarget(Kind.PAYMENT_POINTER, paymentPointer, null, null, null, null);
    }

    public static PaymentTarget invoice(String invoiceUrl) {
        return new PaymentTarget(Kind.INVOICE, null, invoiceUrl, null, null, null);
    }

    /** @param destinationAsset may be null if the receiver will declare it */
    public static PaymentTarget credentials(String destinationAddress, byte[] sharedSecret, Asset destinationAsset) {
        return new PaymentTarget(Kind.CREDENTIALS, null, null, destinationAddress, sharedSecret, destinationAsset);
    }

    public byte[] getSharedSecret() {
        return sharedSecret == null ? null : sharedSecret.clone();
    }
}
