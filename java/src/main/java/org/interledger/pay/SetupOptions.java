package org.interledger.pay;

import org.interledger.pay.client.DestinationResolver;
import org.interledger.pay.client.PaymentTarget;
import org.interledger.pay.config.ProbeSettings;
import org.interledger.pay.model.Asset;
import org.interledger.pay.probe.ProbeChannelFactory;

/**
 * How to reach the receiver. Give one of {@link #invoiceUrl}, {@link #paymentPointer}, or
 * {@link #destinationAddress} with {@link #sharedSecret}.
 */
public class SetupOptions {
    /** Opens the STREAM connection probes travel over. Required. */
    public ProbeChannelFactory channelFactory;

    /** Open Payments invoice URL. */
    public String invoiceUrl;

    /** Payment pointer ({@code $wallet.example/alice}) or SPSP/Open Payments URL. */
    public String paymentPointer;

    /** ILP address of the receiver, with {@link #sharedSecret}. */
    public String destinationAddress;

    /** 32-byte STREAM shared secret, with {@link #destinationAddress}. */
    public byte[] sharedSecret;

    /** Receiver asset when known up front; otherwise the receiver is asked. */
    public Asset destinationAsset;

    /** Null means {@link ProbeSettings#fromEnvironment()}. */
    public ProbeSettings probeSettings;

    /** Null means an {@link org.interledger.pay.client.HttpDestinationResolver} with defaults. */
    public DestinationResolver resolver;

    public SetupOptions() {}

    public SetupOptions(ProbeChannelFactory channelFactory) {
        this.channelFactory = channelFactory;
    }

    /** The target these options describe, or null if none was given. */
    PaymentTarget target() {
        if (invoiceUrl != null) {
            return PaymentTarget.invoice(invoiceUrl);
        }
        if (paymentPointer != null) {
            return PaymentTarget.paymentPointer(paymentPointer);
        }
        if (destinationAddress != null || sharedSecret != null) {
            return PaymentTarget.credentials(destinationAddress, sharedSecret, destinationAsset);
        }
        return null;
    }
}
