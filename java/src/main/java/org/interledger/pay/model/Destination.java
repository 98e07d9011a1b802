package org.interledger.pay.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * STREAM credentials and what is known about the receiver before probing.
 *
 * <p>The shared secret must be exactly {@value #SHARED_SECRET_LENGTH} bytes and the address a
 * valid ILP address; both are checked here so a bad destination cannot be constructed.</p>
 */
public final class Destination {
    public static final int SHARED_SECRET_LENGTH = 32;

    private static final Pattern ILP_ADDRESS = Pattern.compile(
            "^(g|private|example|peer|self|test[1-3]?|local)([.][a-zA-Z0-9_~-]+)+$");
    private static final int MAX_ADDRESS_LENGTH = 1023;

    private final String destinationAddress;
    private final byte[] sharedSecret;
    private final Asset destinationAsset;
    private final Invoice invoice;
    private final String accountUrl;

    /**
     * @throws IllegalArgumentException if the address or shared secret is invalid
     */
    public Destination(String destinationAddress, byte[] sharedSecret, Asset destinationAsset,
                       Invoice invoice, String accountUrl) {
        if (!isValidAddress(destinationAddress)) {
            throw new IllegalArgumentException("Invalid ILP address: " + destinationAddress);
        }
        if (!isValidSharedSecret(sharedSecret)) {
            throw new IllegalArgumentException("Shared secret must be " + SHARED_SECRET_LENGTH + " bytes");
        }
        this.destinationAddress = destinationAddress;
        this.sharedSecret = sharedSecret.clone();
        this.destinationAsset = destinationAsset;
        this.invoice = invoice;
        this.accountUrl = accountUrl;
    }

    public Destination(String destinationAddress, byte[] sharedSecret, Asset destinationAsset) {
        this(destinationAddress, sharedSecret, destinationAsset, null, null);
    }

    public static boolean isValidAddress(String address) {
        return address != null && address.length() <= MAX_ADDRESS_LENGTH && ILP_ADDRESS.matcher(address).matches();
    }

    public static boolean isValidSharedSecret(byte[] secret) {
        return secret != null && secret.length == SHARED_SECRET_LENGTH;
    }

    /** Copy of this destination with the asset learned by probing. */
    public Destination withDestinationAsset(Asset asset) {
        return new Destination(destinationAddress, sharedSecret, asset, invoice, accountUrl);
    }

    public String getDestinationAddress() {
        return destinationAddress;
    }

    public byte[] getSharedSecret() {
        return sharedSecret.clone();
    }

    public Optional<Asset> getDestinationAsset() {
        return Optional.ofNullable(destinationAsset);
    }

    public Optional<Invoice> getInvoice() {
        return Optional.ofNullable(invoice);
    }

    public Optional<String> getAccountUrl() {
        return Optional.ofNullable(accountUrl);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Destination)) return false;
        Destination that = (Destination) o;
        return destinationAddress.equals(that.destinationAddress)
                && Arrays.equals(sharedSecret, that.sharedSecret)
                && Objects.equals(destinationAsset, that.destinationAsset)
                && Objects.equals(invoice, that.invoice)
                && Objects.equals(accountUrl, that.accountUrl);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(destinationAddress, destinationAsset, invoice, accountUrl);
        return 31 * result + Arrays.hashCode(sharedSecret);
    }

    @Override
    public String toString() {
        // excludes the shared secret
        return "Destination{" + destinationAddress + ", asset=" + destinationAsset + "}";
    }
}
