package org.interledger.pay.client;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Payment pointer syntax: {@code $wallet.example/alice} stands for
 * {@code https://wallet.example/alice}, and a pointer with no path for
 * {@code https://wallet.example/.well-known/pay}. A full HTTPS URL is accepted as is.
 */
public final class PaymentPointer {
    static final String WELL_KNOWN_PATH = "/.well-known/pay";

    private PaymentPointer() {
    }

    /**
     * @param allowInsecure accept {@code http://} URLs (local testing only)
     * @throws PaymentException {@code InvalidPaymentPointer} if the pointer is malformed,
     *     carries a query or fragment, or is not HTTPS
     */
    public static URI toUrl(String pointer, boolean allowInsecure) throws PaymentException {
        if (pointer == null || pointer.isBlank()) {
            throw invalid(pointer);
        }
        String raw = pointer.startsWith("$") ? "https://" + pointer.substring(1) : pointer;
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            throw invalid(pointer);
        }
        String scheme = uri.getScheme();
        boolean schemeOk = "https".equals(scheme) || (allowInsecure && "http".equals(scheme));
        if (!schemeOk || uri.getHost() == null || uri.getUserInfo() != null
                || uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw invalid(pointer);
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            path = WELL_KNOWN_PATH;
        }
        try {
            return new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(), null, null, null).resolve(path);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw invalid(pointer);
        }
    }

    private static PaymentException invalid(String pointer) {
        return new PaymentException(PaymentError.InvalidPaymentPointer, "invalid payment pointer: " + pointer);
    }
}
