package org.interledger.pay.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.config.PayDefaults;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Destination;
import org.interledger.pay.model.Invoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Optional;

/**
 * Resolves payment pointers (SPSP or Open Payments accounts), Open Payments invoices and
 * raw STREAM credentials using {@link HttpClient} and Jackson.
 *
 * <p>Every HTTP or parsing failure ends as {@link PaymentError#QueryFailed}. Redirects are
 * followed, but a chain that ends on a non-HTTPS URL is rejected.</p>
 */
public class HttpDestinationResolver implements DestinationResolver {
    private static final Logger logger = LoggerFactory.getLogger(HttpDestinationResolver.class);

    static final String STREAM_JSON = "application/ilp-stream+json";
    static final String SPSP_JSON = "application/spsp4+json";

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Duration queryTimeout;
    private final boolean allowInsecure;

    public HttpDestinationResolver() {
        this(Duration.ofMillis(PayDefaults.DEFAULT_QUERY_TIMEOUT_MS), false);
    }

    /**
     * @param queryTimeout bound on each HTTP query
     * @param allowInsecure accept plain {@code http://} URLs; for local testing only
     */
    public HttpDestinationResolver(Duration queryTimeout, boolean allowInsecure) {
        this.queryTimeout = queryTimeout;
        this.allowInsecure = allowInsecure;
        this.http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(queryTimeout)
                .build();
    }

    @Override
    public Destination resolve(PaymentTarget target) throws PaymentException, InterruptedException {
        if (target == null) {
            throw new PaymentException(PaymentError.InvalidCredentials, "no payment pointer, invoice or credentials");
        }
        switch (target.kind) {
            case INVOICE:
                return resolveInvoice(target.invoiceUrl);
            case PAYMENT_POINTER:
                return resolvePaymentPointer(target.paymentPointer);
            case CREDENTIALS:
            default:
                return resolveCredentials(target);
        }
    }

    private Destination resolveCredentials(PaymentTarget target) throws PaymentException {
        byte[] secret = target.getSharedSecret();
        if (!Destination.isValidAddress(target.destinationAddress) || !Destination.isValidSharedSecret(secret)) {
            throw new PaymentException(PaymentError.InvalidCredentials,
                    "invalid STREAM credentials for " + target.destinationAddress);
        }
        if (target.destinationAsset != null && !target.destinationAsset.isValid()) {
            throw new PaymentException(PaymentError.InvalidCredentials, "invalid destination asset " + target.destinationAsset);
        }
        return new Destination(target.destinationAddress, secret, target.destinationAsset);
    }

    private Destination resolvePaymentPointer(String pointer) throws PaymentException, InterruptedException {
        URI url = PaymentPointer.toUrl(pointer, allowInsecure);
        JsonNode body = query(url, STREAM_JSON + ", " + SPSP_JSON);
        try {
            if (body.has("ilpAddress")) {
                OpenPaymentsAccount account = mapper.treeToValue(body, OpenPaymentsAccount.class);
                Asset asset = account.assetCode == null || account.assetScale == null
                        ? null
                        : new Asset(account.assetCode, account.assetScale);
                if (asset != null && !asset.isValid()) {
                    throw queryFailed(url, "invalid asset " + asset);
                }
                return destination(url, account.ilpAddress, account.sharedSecret, asset, null,
                        account.id != null ? account.id : url.toString());
            }
            SpspResponse spsp = mapper.treeToValue(body, SpspResponse.class);
            return destination(url, spsp.destinationAccount, spsp.sharedSecret, null, null, url.toString());
        } catch (JsonProcessingException e) {
            throw queryFailed(url, e.getOriginalMessage());
        }
    }

    private Destination resolveInvoice(String invoiceUrl) throws PaymentException, InterruptedException {
        URI url = secureUrl(invoiceUrl).orElseThrow(() -> queryFailed(invoiceUrl, "invoice URL must be HTTPS"));
        JsonNode body = query(url, STREAM_JSON);

        InvoiceResponse invoice;
        try {
            invoice = mapper.treeToValue(body, InvoiceResponse.class);
        } catch (JsonProcessingException e) {
            throw queryFailed(url, e.getOriginalMessage());
        }
        if (invoice.id == null || invoice.account == null || invoice.amount == null || invoice.received == null
                || invoice.assetCode == null || invoice.assetScale == null || invoice.expiresAt == null) {
            throw queryFailed(url, "incomplete invoice");
        }

        Optional<URI> accountUrl = secureUrl(invoice.account);
        if (accountUrl.isEmpty() || !invoiceUrl.startsWith(stripTrailingSlash(invoice.account) + "/")) {
            throw queryFailed(url, "invoice does not belong to account " + invoice.account);
        }
        String amount = invoice.amount;
        String received = invoice.received;
        Amount amountToDeliver = Amount.parse(amount)
                .orElseThrow(() -> queryFailed(url, "invalid invoice amount " + amount));
        Amount amountDelivered = Amount.parse(received)
                .orElseThrow(() -> queryFailed(url, "invalid received amount " + received));
        long expiresAt;
        try {
            expiresAt = Instant.parse(invoice.expiresAt).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw queryFailed(url, "invalid expiry " + invoice.expiresAt);
        }
        Asset asset = new Asset(invoice.assetCode, invoice.assetScale);
        if (!asset.isValid()) {
            throw queryFailed(url, "invalid asset " + asset);
        }

        Invoice details = new Invoice(invoiceUrl, invoice.account, expiresAt, invoice.description,
                amountDelivered, amountToDeliver);
        return destination(url, invoice.ilpAddress, invoice.sharedSecret, asset, details, invoice.account);
    }

    private Destination destination(URI url, String address, String sharedSecretBase64, Asset asset,
                                    Invoice invoice, String accountUrl) throws PaymentException {
        byte[] secret = decodeSecret(sharedSecretBase64);
        if (!Destination.isValidAddress(address) || !Destination.isValidSharedSecret(secret)) {
            throw queryFailed(url, "invalid STREAM credentials in response");
        }
        return new Destination(address, secret, asset, invoice, accountUrl);
    }

    /** Null if absent or not base64. */
    private static byte[] decodeSecret(String base64) {
        if (base64 == null) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            logger.debug("Shared secret is not valid base64: {}", e.getMessage());
            return null;
        }
    }

    /**
     * GETs {@code url} and parses a JSON object body.
     *
     * @throws PaymentException {@code QueryFailed} on transport error, non-200 status,
     *     insecure final URL, or a body that is not a JSON object
     */
    private JsonNode query(URI url, String accept) throws PaymentException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(queryTimeout)
                .header("Accept", accept)
                .GET()
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("HTTP " + response.statusCode() + ": " + response.body());
            }
            if (!isAllowedScheme(response.uri())) {
                throw new IOException("Redirected to insecure URL " + response.uri());
            }
            JsonNode body = mapper.readTree(response.body());
            if (body == null || !body.isObject()) {
                throw new IOException("Response is not a JSON object");
            }
            return body;
        } catch (IOException e) {
            throw queryFailed(url, e.getMessage());
        }
    }

    private Optional<URI> secureUrl(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(raw);
            return isAllowedScheme(uri) && uri.getHost() != null ? Optional.of(uri) : Optional.empty();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    private boolean isAllowedScheme(URI uri) {
        String scheme = uri.getScheme();
        return "https".equals(scheme) || (allowInsecure && "http".equals(scheme));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static PaymentException queryFailed(Object url, String reason) {
        logger.warn("Query to {} failed: {}", url, reason);
        return new PaymentException(PaymentError.QueryFailed, url + ": " + reason);
    }
}
