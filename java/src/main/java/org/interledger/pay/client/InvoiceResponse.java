package org.interledger.pay.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** JSON returned for an Open Payments invoice ({@code application/ilp-stream+json}). */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InvoiceResponse {
    /** Invoice URL. */
    public String id;

    /** URL of the account the invoice belongs to. */
    public String account;

    /** Total to deliver, as a u64 integer string. */
    public String amount;

    /** Already delivered, as a u64 integer string. */
    public String received;

    public String assetCode;

    public Integer assetScale;

    /** ISO-8601 expiry timestamp. */
    public String expiresAt;

    public String description;

    public String ilpAddress;

    /** Base64-encoded 32-byte STREAM shared secret. */
    public String sharedSecret;
}
