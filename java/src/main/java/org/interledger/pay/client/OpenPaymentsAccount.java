package org.interledger.pay.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** JSON returned for an Open Payments account ({@code application/ilp-stream+json}). */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenPaymentsAccount {
    /** Account URL. */
    public String id;

    /** Base URL of the wallet servicing the account. */
    public String accountServicer;

    public String ilpAddress;

    /** Base64-encoded 32-byte STREAM shared secret. */
    public String sharedSecret;

    public String assetCode;

    public Integer assetScale;
}
