package org.interledger.pay.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** JSON returned by an SPSP endpoint ({@code application/spsp4+json}). */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpspResponse {
    /** ILP address of the receiver. */
    @JsonProperty("destination_account")
    public String destinationAccount;

    /** Base64-encoded 32-byte STREAM shared secret. */
    @JsonProperty("shared_secret")
    public String sharedSecret;

    /** Whether the receiver issues STREAM receipts. */
    public Boolean receiptsEnabled;
}
