package org.interledger.pay;

/** Terminal outcomes a payment setup or quote can fail with. */
public enum PaymentError {
    // Input validation
    InvalidPaymentPointer,
    InvalidCredentials,
    InvalidSourceAmount,
    InvalidDestinationAmount,
    InvalidSlippage,
    UnknownPaymentTarget,
    UnknownSourceAsset,

    // Destination resolution
    QueryFailed,
    InvoiceAlreadyPaid,

    // Probing
    EstablishmentFailed,
    DestinationAssetConflict,
    UnknownDestinationAsset,
    RateProbeFailed,
    ConnectorError,

    // Exchange rate
    ExternalRateUnavailable,
    InsufficientExchangeRate;

    /** True for errors detected locally, before any network traffic. */
    public boolean isValidationError() {
        switch (this) {
            case InvalidPaymentPointer:
            case InvalidCredentials:
            case InvalidSourceAmount:
            case InvalidDestinationAmount:
            case InvalidSlippage:
            case UnknownPaymentTarget:
            case UnknownSourceAsset:
                return true;
            default:
                return false;
        }
    }
}
