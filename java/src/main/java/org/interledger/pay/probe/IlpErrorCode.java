package org.interledger.pay.probe;

/** ILP reject codes the prober distinguishes. Unlisted codes map to {@link #F00_BAD_REQUEST}. */
public enum IlpErrorCode {
    F00_BAD_REQUEST("F00"),
    F02_UNREACHABLE("F02"),
    F06_UNEXPECTED_PAYMENT("F06"),
    F08_AMOUNT_TOO_LARGE("F08"),
    F99_APPLICATION_ERROR("F99"),
    T00_INTERNAL_ERROR("T00"),
    T01_PEER_UNREACHABLE("T01"),
    T04_INSUFFICIENT_LIQUIDITY("T04"),
    R00_TRANSFER_TIMED_OUT("R00");

    private final String code;

    IlpErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** T-class errors may succeed if the same packet is retried. */
    public boolean isTemporary() {
        return code.charAt(0) == 'T';
    }

    public static IlpErrorCode fromCode(String code) {
        for (IlpErrorCode c : values()) {
            if (c.code.equals(code)) {
                return c;
            }
        }
        return F00_BAD_REQUEST;
    }
}
