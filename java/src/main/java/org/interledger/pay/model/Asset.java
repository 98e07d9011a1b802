package org.interledger.pay.model;

import java.util.Objects;

/** Asset identity: code plus the number of decimal places between raw units and display units. */
public final class Asset {
    public static final int MIN_SCALE = 0;
    public static final int MAX_SCALE = 255;

    public final String code;   // e.g. "USD"
    public final int scale;     // e.g. 2 means 1 raw unit = 0.01 USD

    public Asset(String code, int scale) {
        this.code = code;
        this.scale = scale;
    }

    /** Non-empty code and a scale in {@code [0, 255]}. */
    public boolean isValid() {
        return code != null && !code.isEmpty() && scale >= MIN_SCALE && scale <= MAX_SCALE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Asset)) return false;
        Asset asset = (Asset) o;
        return scale == asset.scale && Objects.equals(code, asset.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, scale);
    }

    @Override
    public String toString() {
        return code + "/" + scale;
    }
}
