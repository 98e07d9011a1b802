package org.interledger.pay.probe;

import org.interledger.pay.model.Asset;

/** ConnectionAssetDetails frame: the receiver declaring the asset it is paid in. */
public final class AssetDetailsFrame implements StreamFrame {
    public static final int TYPE_ID = 0x07;

    public final String assetCode;
    public final int assetScale;

    public AssetDetailsFrame(String assetCode, int assetScale) {
        this.assetCode = assetCode;
        this.assetScale = assetScale;
    }

    public Asset asset() {
        return new Asset(assetCode, assetScale);
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }
}
