package org.interledger.pay.probe;

/** A STREAM frame decoded from a probe reply. */
public interface StreamFrame {
    /** STREAM frame type identifier. */
    int typeId();
}
