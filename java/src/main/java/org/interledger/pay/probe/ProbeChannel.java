package org.interledger.pay.probe;

import org.interledger.pay.model.Amount;

import java.io.Closeable;
import java.io.IOException;

/**
 * Request/response primitive over a STREAM connection: send one unfulfillable test
 * packet and report how the path answered. Implementations may be called from several
 * threads at once with different amounts.
 */
public interface ProbeChannel extends Closeable {
    /**
     * Sends a test packet of {@code amount} source units.
     *
     * @param amount amount to send; may be zero
     * @return the fulfill or reject, with any STREAM frames and F08 metadata
     * @throws IOException if the underlying plugin failed to send or the reply could not be read
     * @throws InterruptedException if the call was interrupted
     */
    ProbeReply sendProbe(Amount amount) throws IOException, InterruptedException;
}
