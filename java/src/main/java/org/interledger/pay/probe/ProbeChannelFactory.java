package org.interledger.pay.probe;

import org.interledger.pay.model.Destination;

import java.io.IOException;

/** Opens a {@link ProbeChannel} to a resolved destination. */
@FunctionalInterface
public interface ProbeChannelFactory {
    /**
     * @throws IOException if the transport could not be set up
     */
    ProbeChannel open(Destination destination) throws IOException;
}
