package com.fintech.candlestream.broadcast;

import java.io.IOException;

/**
 * Handle to one connected live consumer of encoded batches.
 */
public interface LiveSubscriber {
    
    String id();
    
    /** True while the subscriber can accept frames. */
    boolean isOpen();
    
    /**
     * Sends one encoded batch. Implementations must not retain or mutate {@code payload}.
     */
    void send(byte[] payload) throws IOException;
}
