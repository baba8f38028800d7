package com.fintech.candlestream.domain;

/**
 * Where flushed segments go.
 */
public enum PersistenceMode {
    /** Candles are dropped; manifest and latest-segment cache never change. */
    DISABLED,
    /** Segments, latest body and manifest are written under the local storage root. */
    LOCAL
}
