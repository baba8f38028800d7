package com.fintech.candlestream.domain;

/**
 * Origin of the candle stream.
 */
public enum TickSourceMode {
    /** Seeded random walk, infinite. */
    SYNTHETIC,
    /** Delimited historical file, finite. */
    REPLAY
}
