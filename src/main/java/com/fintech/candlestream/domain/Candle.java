package com.fintech.candlestream.domain;

/**
 * Immutable OHLCV sample at a single point in time.
 * 
 * @param timestampMs Sample timestamp (epoch millis)
 * @param open Opening price
 * @param high Highest price
 * @param low Lowest price
 * @param close Closing price
 * @param volume Traded volume
 */
public record Candle(
    long timestampMs,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    
    /** Returns a copy whose price and volume fields are rounded to 32-bit floats. */
    public Candle toFloatPrecision() {
        return new Candle(
            timestampMs,
            (float) open,
            (float) high,
            (float) low,
            (float) close,
            (float) volume
        );
    }
}
