package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.util.SeededRandom;

/**
 * Infinite random-walk candle generator.
 * 
 * <p>Each candle opens at the previous close and drifts by at most
 * {@code volatility / 2} in either direction. Wicks extend up to
 * {@code volatility / 2} beyond the body. Close never drops below 1.
 * Given the same seed and start timestamp the output is identical.
 */
public class SyntheticTickSource extends PacedTickSource {
    
    private static final double MIN_PRICE = 1.0;
    private static final double BASE_VOLUME = 10_000.0;
    private static final double VOLUME_SPREAD = 5_000.0;
    
    private final SeededRandom random;
    private final long intervalMs;
    private final double volatility;
    
    private long lastTimestamp;
    private double lastClose;
    
    public SyntheticTickSource(
            long seed,
            long startTimestampMs,
            long intervalMs,
            double startPrice,
            double volatility,
            TickPacer pacer) {
        super(pacer, intervalMs);
        this.random = new SeededRandom(seed);
        this.intervalMs = intervalMs;
        this.volatility = volatility;
        this.lastTimestamp = startTimestampMs;
        this.lastClose = startPrice;
    }
    
    @Override
    protected Candle computeNext() {
        lastTimestamp += intervalMs;
        
        double drift = (random.nextDouble() - 0.5) * volatility;
        double open = lastClose;
        double close = Math.max(MIN_PRICE, open + drift);
        double high = Math.max(open, close) + random.nextDouble() * (volatility / 2);
        double low = Math.min(open, close) - random.nextDouble() * (volatility / 2);
        double volume = BASE_VOLUME + random.nextDouble() * VOLUME_SPREAD;
        
        lastClose = close;
        return new Candle(lastTimestamp, open, high, low, close, volume);
    }
}
