package com.fintech.candlestream.domain;

import java.util.List;

/**
 * Sequenced group of candles handed from the batcher to broadcast and persistence.
 * 
 * @param sequence Monotonic batch number, starting at 1
 * @param candles Candles in arrival order (defensively copied)
 */
public record CandleBatch(long sequence, List<Candle> candles) {
    
    public CandleBatch {
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one candle");
        }
        candles = List.copyOf(candles);
    }
    
    public int size() {
        return candles.size();
    }
}
