package com.fintech.candlestream.aggregation;

import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.domain.CandleBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Groups candles into fixed-size batches and stamps each batch with the next
 * sequence number.
 * 
 * <p>Sequences start at 1 and are scoped to this instance; independent streams
 * use independent batchers. Candles keep their arrival order within and across
 * batches. Thread-safe, although the tick loop is its only caller.
 */
public class CandleBatcher {
    
    private final int batchSize;
    private final List<Candle> pending;
    private long sequence;
    
    public CandleBatcher(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.pending = new ArrayList<>(batchSize);
    }
    
    /**
     * Adds a candle; returns the completed batch once {@code batchSize} candles
     * have accumulated.
     */
    public synchronized Optional<CandleBatch> add(Candle candle) {
        pending.add(candle);
        if (pending.size() < batchSize) {
            return Optional.empty();
        }
        return Optional.of(drain());
    }
    
    /**
     * Emits whatever is pending as a short final batch. Used when a finite
     * source runs out.
     */
    public synchronized Optional<CandleBatch> flushRemainder() {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(drain());
    }
    
    /** Sequence of the most recently emitted batch, 0 before the first. */
    public synchronized long lastSequence() {
        return sequence;
    }
    
    public synchronized int pendingCount() {
        return pending.size();
    }
    
    private CandleBatch drain() {
        List<Candle> candles = new ArrayList<>(pending);
        pending.clear();
        sequence++;
        return new CandleBatch(sequence, candles);
    }
}
