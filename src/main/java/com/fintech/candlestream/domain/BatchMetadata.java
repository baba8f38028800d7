package com.fintech.candlestream.domain;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * Header fields carried by every encoded candle batch.
 * 
 * <p>All numeric fields are stored unsigned on the wire: {@code version} as u16,
 * {@code intervalMs} and {@code sequence} as u32. Java {@code int}/{@code long}
 * are used so the full unsigned range is representable.
 * 
 * @param version Wire format version
 * @param intervalMs Nominal spacing between candles
 * @param baseTimestampMs Timestamp of the first candle in the batch
 * @param sentAtMs Wall-clock time the batch was encoded
 * @param sequence Batch sequence number within one pipeline
 */
public record BatchMetadata(
    int version,
    long intervalMs,
    double baseTimestampMs,
    double sentAtMs,
    long sequence
) {
    
    public static final int DEFAULT_VERSION = 1;
    
    /** Interval assumed when a batch has fewer than two candles to infer from. */
    public static final long FALLBACK_INTERVAL_MS = 65L;
    
    /** Starts a partially specified header; unset fields are resolved at encode time. */
    public static Draft draft() {
        return new Draft();
    }
    
    /**
     * Mutable header with optional fields. Anything left unset is resolved
     * against the candles being encoded by {@link #resolve(List, LongSupplier)}.
     */
    public static final class Draft {
        private Integer version;
        private Long intervalMs;
        private Double baseTimestampMs;
        private Double sentAtMs;
        private Long sequence;
        
        private Draft() {
        }
        
        public Draft version(int version) {
            this.version = version;
            return this;
        }
        
        public Draft intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }
        
        public Draft baseTimestampMs(double baseTimestampMs) {
            this.baseTimestampMs = baseTimestampMs;
            return this;
        }
        
        public Draft sentAtMs(double sentAtMs) {
            this.sentAtMs = sentAtMs;
            return this;
        }
        
        public Draft sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }
        
        /**
         * Applies defaults: base timestamp from the first candle, sequence 0,
         * interval inferred from the mean timestamp delta and sentAt from the clock.
         */
        public BatchMetadata resolve(List<Candle> candles, LongSupplier nowMs) {
            return new BatchMetadata(
                version != null ? version : DEFAULT_VERSION,
                intervalMs != null ? intervalMs : inferInterval(candles),
                baseTimestampMs != null ? baseTimestampMs : (double) candles.get(0).timestampMs(),
                sentAtMs != null ? sentAtMs : (double) nowMs.getAsLong(),
                sequence != null ? sequence : 0L
            );
        }
    }
    
    /** Mean delta between consecutive timestamps, rounded to the nearest millisecond. */
    static long inferInterval(List<Candle> candles) {
        if (candles.size() < 2) {
            return FALLBACK_INTERVAL_MS;
        }
        long span = candles.get(candles.size() - 1).timestampMs() - candles.get(0).timestampMs();
        return Math.round((double) span / (candles.size() - 1));
    }
}
