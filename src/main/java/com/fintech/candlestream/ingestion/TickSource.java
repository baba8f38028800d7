package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.domain.Candle;

import java.util.Iterator;

/**
 * Lazy sequence of candles.
 * 
 * <p>{@link #hasNext()} returning false means the source is exhausted, which is
 * a normal end of stream and not an error. Consumers may stop iterating at
 * any point and must then call {@link #close()}.
 */
public interface TickSource extends Iterator<Candle>, AutoCloseable {
    
    /** Releases any underlying resource. Idempotent; never throws. */
    @Override
    void close();
}
