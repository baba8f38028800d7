package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.domain.Candle;

import java.util.NoSuchElementException;

/**
 * Base for tick sources that emit one candle per inter-tick delay.
 * 
 * <p>The delay is taken in {@link #hasNext()} before every candle except the
 * first, so the consumer is suspended only while asking for the next item.
 * An interrupt during the delay ends the sequence cleanly and re-asserts the
 * thread's interrupt flag.
 */
abstract class PacedTickSource implements TickSource {
    
    private final TickPacer pacer;
    private final long delayMs;
    
    private Candle next;
    private boolean started;
    private boolean finished;
    
    protected PacedTickSource(TickPacer pacer, long delayMs) {
        this.pacer = pacer;
        this.delayMs = delayMs;
    }
    
    /**
     * Produces the next candle, or {@code null} once the source is exhausted.
     */
    protected abstract Candle computeNext();
    
    /** Hook for releasing resources; called once. */
    protected void onClose() {
    }
    
    @Override
    public final boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        if (started) {
            try {
                pacer.pause(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                return false;
            }
        }
        started = true;
        next = computeNext();
        if (next == null) {
            close();
            return false;
        }
        return true;
    }
    
    @Override
    public final Candle next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Tick source exhausted");
        }
        Candle result = next;
        next = null;
        return result;
    }
    
    @Override
    public final void close() {
        next = null;
        if (!finished) {
            finished = true;
            onClose();
        }
    }
}
