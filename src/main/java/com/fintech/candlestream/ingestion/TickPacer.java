package com.fintech.candlestream.ingestion;

/**
 * Waits between consecutive ticks.
 */
@FunctionalInterface
public interface TickPacer {
    
    void pause(long millis) throws InterruptedException;
    
    /** Real-time pacing backed by {@link Thread#sleep(long)}. */
    static TickPacer sleeping() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
    
    /** No delay at all; used for tests and dataset generation. */
    static TickPacer none() {
        return millis -> { };
    }
}
