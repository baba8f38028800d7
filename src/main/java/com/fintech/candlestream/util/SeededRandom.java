package com.fintech.candlestream.util;

/**
 * Small deterministic 32-bit generator (mulberry32).
 * 
 * <p>Two instances created with the same seed produce identical sequences,
 * which keeps synthetic streams reproducible in tests. Not thread-safe.
 */
public final class SeededRandom {
    
    private static final double TWO_POW_32 = 4294967296.0;
    
    private int state;
    
    public SeededRandom(long seed) {
        this.state = (int) seed;
    }
    
    /** Next value uniformly distributed in [0, 1). */
    public double nextDouble() {
        state += 0x6D2B79F5;
        int t = state;
        t = (t ^ (t >>> 15)) * (t | 1);
        t ^= t + (t ^ (t >>> 7)) * (t | 61);
        return Integer.toUnsignedLong(t ^ (t >>> 14)) / TWO_POW_32;
    }
}
