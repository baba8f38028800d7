package com.fintech.candlestream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Candle Stream Service
 * 
 * Ingests a continuous stream of OHLCV candles, broadcasts them to live
 * subscribers in a compact binary format and persists them as an
 * append-only segmented log that survives restarts.
 * 
 * Key Features:
 * - Synthetic (seeded random walk) or replayed tick sources
 * - LMAX Disruptor hand-off so broadcast and persistence never block each other
 * - Fixed-layout little-endian batch codec for WebSocket subscribers
 * - Size/time triggered segment flushes with a crash-safe manifest
 * - Read-only state API (manifest and latest segment)
 * 
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class CandleStreamApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(CandleStreamApplication.class, args);
    }
}
