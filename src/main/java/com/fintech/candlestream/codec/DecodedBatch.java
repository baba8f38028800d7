package com.fintech.candlestream.codec;

import com.fintech.candlestream.domain.BatchMetadata;
import com.fintech.candlestream.domain.Candle;

import java.util.List;

/**
 * Header and candles read back from an encoded buffer.
 */
public record DecodedBatch(BatchMetadata metadata, List<Candle> candles) {
    
    public DecodedBatch {
        candles = List.copyOf(candles);
    }
}
