package com.fintech.candlestream.aggregation;

import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.domain.CandleBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CandleBatcher Tests")
class CandleBatcherTest {
    
    private static Candle candle(long timestamp) {
        return new Candle(timestamp, 1, 2, 0.5, 1.5, 10);
    }
    
    @Test
    @DisplayName("Should emit a batch every batchSize candles with increasing sequence")
    void testBatching() {
        CandleBatcher batcher = new CandleBatcher(3);
        List<CandleBatch> batches = new ArrayList<>();
        
        for (int i = 0; i < 9; i++) {
            batcher.add(candle(i)).ifPresent(batches::add);
        }
        
        assertThat(batches).extracting(CandleBatch::sequence).containsExactly(1L, 2L, 3L);
        assertThat(batches).allSatisfy(b -> assertThat(b.size()).isEqualTo(3));
        assertThat(batches.get(1).candles()).extracting(Candle::timestampMs).containsExactly(3L, 4L, 5L);
        assertThat(batcher.lastSequence()).isEqualTo(3L);
        assertThat(batcher.pendingCount()).isZero();
    }
    
    @Test
    @DisplayName("Should hold candles until the batch is full")
    void testPending() {
        CandleBatcher batcher = new CandleBatcher(3);
        
        assertThat(batcher.add(candle(1))).isEmpty();
        assertThat(batcher.add(candle(2))).isEmpty();
        
        assertThat(batcher.pendingCount()).isEqualTo(2);
        assertThat(batcher.lastSequence()).isZero();
    }
    
    @Test
    @DisplayName("Should flush a short remainder with the next sequence")
    void testFlushRemainder() {
        CandleBatcher batcher = new CandleBatcher(3);
        batcher.add(candle(1));
        batcher.add(candle(2));
        batcher.add(candle(3));
        batcher.add(candle(4));
        
        Optional<CandleBatch> remainder = batcher.flushRemainder();
        
        assertThat(remainder).isPresent();
        assertThat(remainder.get().sequence()).isEqualTo(2L);
        assertThat(remainder.get().candles()).extracting(Candle::timestampMs).containsExactly(4L);
        assertThat(batcher.flushRemainder()).isEmpty();
    }
    
    @Test
    @DisplayName("Should emit single-candle batches when batchSize is 1")
    void testBatchSizeOne() {
        CandleBatcher batcher = new CandleBatcher(1);
        
        assertThat(batcher.add(candle(1))).map(CandleBatch::sequence).contains(1L);
        assertThat(batcher.add(candle(2))).map(CandleBatch::sequence).contains(2L);
    }
    
    @Test
    @DisplayName("Should reject non-positive batch sizes")
    void testInvalidSize() {
        assertThatThrownBy(() -> new CandleBatcher(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
