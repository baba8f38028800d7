package com.fintech.candlestream.codec;

import com.fintech.candlestream.domain.BatchMetadata;
import com.fintech.candlestream.domain.Candle;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-layout binary codec for candle batches sent to live subscribers.
 * 
 * <p><b>Layout</b> (little-endian throughout):
 * <pre>
 * Header, 32 bytes
 *   0  u16 version
 *   2  u16 candleCount
 *   4  u32 intervalMs
 *   8  f64 baseTimestampMs
 *  16  f64 sentAtMs
 *  24  u32 sequence
 *  28  u32 reserved (always 0)
 * Record, 24 bytes per candle
 *   0  i32 deltaMs from previous timestamp (0 for the first record)
 *   4  f32 open
 *   8  f32 high
 *  12  f32 low
 *  16  f32 close
 *  20  f32 volume
 * </pre>
 * 
 * <p>Prices and volume lose precision to 32-bit floats; header fields round-trip
 * exactly. Decoded timestamps start from {@code baseTimestampMs} rounded to the
 * nearest millisecond, so they match the encoded candles whenever the base is
 * the first candle's timestamp (the draft default). Instances are stateless apart from the clock and
 * safe to share between threads.
 */
public class CandleBatchCodec {
    
    public static final int HEADER_BYTES = 32;
    public static final int CANDLE_BYTES = 24;
    
    private static final int MAX_U16 = 0xFFFF;
    private static final long MAX_U32 = 0xFFFFFFFFL;
    
    private final Clock clock;
    
    public CandleBatchCodec() {
        this(Clock.systemUTC());
    }
    
    public CandleBatchCodec(Clock clock) {
        this.clock = clock;
    }
    
    /** Total encoded size of a batch holding {@code candleCount} candles. */
    public static int byteLength(int candleCount) {
        return HEADER_BYTES + candleCount * CANDLE_BYTES;
    }
    
    /**
     * Encodes a batch, resolving any header fields the draft leaves unset.
     * 
     * @throws CodecException if {@code candles} is empty or a field does not fit its wire width
     */
    public byte[] encode(BatchMetadata.Draft draft, List<Candle> candles) {
        requireCandles(candles);
        return encode(draft.resolve(candles, clock::millis), candles);
    }
    
    /**
     * Encodes a batch with a fully specified header.
     * 
     * @throws CodecException if {@code candles} is empty or a field does not fit its wire width
     */
    public byte[] encode(BatchMetadata metadata, List<Candle> candles) {
        requireCandles(candles);
        if (candles.size() > MAX_U16) {
            throw new CodecException("Batch too large: " + candles.size() + " candles (max " + MAX_U16 + ")");
        }
        checkRange("version", metadata.version(), MAX_U16);
        checkRange("intervalMs", metadata.intervalMs(), MAX_U32);
        checkRange("sequence", metadata.sequence(), MAX_U32);
        
        ByteBuffer buffer = ByteBuffer.allocate(byteLength(candles.size())).order(ByteOrder.LITTLE_ENDIAN);
        
        buffer.putShort((short) metadata.version());
        buffer.putShort((short) candles.size());
        buffer.putInt((int) metadata.intervalMs());
        buffer.putDouble(metadata.baseTimestampMs());
        buffer.putDouble(metadata.sentAtMs());
        buffer.putInt((int) metadata.sequence());
        buffer.putInt(0);
        
        long previous = candles.get(0).timestampMs();
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            long delta = i == 0 ? 0L : candle.timestampMs() - previous;
            if (delta < Integer.MIN_VALUE || delta > Integer.MAX_VALUE) {
                throw new CodecException("Timestamp delta out of i32 range at index " + i + ": " + delta);
            }
            buffer.putInt((int) delta);
            buffer.putFloat((float) candle.open());
            buffer.putFloat((float) candle.high());
            buffer.putFloat((float) candle.low());
            buffer.putFloat((float) candle.close());
            buffer.putFloat((float) candle.volume());
            previous = candle.timestampMs();
        }
        
        return buffer.array();
    }
    
    /**
     * Decodes a buffer produced by {@link #encode}.
     * 
     * @throws CodecException if the buffer is shorter than a header or its length
     *         disagrees with the header's candle count
     */
    public DecodedBatch decode(byte[] bytes) {
        return decode(ByteBuffer.wrap(bytes));
    }
    
    /**
     * Decodes the remaining bytes of {@code source} without moving its position.
     */
    public DecodedBatch decode(ByteBuffer source) {
        ByteBuffer buffer = source.slice().order(ByteOrder.LITTLE_ENDIAN);
        int length = buffer.remaining();
        if (length < HEADER_BYTES) {
            throw new CodecException("Buffer too small for batch header: " + length + " bytes");
        }
        
        int version = Short.toUnsignedInt(buffer.getShort(0));
        int candleCount = Short.toUnsignedInt(buffer.getShort(2));
        long intervalMs = Integer.toUnsignedLong(buffer.getInt(4));
        double baseTimestampMs = buffer.getDouble(8);
        double sentAtMs = buffer.getDouble(16);
        long sequence = Integer.toUnsignedLong(buffer.getInt(24));
        
        int expected = byteLength(candleCount);
        if (length != expected) {
            throw new CodecException("Buffer length mismatch: expected " + expected + " bytes, received " + length);
        }
        
        List<Candle> candles = new ArrayList<>(candleCount);
        long timestamp = Math.round(baseTimestampMs);
        int offset = HEADER_BYTES;
        for (int i = 0; i < candleCount; i++) {
            int delta = buffer.getInt(offset);
            if (i > 0) {
                timestamp += delta;
            }
            candles.add(new Candle(
                timestamp,
                buffer.getFloat(offset + 4),
                buffer.getFloat(offset + 8),
                buffer.getFloat(offset + 12),
                buffer.getFloat(offset + 16),
                buffer.getFloat(offset + 20)
            ));
            offset += CANDLE_BYTES;
        }
        
        return new DecodedBatch(
            new BatchMetadata(version, intervalMs, baseTimestampMs, sentAtMs, sequence),
            candles
        );
    }
    
    private static void requireCandles(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new CodecException("Cannot encode empty batch");
        }
    }
    
    private static void checkRange(String field, long value, long max) {
        if (value < 0 || value > max) {
            throw new CodecException(field + " out of range: " + value);
        }
    }
}
