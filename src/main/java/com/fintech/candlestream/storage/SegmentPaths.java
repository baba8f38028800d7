package com.fintech.candlestream.storage;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Deterministic layout of a stream's files relative to the storage root.
 * 
 * <pre>
 * &lt;streamId&gt;/manifest.json
 * &lt;streamId&gt;/latest.log
 * &lt;streamId&gt;/&lt;yyyyMMdd&gt;/&lt;HH&gt;/&lt;sequence, 6 digits&gt;.log
 * </pre>
 * 
 * Date and hour come from the first candle of the segment, in UTC.
 */
public final class SegmentPaths {
    
    public static final String SEGMENT_EXTENSION = ".log";
    
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HOUR = DateTimeFormatter.ofPattern("HH").withZone(ZoneOffset.UTC);
    
    private SegmentPaths() {
    }
    
    public static String segmentPath(String streamId, long firstTimestampMs, long sequence) {
        Instant instant = Instant.ofEpochMilli(firstTimestampMs);
        return streamId
            + "/" + DAY.format(instant)
            + "/" + HOUR.format(instant)
            + "/" + String.format("%06d", sequence) + SEGMENT_EXTENSION;
    }
    
    public static String latestPath(String streamId) {
        return streamId + "/latest" + SEGMENT_EXTENSION;
    }
    
    public static String manifestPath(String streamId) {
        return streamId + "/manifest.json";
    }
}
