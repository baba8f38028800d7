package com.fintech.candlestream.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * Recovery pointer for one stream: the latest flushed segment and the
 * sequence it was written under.
 * 
 * @param streamId Stream the manifest belongs to
 * @param latestSegmentPath Segment path relative to the storage root, null until the first flush
 * @param sequence Sequence of the latest flushed segment (0 before any flush)
 * @param intervalMs Tick interval of the stream
 * @param updatedAtMs Last time the manifest changed
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Manifest(
    String streamId,
    String latestSegmentPath,
    long sequence,
    long intervalMs,
    long updatedAtMs
) {
    
    /** Fresh manifest for a stream that has not flushed anything yet. */
    public static Manifest initial(String streamId, long intervalMs, long nowMs) {
        return new Manifest(streamId, null, 0L, intervalMs, nowMs);
    }
    
    /** Returns a copy pointing at a newly flushed segment. */
    public Manifest advance(String segmentPath, long newSequence, long nowMs) {
        return new Manifest(streamId, segmentPath, newSequence, intervalMs, nowMs);
    }
    
    @JsonIgnore
    public Optional<String> latestSegment() {
        return Optional.ofNullable(latestSegmentPath);
    }
}
