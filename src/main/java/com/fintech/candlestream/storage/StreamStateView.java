package com.fintech.candlestream.storage;

import com.fintech.candlestream.domain.Manifest;

import java.util.Optional;

/**
 * Read-only view of a stream's persisted state, for external readers.
 */
public interface StreamStateView {
    
    /** Current manifest; the initial manifest (no segment, sequence 0) before any flush. */
    Manifest getManifestSnapshot();
    
    /** Newline-delimited body of the most recently flushed segment, empty before any flush. */
    Optional<String> getLatestSegment();
}
