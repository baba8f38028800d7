package com.fintech.candlestream.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Applies the time-based flush threshold when no candles are arriving, for
 * example after a replay source has been exhausted.
 */
@Component
public class SegmentFlushScheduler {
    
    private static final Logger log = LoggerFactory.getLogger(SegmentFlushScheduler.class);
    
    private final SegmentLogWriter writer;
    
    public SegmentFlushScheduler(SegmentLogWriter writer) {
        this.writer = writer;
    }
    
    @Scheduled(fixedDelayString = "${candle.stream.persistence.flush-interval-ms:1000}")
    public void flushIfDue() {
        try {
            if (writer.flushIfDue()) {
                log.debug("Idle flush completed: stream={}", writer.getStreamId());
            }
        } catch (PersistenceException e) {
            log.error("Idle flush failed: stream={}", writer.getStreamId(), e);
        }
    }
}
