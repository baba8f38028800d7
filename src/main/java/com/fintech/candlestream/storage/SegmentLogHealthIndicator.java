package com.fintech.candlestream.storage;

import com.fintech.candlestream.domain.Manifest;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports segment log state under {@code /actuator/health}. Stays UP after a
 * failed flush, since persistence is best-effort, but exposes the error.
 */
@Component("segmentLog")
public class SegmentLogHealthIndicator implements HealthIndicator {
    
    private final SegmentLogWriter writer;
    
    public SegmentLogHealthIndicator(SegmentLogWriter writer) {
        this.writer = writer;
    }
    
    @Override
    public Health health() {
        Manifest manifest = writer.getManifestSnapshot();
        Health.Builder builder = Health.up()
            .withDetail("stream", manifest.streamId())
            .withDetail("mode", writer.getMode())
            .withDetail("sequence", manifest.sequence())
            .withDetail("latestSegment", manifest.latestSegment().orElse("none"))
            .withDetail("pendingCandles", writer.pendingCount());
        writer.getLastFlushError().ifPresent(error -> builder.withDetail("lastFlushError", error));
        return builder.build();
    }
}
