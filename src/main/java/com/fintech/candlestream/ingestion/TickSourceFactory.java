package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.config.CandleStreamProperties;
import com.fintech.candlestream.config.ConfigurationException;
import com.fintech.candlestream.domain.TickSourceMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the configured {@link TickSource}. Settings are checked eagerly so an
 * unusable source configuration fails startup rather than the first tick.
 */
public class TickSourceFactory {
    
    private final CandleStreamProperties properties;
    private final Clock clock;
    private final TickPacer pacer;
    
    public TickSourceFactory(CandleStreamProperties properties, Clock clock, TickPacer pacer) {
        this.properties = properties;
        this.clock = clock;
        this.pacer = pacer;
        validate();
    }
    
    /** Opens a fresh source. Each call starts from the beginning. */
    public TickSource create() {
        CandleStreamProperties.Source source = properties.getSource();
        long now = clock.millis();
        
        return switch (source.getMode()) {
            case SYNTHETIC -> new SyntheticTickSource(
                source.getSeed() != null ? source.getSeed() : now,
                now,
                properties.getIntervalMs(),
                source.getStartPrice(),
                source.getVolatility(),
                pacer
            );
            case REPLAY -> new ReplayTickSource(
                Path.of(source.getReplayPath()),
                source.getDelimiter(),
                properties.getIntervalMs(),
                now,
                pacer
            );
        };
    }
    
    private void validate() {
        CandleStreamProperties.Source source = properties.getSource();
        if (source.getMode() == null) {
            throw new ConfigurationException("candle.stream.source.mode is required");
        }
        if (source.getMode() == TickSourceMode.REPLAY) {
            String replayPath = source.getReplayPath();
            if (replayPath == null || replayPath.isBlank()) {
                throw new ConfigurationException("candle.stream.source.replay-path is required in replay mode");
            }
            if (!Files.isReadable(Path.of(replayPath))) {
                throw new ConfigurationException("Replay file is not readable: " + replayPath);
            }
        }
    }
}
