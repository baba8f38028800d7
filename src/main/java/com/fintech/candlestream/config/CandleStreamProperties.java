package com.fintech.candlestream.config;

import com.fintech.candlestream.domain.PersistenceMode;
import com.fintech.candlestream.domain.TickSourceMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the candle stream pipeline.
 * Maps to 'candle.stream.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "candle.stream")
public class CandleStreamProperties {
    
    @NotBlank
    private String streamId;
    
    @Positive
    private long intervalMs = 65L;
    
    @Positive
    private int batchSize = 3;
    
    @Valid
    private Source source = new Source();
    @Valid
    private Persistence persistence = new Persistence();
    @Valid
    private Broadcast broadcast = new Broadcast();
    @Valid
    private Disruptor disruptor = new Disruptor();
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Dataset dataset = new Dataset();
    
    @Data
    public static class Source {
        @NotNull
        private TickSourceMode mode = TickSourceMode.SYNTHETIC;
        private Long seed;  // null = seed from the clock
        @Positive
        private double startPrice = 100.0;
        @Positive
        private double volatility = 0.8;
        private String replayPath;
        @NotBlank
        private String delimiter = ",";
    }
    
    @Data
    public static class Persistence {
        @NotNull
        private PersistenceMode mode = PersistenceMode.LOCAL;
        @NotBlank
        private String localRoot = "data/local-segments";
        @Positive
        private long flushIntervalMs = 1_000L;
        @Positive
        private long segmentTargetBytes = 64L * 1024;
        @Positive
        private int maxPendingCandles = 100_000;
        private long flushWaitMs = 30_000L;  // max wait for the single flush slot
    }
    
    @Data
    public static class Broadcast {
        @NotBlank
        private String path = "/ws/candles";
        private String allowedOrigins = "*";
        @Positive
        private int sendTimeLimitMs = 5_000;
        @Positive
        private int bufferSizeLimit = 512 * 1024;
        @Positive
        private int maxQueuedBatches = 256;  // per subscriber, beyond this batches are skipped
    }
    
    @Data
    public static class Disruptor {
        @Positive
        private int bufferSize = 1024;
        private String waitStrategy = "BLOCKING";
    }
    
    @Data
    public static class Pipeline {
        private boolean enabled = true;
    }
    
    @Data
    public static class Dataset {
        private String outputPath;
        @Positive
        private int count = 1024;
    }
}
