package com.fintech.candlestream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlestream.aggregation.CandleBatcher;
import com.fintech.candlestream.broadcast.BroadcastDistributor;
import com.fintech.candlestream.broadcast.SubscriberRegistry;
import com.fintech.candlestream.codec.CandleBatchCodec;
import com.fintech.candlestream.ingestion.BatchEventPublisher;
import com.fintech.candlestream.ingestion.TickPacer;
import com.fintech.candlestream.ingestion.TickPipeline;
import com.fintech.candlestream.ingestion.TickSourceFactory;
import com.fintech.candlestream.storage.SegmentLogWriter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Spring configuration for the ingestion, broadcast and persistence pipeline.
 */
@Configuration
public class ApplicationConfig {
    
    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public CandleBatchCodec candleBatchCodec(Clock clock) {
        return new CandleBatchCodec(clock);
    }
    
    @Bean
    public SubscriberRegistry subscriberRegistry() {
        return new SubscriberRegistry();
    }
    
    @Bean
    public ThreadPoolTaskExecutor broadcastExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("broadcast-send-");
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(1024);
        return executor;
    }
    
    @Bean
    public BroadcastDistributor broadcastDistributor(
            CandleBatchCodec codec,
            SubscriberRegistry registry,
            ThreadPoolTaskExecutor broadcastExecutor,
            CandleStreamProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new BroadcastDistributor(
            codec,
            registry,
            broadcastExecutor,
            properties.getIntervalMs(),
            properties.getBroadcast().getMaxQueuedBatches(),
            clock,
            meterRegistry);
    }
    
    @Bean(destroyMethod = "shutdown")
    public SegmentLogWriter segmentLogWriter(
            CandleStreamProperties properties,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {
        log.info("Candle stream configured: stream={}, intervalMs={}, batchSize={}, source={}, persistence={}, root={}",
            properties.getStreamId(), properties.getIntervalMs(), properties.getBatchSize(),
            properties.getSource().getMode(), properties.getPersistence().getMode(),
            properties.getPersistence().getLocalRoot());
        
        SegmentLogWriter writer = new SegmentLogWriter(
            SegmentLogWriter.Settings.from(properties), objectMapper, clock, meterRegistry);
        writer.hydrateFromDisk();
        return writer;
    }
    
    @Bean
    public TickSourceFactory tickSourceFactory(CandleStreamProperties properties, Clock clock) {
        return new TickSourceFactory(properties, clock, TickPacer.sleeping());
    }
    
    @Bean
    public CandleBatcher candleBatcher(CandleStreamProperties properties) {
        return new CandleBatcher(properties.getBatchSize());
    }
    
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public BatchEventPublisher batchEventPublisher(
            BroadcastDistributor distributor,
            SegmentLogWriter writer,
            CandleStreamProperties properties,
            MeterRegistry meterRegistry) {
        return new BatchEventPublisher(distributor, writer, properties.getDisruptor(), meterRegistry);
    }
    
    @Bean(destroyMethod = "stop")
    @ConditionalOnProperty(name = "candle.stream.pipeline.enabled", havingValue = "true", matchIfMissing = true)
    public TickPipeline tickPipeline(
            CandleStreamProperties properties,
            TickSourceFactory sourceFactory,
            CandleBatcher batcher,
            BatchEventPublisher publisher) {
        return new TickPipeline(properties.getStreamId(), sourceFactory, batcher, publisher);
    }
    
    /**
     * Starts the tick loop once the web server is accepting subscribers.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startPipeline(ApplicationReadyEvent event) {
        ObjectProvider<TickPipeline> pipeline = event.getApplicationContext().getBeanProvider(TickPipeline.class);
        pipeline.ifAvailable(TickPipeline::start);
    }
}
