package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.broadcast.BroadcastDistributor;
import com.fintech.candlestream.config.CandleStreamProperties;
import com.fintech.candlestream.domain.CandleBatch;
import com.fintech.candlestream.storage.PersistenceException;
import com.fintech.candlestream.storage.SegmentLogWriter;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands completed batches from the tick loop to broadcast and persistence.
 * 
 * <p>Backed by an LMAX Disruptor ring buffer with two independent event
 * handlers, each on its own thread:
 * <ul>
 *   <li>broadcast: encode once and fan out to live subscribers</li>
 *   <li>persistence: ingest into the segment log, logging any failure</li>
 * </ul>
 * Neither handler waits for the other. Publishing never blocks the tick loop:
 * when the ring buffer is full the batch is dropped and counted.
 */
public class BatchEventPublisher {
    
    private static final Logger log = LoggerFactory.getLogger(BatchEventPublisher.class);
    
    private final BroadcastDistributor distributor;
    private final SegmentLogWriter writer;
    private final CandleStreamProperties.Disruptor settings;
    private final Counter batchesDropped;
    
    private Disruptor<BatchEventWrapper> disruptor;
    private RingBuffer<BatchEventWrapper> ringBuffer;
    
    public BatchEventPublisher(
            BroadcastDistributor distributor,
            SegmentLogWriter writer,
            CandleStreamProperties.Disruptor settings,
            MeterRegistry meterRegistry) {
        this.distributor = distributor;
        this.writer = writer;
        this.settings = settings;
        this.batchesDropped = meterRegistry.counter("pipeline.batches.dropped");
    }
    
    public void start() {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("batch-handler-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };
        
        WaitStrategy waitStrategy = createWaitStrategy();
        disruptor = new Disruptor<>(
            BatchEventWrapper::new,
            settings.getBufferSize(),
            threadFactory,
            ProducerType.SINGLE,  // only the tick loop publishes
            waitStrategy
        );
        
        // Two handlers in parallel: broadcast and persistence progress independently
        EventHandler<BatchEventWrapper> broadcastHandler = (wrapper, sequence, endOfBatch) -> {
            if (wrapper.batch != null) {
                distributor.broadcast(wrapper.batch);
            }
        };
        EventHandler<BatchEventWrapper> persistenceHandler = (wrapper, sequence, endOfBatch) -> {
            if (wrapper.batch != null) {
                persist(wrapper.batch);
            }
        };
        disruptor.handleEventsWith(broadcastHandler, persistenceHandler);
        
        disruptor.setDefaultExceptionHandler(new ExceptionHandler<BatchEventWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, BatchEventWrapper event) {
                log.error("Exception handling batch at ring sequence {}: batch={}", sequence,
                    event.batch != null ? event.batch.sequence() : null, ex);
            }
            
            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }
            
            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });
        
        ringBuffer = disruptor.start();
        log.info("Batch publisher started: bufferSize={}, waitStrategy={}",
            settings.getBufferSize(), waitStrategy.getClass().getSimpleName());
    }
    
    /**
     * Publishes a batch without blocking.
     * 
     * @return false if the ring buffer was full and the batch was dropped
     */
    public boolean tryPublish(CandleBatch batch) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).batch = batch;
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            batchesDropped.increment();
            log.warn("Ring buffer full, dropping batch: sequence={}, candles={}", batch.sequence(), batch.size());
            return false;
        }
    }
    
    /**
     * Stops accepting work after both handlers have drained everything published so far.
     */
    public void shutdown() {
        if (disruptor != null) {
            log.info("Shutting down batch publisher...");
            disruptor.shutdown();
            disruptor = null;
            log.info("Batch publisher shutdown complete");
        }
    }
    
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }
    
    private void persist(CandleBatch batch) {
        try {
            writer.ingest(batch.candles());
        } catch (PersistenceException e) {
            log.error("Failed to persist candles: stream={}, batch={}", writer.getStreamId(), batch.sequence(), e);
        }
    }
    
    private WaitStrategy createWaitStrategy() {
        String strategy = settings.getWaitStrategy();
        
        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }
    
    /**
     * Ring buffer slot. Pre-allocated by the Disruptor and reused.
     */
    private static class BatchEventWrapper {
        CandleBatch batch;
    }
}
