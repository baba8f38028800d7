package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.aggregation.CandleBatcher;
import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.domain.CandleBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The tick loop: pulls candles from the tick source, groups them into batches
 * and publishes each batch downstream.
 * 
 * <p>Runs on a single dedicated thread. Waiting for the next candle is the
 * only place the loop suspends; broadcast and persistence run on the
 * publisher's handler threads. The loop ends when a finite source is
 * exhausted or when {@link #stop()} interrupts it.
 */
public class TickPipeline {
    
    private static final Logger log = LoggerFactory.getLogger(TickPipeline.class);
    
    private final String streamId;
    private final TickSourceFactory sourceFactory;
    private final CandleBatcher batcher;
    private final BatchEventPublisher publisher;
    
    private final AtomicLong candlesRead = new AtomicLong();
    private volatile Thread worker;
    
    public TickPipeline(
            String streamId,
            TickSourceFactory sourceFactory,
            CandleBatcher batcher,
            BatchEventPublisher publisher) {
        this.streamId = streamId;
        this.sourceFactory = sourceFactory;
        this.batcher = batcher;
        this.publisher = publisher;
    }
    
    /** Starts the tick loop on its own thread. */
    public synchronized void start() {
        if (worker != null) {
            throw new IllegalStateException("Tick pipeline already started for stream " + streamId);
        }
        Thread thread = new Thread(this::run, "tick-loop-" + streamId);
        thread.setDaemon(false);
        worker = thread;
        thread.start();
    }
    
    /**
     * Runs the loop on the calling thread until the source ends or the thread
     * is interrupted.
     */
    public void run() {
        MDC.put("stream", streamId);
        log.info("Tick loop started: stream={}", streamId);
        try (TickSource source = sourceFactory.create()) {
            while (!Thread.currentThread().isInterrupted() && source.hasNext()) {
                Candle candle = source.next();
                candlesRead.incrementAndGet();
                batcher.add(candle).ifPresent(publisher::tryPublish);
            }
            
            if (Thread.currentThread().isInterrupted()) {
                log.info("Tick loop stopped: stream={}, candles={}, batches={}",
                    streamId, candlesRead.get(), batcher.lastSequence());
            } else {
                batcher.flushRemainder().ifPresent(this::publishRemainder);
                log.info("Tick source exhausted: stream={}, candles={}, batches={}",
                    streamId, candlesRead.get(), batcher.lastSequence());
            }
        } catch (RuntimeException e) {
            log.error("Tick loop failed: stream={}, candles={}", streamId, candlesRead.get(), e);
        } finally {
            MDC.remove("stream");
        }
    }
    
    /**
     * Interrupts the tick loop and waits for it to finish.
     */
    public void stop() throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = worker;
            worker = null;
        }
        if (thread != null) {
            thread.interrupt();
            thread.join(TimeUnit.SECONDS.toMillis(5));
        }
    }
    
    public long getCandlesRead() {
        return candlesRead.get();
    }
    
    private void publishRemainder(CandleBatch batch) {
        log.debug("Publishing final short batch: stream={}, sequence={}, candles={}",
            streamId, batch.sequence(), batch.size());
        publisher.tryPublish(batch);
    }
}
