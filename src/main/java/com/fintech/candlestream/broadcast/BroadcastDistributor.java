package com.fintech.candlestream.broadcast;

import com.fintech.candlestream.codec.CandleBatchCodec;
import com.fintech.candlestream.domain.BatchMetadata;
import com.fintech.candlestream.domain.CandleBatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans each batch out to every open live subscriber.
 * 
 * <p>A batch is encoded once and the same bytes go to every subscriber.
 * Each subscriber has its own outbox drained by at most one
 * {@code sendExecutor} task at a time, so a subscriber receives batches in
 * broadcast order while a slow subscriber cannot hold up the others or the
 * caller. An outbox holds at most {@code maxQueuedBatches}; further batches
 * for that subscriber are skipped until it catches up. Subscribers that are
 * not open are skipped; nothing is retried for them. Subscribers only see
 * batches broadcast after they connect.
 * 
 * <p>{@link #broadcast} is called from a single thread (the broadcast event handler).
 */
public class BroadcastDistributor {
    
    private static final Logger log = LoggerFactory.getLogger(BroadcastDistributor.class);
    
    private final CandleBatchCodec codec;
    private final SubscriberRegistry registry;
    private final Executor sendExecutor;
    private final long intervalMs;
    private final int maxQueuedBatches;
    private final Clock clock;
    
    private final Map<String, Outbox> outboxes = new ConcurrentHashMap<>();
    
    private final Counter batchesBroadcast;
    private final Counter sendsSkipped;
    private final Counter sendsFailed;
    
    public BroadcastDistributor(
            CandleBatchCodec codec,
            SubscriberRegistry registry,
            Executor sendExecutor,
            long intervalMs,
            int maxQueuedBatches,
            Clock clock,
            MeterRegistry meterRegistry) {
        if (maxQueuedBatches <= 0) {
            throw new IllegalArgumentException("maxQueuedBatches must be positive: " + maxQueuedBatches);
        }
        this.codec = codec;
        this.registry = registry;
        this.sendExecutor = sendExecutor;
        this.intervalMs = intervalMs;
        this.maxQueuedBatches = maxQueuedBatches;
        this.clock = clock;
        
        this.batchesBroadcast = meterRegistry.counter("broadcast.batches");
        this.sendsSkipped = meterRegistry.counter("broadcast.sends.skipped");
        this.sendsFailed = meterRegistry.counter("broadcast.sends.failed");
        meterRegistry.gauge("broadcast.subscribers", registry, SubscriberRegistry::size);
    }
    
    /**
     * Encodes one batch and queues it for every open subscriber.
     * 
     * @return number of subscribers the batch was queued for
     */
    public int broadcast(CandleBatch batch) {
        if (registry.isEmpty()) {
            outboxes.clear();
            return 0;
        }
        
        byte[] payload = codec.encode(
            BatchMetadata.draft()
                .sequence(batch.sequence())
                .intervalMs(intervalMs)
                .sentAtMs(clock.millis()),
            batch.candles()
        );
        
        int dispatched = 0;
        for (LiveSubscriber subscriber : registry.snapshot()) {
            if (!subscriber.isOpen()) {
                outboxes.remove(subscriber.id());
                sendsSkipped.increment();
                continue;
            }
            Outbox outbox = outboxes.computeIfAbsent(subscriber.id(), id -> new Outbox(subscriber));
            if (outbox.offer(new Frame(batch.sequence(), payload))) {
                dispatched++;
            } else {
                sendsSkipped.increment();
            }
        }
        
        if (outboxes.size() > registry.size()) {
            outboxes.keySet().removeIf(id -> !registry.contains(id));
        }
        
        batchesBroadcast.increment();
        if (log.isTraceEnabled()) {
            log.trace("Broadcast batch: sequence={}, bytes={}, subscribers={}", batch.sequence(), payload.length, dispatched);
        }
        return dispatched;
    }
    
    private void send(LiveSubscriber subscriber, Frame frame) {
        try {
            subscriber.send(frame.payload());
        } catch (Exception e) {
            sendsFailed.increment();
            log.debug("Broadcast send failed: subscriber={}, sequence={}, reason={}",
                subscriber.id(), frame.sequence(), e.getMessage());
        }
    }
    
    private record Frame(long sequence, byte[] payload) {
    }
    
    /**
     * Per-subscriber FIFO. At most one drain task is scheduled at a time.
     */
    private final class Outbox implements Runnable {
        
        private final LiveSubscriber subscriber;
        private final Queue<Frame> frames = new ConcurrentLinkedQueue<>();
        private final AtomicInteger queued = new AtomicInteger();
        private final AtomicBoolean draining = new AtomicBoolean();
        
        Outbox(LiveSubscriber subscriber) {
            this.subscriber = subscriber;
        }
        
        boolean offer(Frame frame) {
            if (queued.incrementAndGet() > maxQueuedBatches) {
                queued.decrementAndGet();
                return false;
            }
            frames.add(frame);
            if (draining.compareAndSet(false, true)) {
                try {
                    sendExecutor.execute(this);
                } catch (RejectedExecutionException e) {
                    // no drain task is running, so only this frame is queued
                    frames.clear();
                    queued.set(0);
                    draining.set(false);
                    log.warn("Broadcast send rejected: subscriber={}, sequence={}", subscriber.id(), frame.sequence());
                    return false;
                }
            }
            return true;
        }
        
        @Override
        public void run() {
            do {
                Frame frame;
                while ((frame = frames.poll()) != null) {
                    queued.decrementAndGet();
                    send(subscriber, frame);
                }
                draining.set(false);
            } while (!frames.isEmpty() && draining.compareAndSet(false, true));
        }
    }
}
