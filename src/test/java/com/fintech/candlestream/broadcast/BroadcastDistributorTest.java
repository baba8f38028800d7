package com.fintech.candlestream.broadcast;

import com.fintech.candlestream.codec.CandleBatchCodec;
import com.fintech.candlestream.codec.DecodedBatch;
import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.domain.CandleBatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BroadcastDistributor} fan-out semantics.
 */
@DisplayName("BroadcastDistributor Tests")
class BroadcastDistributorTest {
    
    private static final long NOW = 1_734_009_000_200L;
    
    private final CandleBatchCodec codec = new CandleBatchCodec();
    private SubscriberRegistry registry;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;
    private BroadcastDistributor distributor;
    
    @BeforeEach
    void setUp() {
        registry = new SubscriberRegistry();
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
        distributor = new BroadcastDistributor(
            codec, registry, executor, 65L, 256,
            Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC), meterRegistry);
    }
    
    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }
    
    private static CandleBatch batch(long sequence) {
        return new CandleBatch(sequence, List.of(
            new Candle(1_734_009_000_000L, 100, 105, 99, 104, 12500),
            new Candle(1_734_009_000_065L, 104, 106, 101, 103, 10250),
            new Candle(1_734_009_000_130L, 103, 108, 102, 107, 9750)
        ));
    }
    
    @Test
    @DisplayName("Should send the same encoded bytes to every open subscriber")
    void testFanOutSharesPayload() throws InterruptedException {
        RecordingSubscriber first = new RecordingSubscriber("a", 1);
        RecordingSubscriber second = new RecordingSubscriber("b", 1);
        registry.add(first);
        registry.add(second);
        
        int dispatched = distributor.broadcast(batch(42));
        
        assertThat(dispatched).isEqualTo(2);
        assertThat(first.latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(second.latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(first.received.get(0)).isSameAs(second.received.get(0));
        
        DecodedBatch decoded = codec.decode(first.received.get(0));
        assertThat(decoded.metadata().sequence()).isEqualTo(42L);
        assertThat(decoded.metadata().intervalMs()).isEqualTo(65L);
        assertThat(decoded.metadata().sentAtMs()).isEqualTo((double) NOW);
        assertThat(decoded.metadata().baseTimestampMs()).isEqualTo(1_734_009_000_000.0);
        assertThat(decoded.candles()).isEqualTo(batch(42).candles());
        assertThat(meterRegistry.counter("broadcast.batches").count()).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should skip subscribers that are not open")
    void testSkipsClosed() throws InterruptedException {
        RecordingSubscriber open = new RecordingSubscriber("open", 1);
        RecordingSubscriber closed = new RecordingSubscriber("closed", 1);
        closed.open = false;
        registry.add(open);
        registry.add(closed);
        
        assertThat(distributor.broadcast(batch(1))).isEqualTo(1);
        
        assertThat(open.latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(closed.received).isEmpty();
        assertThat(meterRegistry.counter("broadcast.sends.skipped").count()).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should isolate a failing subscriber from the others")
    void testFailureIsolated() throws InterruptedException {
        CountDownLatch failed = new CountDownLatch(1);
        registry.add(new LiveSubscriber() {
            @Override
            public String id() {
                return "broken";
            }
            
            @Override
            public boolean isOpen() {
                return true;
            }
            
            @Override
            public void send(byte[] payload) throws IOException {
                failed.countDown();
                throw new IOException("connection reset");
            }
        });
        RecordingSubscriber healthy = new RecordingSubscriber("healthy", 2);
        registry.add(healthy);
        
        distributor.broadcast(batch(1));
        distributor.broadcast(batch(2));
        
        assertThat(healthy.latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(failed.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(healthy.received).hasSize(2);
    }
    
    @Test
    @DisplayName("Should return immediately even when a subscriber is stalled")
    void testSlowSubscriberDoesNotBlock() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        registry.add(new LiveSubscriber() {
            @Override
            public String id() {
                return "stalled";
            }
            
            @Override
            public boolean isOpen() {
                return true;
            }
            
            @Override
            public void send(byte[] payload) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });
        RecordingSubscriber fast = new RecordingSubscriber("fast", 3);
        registry.add(fast);
        
        try {
            long start = System.nanoTime();
            for (long seq = 1; seq <= 3; seq++) {
                distributor.broadcast(batch(seq));
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            
            assertThat(elapsedMs).isLessThan(1_000);
            assertThat(fast.latch.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
        }
    }
    
    @Test
    @DisplayName("Should do nothing without subscribers")
    void testNoSubscribers() {
        assertThat(distributor.broadcast(batch(1))).isZero();
        assertThat(meterRegistry.counter("broadcast.batches").count()).isZero();
    }
    
    @Test
    @DisplayName("Should count rejected sends as skipped")
    void testRejectedExecution() {
        BroadcastDistributor rejecting = new BroadcastDistributor(
            codec, registry, task -> {
                throw new RejectedExecutionException("queue full");
            }, 65L, 256, Clock.systemUTC(), meterRegistry);
        registry.add(new RecordingSubscriber("a", 1));
        
        assertThat(rejecting.broadcast(batch(1))).isZero();
        assertThat(meterRegistry.counter("broadcast.sends.skipped").count()).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should deliver batches to each subscriber in broadcast order despite send jitter")
    void testPerSubscriberOrdering() throws InterruptedException {
        int batches = 1_000;
        BroadcastDistributor ordered = new BroadcastDistributor(
            codec, registry, executor, 65L, 2 * batches, Clock.systemUTC(), meterRegistry);
        List<SequenceSubscriber> subscribers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            SequenceSubscriber subscriber = new SequenceSubscriber("jittery-" + i, batches);
            subscribers.add(subscriber);
            registry.add(subscriber);
        }
        
        for (long seq = 1; seq <= batches; seq++) {
            assertThat(ordered.broadcast(batch(seq))).isEqualTo(3);
        }
        
        for (SequenceSubscriber subscriber : subscribers) {
            assertThat(subscriber.latch.await(30, TimeUnit.SECONDS)).isTrue();
            assertThat(subscriber.sequences).hasSize(batches);
            assertThat(subscriber.sequences).isSorted();
            assertThat(subscriber.sequences).doesNotHaveDuplicates();
        }
        assertThat(meterRegistry.counter("broadcast.sends.skipped").count()).isZero();
    }
    
    @Test
    @DisplayName("Should skip batches once a stalled subscriber's outbox is full")
    void testOutboxCap() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SequenceSubscriber stalled = new SequenceSubscriber("stalled", 3) {
            @Override
            public void send(byte[] payload) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.send(payload);
            }
        };
        registry.add(stalled);
        BroadcastDistributor capped = new BroadcastDistributor(
            codec, registry, executor, 65L, 2, Clock.systemUTC(), meterRegistry);
        
        try {
            assertThat(capped.broadcast(batch(1))).isEqualTo(1);
            assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
            
            assertThat(capped.broadcast(batch(2))).isEqualTo(1);
            assertThat(capped.broadcast(batch(3))).isEqualTo(1);
            assertThat(capped.broadcast(batch(4))).isZero();
            assertThat(meterRegistry.counter("broadcast.sends.skipped").count()).isEqualTo(1.0);
        } finally {
            release.countDown();
        }
        
        assertThat(stalled.latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(stalled.sequences).containsExactly(1L, 2L, 3L);
    }
    
    @Test
    @DisplayName("Should reject a non-positive outbox capacity")
    void testInvalidOutboxCapacity() {
        assertThatThrownBy(() -> new BroadcastDistributor(
            codec, registry, executor, 65L, 0, Clock.systemUTC(), meterRegistry))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Should expose the subscriber count as a gauge")
    void testSubscriberGauge() {
        registry.add(new RecordingSubscriber("a", 1));
        registry.add(new RecordingSubscriber("b", 1));
        registry.remove("a");
        
        assertThat(meterRegistry.get("broadcast.subscribers").gauge().value()).isEqualTo(1.0);
    }
    
    private static class RecordingSubscriber implements LiveSubscriber {
        final String id;
        final List<byte[]> received = new CopyOnWriteArrayList<>();
        final CountDownLatch latch;
        volatile boolean open = true;
        
        RecordingSubscriber(String id, int expected) {
            this.id = id;
            this.latch = new CountDownLatch(expected);
        }
        
        @Override
        public String id() {
            return id;
        }
        
        @Override
        public boolean isOpen() {
            return open;
        }
        
        @Override
        public void send(byte[] payload) {
            received.add(payload);
            latch.countDown();
        }
    }
    
    private class SequenceSubscriber implements LiveSubscriber {
        final String id;
        final List<Long> sequences = new CopyOnWriteArrayList<>();
        final CountDownLatch latch;
        
        SequenceSubscriber(String id, int expected) {
            this.id = id;
            this.latch = new CountDownLatch(expected);
        }
        
        @Override
        public String id() {
            return id;
        }
        
        @Override
        public boolean isOpen() {
            return true;
        }
        
        @Override
        public void send(byte[] payload) {
            LockSupport.parkNanos(ThreadLocalRandom.current().nextLong(50_000));
            sequences.add(codec.decode(payload).metadata().sequence());
            latch.countDown();
        }
    }
}
