package com.fintech.candlestream.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlestream.config.CandleStreamProperties;
import com.fintech.candlestream.domain.Candle;
import com.fintech.candlestream.domain.Manifest;
import com.fintech.candlestream.domain.PersistenceMode;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only segmented log for one stream.
 *
 * <p>Candles accumulate in a pending buffer until either the serialized size
 * reaches {@code segmentTargetBytes} or {@code flushIntervalMs} has passed
 * since the previous flush. A flush writes the whole buffer as one immutable
 * newline-delimited JSON segment, mirrors it to {@code latest.log}, then
 * advances and persists the manifest. The manifest is only ever written after
 * the segment it names is fully on disk.
 *
 * <p><b>Thread-safety:</b> {@link #ingest} may be called from any thread and
 * never waits for disk I/O unless it triggers a flush itself. Flushes are
 * admitted through a bulkhead with a single permit, so at most one flush runs
 * at a time and sequence numbers are never reused. Candles that arrive while a
 * flush is running go to the next segment.
 *
 * <p><b>Failure policy:</b> a failed segment write puts its candles back at the
 * head of the pending buffer and does not consume a sequence number. The
 * buffer is capped at {@code maxPendingCandles}; beyond that the oldest
 * candles are dropped and counted.
 *
 * <p>Each instance owns its buffer, sequence and manifest. Independent streams
 * use independent writers.
 */
public class SegmentLogWriter implements StreamStateView {

    private static final Logger log = LoggerFactory.getLogger(SegmentLogWriter.class);

    private static final byte NEWLINE = '\n';

    private final Settings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Bulkhead flushBulkhead;
    private final Path manifestFile;
    private final Path latestFile;

    private final Object bufferLock = new Object();
    // guarded by bufferLock
    private final Deque<PendingLine> pending = new ArrayDeque<>();
    private long pendingBytes;
    private long lastFlushMs;

    // written only while holding the flush permit
    private volatile long sequence;
    private volatile Manifest manifest;
    private volatile String latestSegmentCache;
    private volatile String lastFlushError;

    private final AtomicLong completedFlushes = new AtomicLong();
    private final Counter flushFailures;
    private final Counter candlesDropped;
    private final Timer flushTimer;

    public SegmentLogWriter(Settings settings, ObjectMapper objectMapper, Clock clock, MeterRegistry meterRegistry) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.manifestFile = settings.root().resolve(SegmentPaths.manifestPath(settings.streamId()));
        this.latestFile = settings.root().resolve(SegmentPaths.latestPath(settings.streamId()));
        this.flushBulkhead = Bulkhead.of(
            "segment-flush-" + settings.streamId(),
            BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(settings.flushWait())
                .build()
        );
        this.manifest = Manifest.initial(settings.streamId(), settings.intervalMs(), clock.millis());
        this.lastFlushMs = clock.millis();

        Tags tags = Tags.of("stream", settings.streamId());
        Gauge.builder("segment.writer.pending.candles", this, SegmentLogWriter::pendingCount).tags(tags).register(meterRegistry);
        Gauge.builder("segment.writer.pending.bytes", this, SegmentLogWriter::pendingBytes).tags(tags).register(meterRegistry);
        Gauge.builder("segment.writer.flushes", completedFlushes, AtomicLong::get).tags(tags).register(meterRegistry);
        this.flushFailures = meterRegistry.counter("segment.writer.flush.failures", tags);
        this.candlesDropped = meterRegistry.counter("segment.writer.candles.dropped", tags);
        this.flushTimer = meterRegistry.timer("segment.writer.flush.time", tags);
    }

    /**
     * Restores sequence, manifest and latest-segment cache from disk.
     *
     * <p>Never fails: a missing manifest means a fresh stream, and an unreadable
     * or foreign one is logged and replaced by a fresh manifest.
     */
    public void hydrateFromDisk() {
        if (settings.mode() != PersistenceMode.LOCAL) {
            return;
        }

        Manifest restored;
        try {
            restored = objectMapper.readValue(Files.readAllBytes(manifestFile), Manifest.class);
        } catch (NoSuchFileException e) {
            log.info("No manifest on disk, starting fresh: stream={}, path={}", settings.streamId(), manifestFile);
            return;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to hydrate manifest, starting fresh: stream={}, path={}, reason={}",
                settings.streamId(), manifestFile, e.getMessage());
            resetToFresh();
            return;
        }

        if (restored == null) {
            log.warn("Manifest is empty, starting fresh: stream={}, path={}", settings.streamId(), manifestFile);
            resetToFresh();
            return;
        }
        if (!settings.streamId().equals(restored.streamId()) || restored.sequence() < 0) {
            log.warn("Manifest does not belong to this stream, starting fresh: stream={}, found={}, sequence={}",
                settings.streamId(), restored.streamId(), restored.sequence());
            resetToFresh();
            return;
        }

        this.manifest = restored;
        this.sequence = restored.sequence();
        restored.latestSegment().ifPresent(this::loadLatestSegment);

        log.info("Hydrated manifest from disk: stream={}, sequence={}, latest={}",
            settings.streamId(), restored.sequence(), restored.latestSegmentPath());
    }

    /**
     * Buffers candles and flushes if a size or time threshold is reached.
     * No-op when persistence is disabled.
     *
     * @throws PersistenceException if a triggered flush fails
     */
    public void ingest(Collection<Candle> candles) {
        if (settings.mode() == PersistenceMode.DISABLED || candles.isEmpty()) {
            return;
        }

        List<PendingLine> lines = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            lines.add(serialize(candle));
        }

        boolean due;
        synchronized (bufferLock) {
            for (PendingLine line : lines) {
                pending.addLast(line);
                pendingBytes += line.bytes().length;
            }
            enforceCapacity();
            due = isDue();
        }

        if (due) {
            flush(false);
        }
    }

    /**
     * Flushes the pending buffer if the time threshold has passed, even when no
     * new candles are arriving.
     *
     * @return true if a flush ran
     */
    public boolean flushIfDue() {
        if (settings.mode() == PersistenceMode.DISABLED) {
            return false;
        }
        synchronized (bufferLock) {
            if (pending.isEmpty() || clock.millis() - lastFlushMs < settings.flushIntervalMs()) {
                return false;
            }
        }
        return flush(false);
    }

    /**
     * Writes everything pending as one new segment.
     *
     * <p>Without {@code force} an empty buffer is left alone. With it the call
     * still waits for any in-flight flush, but an empty buffer produces no segment.
     * In disabled mode the pending buffer is discarded.
     *
     * @return true if a segment was written
     * @throws PersistenceException if the segment or manifest could not be written,
     *         or the flush permit could not be obtained in time
     */
    public boolean flush(boolean force) {
        if (settings.mode() == PersistenceMode.DISABLED) {
            synchronized (bufferLock) {
                pending.clear();
                pendingBytes = 0;
            }
            return false;
        }

        synchronized (bufferLock) {
            if (pending.isEmpty() && !force) {
                return false;
            }
        }

        try {
            return flushBulkhead.executeCallable(this::writeSegment);
        } catch (PersistenceException e) {
            throw e;
        } catch (BulkheadFullException e) {
            throw new PersistenceException("Timed out waiting for in-flight flush: stream=" + settings.streamId(), e);
        } catch (Exception e) {
            throw new PersistenceException("Flush failed: stream=" + settings.streamId(), e);
        }
    }

    /**
     * Final forced flush on shutdown. Failures are logged, not thrown.
     */
    public void shutdown() {
        log.info("Flushing segment log before shutdown: stream={}, pending={}", settings.streamId(), pendingCount());
        try {
            flush(true);
        } catch (PersistenceException e) {
            log.error("Shutdown flush failed: stream={}", settings.streamId(), e);
        }
    }

    @Override
    public Manifest getManifestSnapshot() {
        return manifest;
    }

    @Override
    public Optional<String> getLatestSegment() {
        return Optional.ofNullable(latestSegmentCache);
    }

    public String getStreamId() {
        return settings.streamId();
    }

    public PersistenceMode getMode() {
        return settings.mode();
    }

    /** Number of segments successfully written by this instance. */
    public long getCompletedFlushes() {
        return completedFlushes.get();
    }

    /** Message of the most recent failed flush, empty once a later flush succeeds. */
    public Optional<String> getLastFlushError() {
        return Optional.ofNullable(lastFlushError);
    }

    public int pendingCount() {
        synchronized (bufferLock) {
            return pending.size();
        }
    }

    public long pendingBytes() {
        synchronized (bufferLock) {
            return pendingBytes;
        }
    }

    private Boolean writeSegment() {
        List<PendingLine> taken;
        synchronized (bufferLock) {
            if (pending.isEmpty()) {
                return false;
            }
            taken = new ArrayList<>(pending);
            pending.clear();
            pendingBytes = 0;
            lastFlushMs = clock.millis();
        }

        Timer.Sample sample = Timer.start();
        long nextSequence = sequence + 1;
        String segmentKey = SegmentPaths.segmentPath(settings.streamId(), taken.get(0).timestampMs(), nextSequence);
        byte[] body = join(taken);

        try {
            writeAtomically(settings.root().resolve(segmentKey), body);
            writeAtomically(latestFile, body);
        } catch (IOException e) {
            requeue(taken);
            recordFailure(e);
            throw new PersistenceException("Failed to write segment " + segmentKey, e);
        }

        sequence = nextSequence;
        Manifest updated = manifest.advance(segmentKey, nextSequence, clock.millis());
        manifest = updated;
        try {
            writeAtomically(manifestFile, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(updated));
        } catch (IOException e) {
            recordFailure(e);
            throw new PersistenceException("Segment " + segmentKey + " written but manifest update failed", e);
        } finally {
            latestSegmentCache = new String(body, StandardCharsets.UTF_8);
            completedFlushes.incrementAndGet();
            sample.stop(flushTimer);
        }

        lastFlushError = null;
        log.debug("Flushed segment: stream={}, sequence={}, candles={}, bytes={}, path={}",
            settings.streamId(), nextSequence, taken.size(), body.length, segmentKey);
        return true;
    }

    private void loadLatestSegment(String segmentKey) {
        try {
            latestSegmentCache = Files.readString(settings.root().resolve(segmentKey), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            log.warn("Latest segment unreadable, cache left empty: stream={}, path={}, reason={}",
                settings.streamId(), segmentKey, e.getMessage());
        }
    }

    private void resetToFresh() {
        this.manifest = Manifest.initial(settings.streamId(), settings.intervalMs(), clock.millis());
        this.sequence = 0;
        this.latestSegmentCache = null;
    }

    private PendingLine serialize(Candle candle) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(candle);
            byte[] line = Arrays.copyOf(json, json.length + 1);
            line[json.length] = NEWLINE;
            return new PendingLine(candle.timestampMs(), line);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize candle at " + candle.timestampMs(), e);
        }
    }

    // caller holds bufferLock
    private boolean isDue() {
        return pendingBytes >= settings.segmentTargetBytes()
            || clock.millis() - lastFlushMs >= settings.flushIntervalMs();
    }

    // caller holds bufferLock
    private void enforceCapacity() {
        int dropped = 0;
        while (pending.size() > settings.maxPendingCandles()) {
            PendingLine oldest = pending.removeFirst();
            pendingBytes -= oldest.bytes().length;
            dropped++;
        }
        if (dropped > 0) {
            candlesDropped.increment(dropped);
            log.warn("Pending buffer full, dropped oldest candles: stream={}, dropped={}, limit={}",
                settings.streamId(), dropped, settings.maxPendingCandles());
        }
    }

    private void requeue(List<PendingLine> lines) {
        synchronized (bufferLock) {
            for (int i = lines.size() - 1; i >= 0; i--) {
                PendingLine line = lines.get(i);
                pending.addFirst(line);
                pendingBytes += line.bytes().length;
            }
            enforceCapacity();
        }
    }

    private void recordFailure(IOException e) {
        flushFailures.increment();
        lastFlushError = e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static byte[] join(List<PendingLine> lines) {
        int size = 0;
        for (PendingLine line : lines) {
            size += line.bytes().length;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(size);
        for (PendingLine line : lines) {
            out.writeBytes(line.bytes());
        }
        return out.toByteArray();
    }

    private static void writeAtomically(Path target, byte[] body) throws IOException {
        Files.createDirectories(target.getParent());
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temp, body);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * One serialized candle, newline included. Its length is exactly what the
     * candle adds to the segment on disk.
     */
    private record PendingLine(long timestampMs, byte[] bytes) {
    }

    /**
     * Writer configuration for one stream.
     *
     * @param streamId Stream identifier, first path component under the root
     * @param intervalMs Tick interval recorded in the manifest
     * @param mode Persistence mode
     * @param root Local storage root
     * @param segmentTargetBytes Size threshold for an automatic flush
     * @param flushIntervalMs Time threshold for an automatic flush
     * @param maxPendingCandles Pending buffer ceiling
     * @param flushWait How long a flush waits for the in-flight one before failing
     */
    public record Settings(
        String streamId,
        long intervalMs,
        PersistenceMode mode,
        Path root,
        long segmentTargetBytes,
        long flushIntervalMs,
        int maxPendingCandles,
        Duration flushWait
    ) {

        public static Settings from(CandleStreamProperties properties) {
            CandleStreamProperties.Persistence persistence = properties.getPersistence();
            return new Settings(
                properties.getStreamId(),
                properties.getIntervalMs(),
                persistence.getMode(),
                Path.of(persistence.getLocalRoot()).toAbsolutePath(),
                persistence.getSegmentTargetBytes(),
                persistence.getFlushIntervalMs(),
                persistence.getMaxPendingCandles(),
                Duration.ofMillis(persistence.getFlushWaitMs())
            );
        }
    }
}
