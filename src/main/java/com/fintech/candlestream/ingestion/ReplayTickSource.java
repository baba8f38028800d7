package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.domain.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Replays a delimited historical file, one candle per line:
 * {@code timestampMs,open,high,low,close,volume}.
 * 
 * <p>Lines are read lazily. A missing or unparsable timestamp becomes
 * {@code previous timestamp + intervalMs} so time keeps moving forward.
 * Rows whose price or volume columns cannot be parsed are skipped.
 */
public class ReplayTickSource extends PacedTickSource {
    
    private static final Logger log = LoggerFactory.getLogger(ReplayTickSource.class);
    
    private static final int COLUMNS = 6;
    private static final Pattern NUMERIC = Pattern.compile("[+-]?\\d+(\\.\\d*)?([eE][+-]?\\d+)?");
    
    private final BufferedReader reader;
    private final Path path;
    private final Pattern delimiter;
    private final long intervalMs;
    
    private long lastTimestamp;
    private long lineNumber;
    
    /**
     * @param startTimestampMs Timestamp the fallback counts from when the first row has none
     * @throws UncheckedIOException if the file cannot be opened
     */
    public ReplayTickSource(
            Path path,
            String delimiter,
            long intervalMs,
            long startTimestampMs,
            TickPacer pacer) {
        super(pacer, intervalMs);
        this.path = path;
        this.delimiter = Pattern.compile(Pattern.quote(delimiter));
        this.intervalMs = intervalMs;
        this.lastTimestamp = startTimestampMs;
        try {
            this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open replay file " + path, e);
        }
    }
    
    @Override
    protected Candle computeNext() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Candle candle = parse(line);
            if (candle != null) {
                lastTimestamp = candle.timestampMs();
                return candle;
            }
        }
        log.info("Replay source exhausted: path={}, lines={}", path, lineNumber);
        return null;
    }
    
    private Candle parse(String line) {
        String[] columns = delimiter.split(line.trim(), -1);
        if (columns.length < COLUMNS) {
            log.warn("Skipping replay row with {} columns: path={}, line={}", columns.length, path, lineNumber);
            return null;
        }
        
        long timestamp = parseTimestamp(columns[0]);
        try {
            return new Candle(
                timestamp,
                Double.parseDouble(columns[1].trim()),
                Double.parseDouble(columns[2].trim()),
                Double.parseDouble(columns[3].trim()),
                Double.parseDouble(columns[4].trim()),
                Double.parseDouble(columns[5].trim())
            );
        } catch (NumberFormatException e) {
            log.warn("Skipping malformed replay row: path={}, line={}, reason={}", path, lineNumber, e.getMessage());
            return null;
        }
    }
    
    private long parseTimestamp(String raw) {
        String value = raw.trim();
        if (NUMERIC.matcher(value).matches()) {
            return (long) Double.parseDouble(value);
        }
        return lastTimestamp + intervalMs;
    }
    
    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading replay file " + path + " at line " + lineNumber, e);
        }
    }
    
    @Override
    protected void onClose() {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close replay file: path={}", path, e);
        }
    }
}
