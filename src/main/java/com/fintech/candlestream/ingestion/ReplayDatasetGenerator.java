package com.fintech.candlestream.ingestion;

import com.fintech.candlestream.config.CandleStreamProperties;
import com.fintech.candlestream.domain.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Writes a synthetic candle file that replay mode can read back.
 * Enabled by setting {@code candle.stream.dataset.output-path}.
 */
@Component
@ConditionalOnProperty(name = "candle.stream.dataset.output-path")
public class ReplayDatasetGenerator implements ApplicationRunner {
    
    private static final Logger log = LoggerFactory.getLogger(ReplayDatasetGenerator.class);
    
    private final CandleStreamProperties properties;
    private final Clock clock;
    
    public ReplayDatasetGenerator(CandleStreamProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }
    
    @Override
    public void run(ApplicationArguments args) throws IOException {
        Path output = Path.of(properties.getDataset().getOutputPath());
        int written = generate(output, properties.getDataset().getCount());
        log.info("Wrote synthetic dataset: candles={}, path={}", written, output.toAbsolutePath());
    }
    
    /**
     * Writes {@code count} candles as {@code timestampMs,open,high,low,close,volume} rows.
     * 
     * @return number of rows written
     */
    public int generate(Path output, int count) throws IOException {
        CandleStreamProperties.Source source = properties.getSource();
        long now = clock.millis();
        String delimiter = source.getDelimiter();
        
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        
        int written = 0;
        try (SyntheticTickSource ticks = new SyntheticTickSource(
                source.getSeed() != null ? source.getSeed() : now,
                now,
                properties.getIntervalMs(),
                source.getStartPrice(),
                source.getVolatility(),
                TickPacer.none());
             BufferedWriter out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            while (written < count && ticks.hasNext()) {
                Candle candle = ticks.next();
                out.write(String.join(delimiter,
                    Long.toString(candle.timestampMs()),
                    Double.toString(candle.open()),
                    Double.toString(candle.high()),
                    Double.toString(candle.low()),
                    Double.toString(candle.close()),
                    Double.toString(candle.volume())));
                out.newLine();
                written++;
            }
        }
        return written;
    }
}
