package com.fintech.candlestream.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SegmentPaths Tests")
class SegmentPathsTest {
    
    @ParameterizedTest(name = "{0} seq {1} -> {2}")
    @CsvSource({
        "1734009000000, 1,       demo/20241212/13/000001.log",
        "0,             42,      demo/19700101/00/000042.log",
        "1734047999999, 999999,  demo/20241212/23/999999.log",
        "1734048000000, 1234567, demo/20241213/00/1234567.log"
    })
    @DisplayName("Should bucket segments by UTC day and hour of the first candle")
    void testSegmentPath(long timestamp, long sequence, String expected) {
        assertThat(SegmentPaths.segmentPath("demo", timestamp, sequence)).isEqualTo(expected);
    }
    
    @Test
    @DisplayName("Should place latest and manifest directly under the stream directory")
    void testFixedFiles() {
        assertThat(SegmentPaths.latestPath("demo")).isEqualTo("demo/latest.log");
        assertThat(SegmentPaths.manifestPath("demo")).isEqualTo("demo/manifest.json");
    }
}
