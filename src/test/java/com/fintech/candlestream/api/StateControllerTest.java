package com.fintech.candlestream.api;

import com.fintech.candlestream.domain.Manifest;
import com.fintech.candlestream.storage.StreamStateView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(StateController.class)
@DisplayName("StateController Tests")
class StateControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private StreamStateView stateView;
    
    @Test
    @DisplayName("Should return the fresh manifest before any flush")
    void testInitialManifest() throws Exception {
        when(stateView.getManifestSnapshot()).thenReturn(Manifest.initial("m1", 65L, 1_734_009_000_000L));
        
        mockMvc.perform(get("/state/manifest"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("application/json"))
            .andExpect(jsonPath("$.streamId").value("m1"))
            .andExpect(jsonPath("$.sequence").value(0))
            .andExpect(jsonPath("$.intervalMs").value(65))
            .andExpect(jsonPath("$.updatedAtMs").value(1_734_009_000_000L))
            .andExpect(jsonPath("$.latestSegmentPath").value(nullValue()))
            .andExpect(jsonPath("$.latestSegment").doesNotExist());
    }
    
    @Test
    @DisplayName("Should return the manifest after flushes")
    void testAdvancedManifest() throws Exception {
        when(stateView.getManifestSnapshot()).thenReturn(
            new Manifest("m1", "m1/20241212/13/000003.log", 3L, 65L, 1_734_009_001_130L));
        
        mockMvc.perform(get("/state/manifest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sequence").value(3))
            .andExpect(jsonPath("$.latestSegmentPath").value("m1/20241212/13/000003.log"));
    }
    
    @Test
    @DisplayName("Should answer 204 when no segment has been flushed")
    void testLatestEmpty() throws Exception {
        when(stateView.getLatestSegment()).thenReturn(Optional.empty());
        
        mockMvc.perform(get("/state/latest"))
            .andExpect(status().isNoContent())
            .andExpect(content().string(emptyString()));
    }
    
    @Test
    @DisplayName("Should return the latest segment as newline-delimited JSON")
    void testLatestBody() throws Exception {
        String body = "{\"timestampMs\":1000,\"open\":1.0,\"high\":2.0,\"low\":0.5,\"close\":1.5,\"volume\":10.0}\n"
            + "{\"timestampMs\":1065,\"open\":1.5,\"high\":2.5,\"low\":1.0,\"close\":2.0,\"volume\":11.0}\n";
        when(stateView.getLatestSegment()).thenReturn(Optional.of(body));
        
        mockMvc.perform(get("/state/latest"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("application/x-ndjson"))
            .andExpect(content().string(body));
    }
    
    @Test
    @DisplayName("Should allow cross-origin reads")
    void testCors() throws Exception {
        when(stateView.getManifestSnapshot()).thenReturn(Manifest.initial("m1", 65L, 0L));
        
        mockMvc.perform(get("/state/manifest").header("Origin", "http://example.com"))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }
}
