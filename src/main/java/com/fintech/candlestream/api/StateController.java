package com.fintech.candlestream.api;

import com.fintech.candlestream.domain.Manifest;
import com.fintech.candlestream.storage.StreamStateView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the persisted state of the stream.
 * Both endpoints answer normally before the first flush.
 */
@RestController
@RequestMapping("/state")
@CrossOrigin(origins = "*")
@Tag(name = "Stream State", description = "Manifest and latest segment of the segmented log")
public class StateController {
    
    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");
    
    private final StreamStateView stateView;
    
    public StateController(StreamStateView stateView) {
        this.stateView = stateView;
    }
    
    /**
     * GET /state/manifest
     * 
     * @return the current manifest; sequence 0 and a null segment before the first flush
     */
    @Operation(summary = "Get the current manifest")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Current manifest snapshot",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = Manifest.class),
                examples = @ExampleObject(
                    name = "After three flushes",
                    value = """
                        {
                          "streamId": "m1",
                          "latestSegmentPath": "m1/20241212/13/000003.log",
                          "sequence": 3,
                          "intervalMs": 65,
                          "updatedAtMs": 1734009001130
                        }
                        """
                )
            )
        )
    })
    @GetMapping(value = "/manifest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Manifest> getManifest() {
        return ResponseEntity.ok(stateView.getManifestSnapshot());
    }
    
    /**
     * GET /state/latest
     * 
     * @return the latest segment body, or 204 No Content if nothing has been flushed
     */
    @Operation(summary = "Get the most recently flushed segment")
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Newline-delimited JSON candles",
            content = @Content(mediaType = "application/x-ndjson")
        ),
        @ApiResponse(responseCode = "204", description = "No segment has been flushed yet")
    })
    @GetMapping("/latest")
    public ResponseEntity<String> getLatest() {
        return stateView.getLatestSegment()
            .map(body -> ResponseEntity.ok().contentType(NDJSON).body(body))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
