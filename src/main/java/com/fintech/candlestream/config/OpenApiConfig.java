package com.fintech.candlestream.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the state query API.
 * 
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8787/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8787/v3/api-docs
 */
@Configuration
public class OpenApiConfig {
    
    @Bean
    public OpenAPI candleStreamOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Candle Stream Service API")
                        .description("""
                                Live OHLCV candle stream with a durable segmented log.
                                
                                **Live feed:** binary WebSocket frames at `/ws/candles`
                                (32-byte little-endian header followed by 24-byte candle records).
                                
                                **State:** the current manifest and the most recently flushed
                                segment as newline-delimited JSON.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8787")
                                .description("Local Development Server")
                ));
    }
}
