package com.fintech.candlestream.config;

import com.fintech.candlestream.broadcast.LiveFeedWebSocketHandler;
import com.fintech.candlestream.broadcast.SubscriberRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the binary live feed endpoint at {@code candle.stream.broadcast.path}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    
    private final CandleStreamProperties properties;
    private final SubscriberRegistry subscriberRegistry;
    
    public WebSocketConfig(CandleStreamProperties properties, SubscriberRegistry subscriberRegistry) {
        this.properties = properties;
        this.subscriberRegistry = subscriberRegistry;
    }
    
    @Bean
    public LiveFeedWebSocketHandler liveFeedWebSocketHandler() {
        CandleStreamProperties.Broadcast broadcast = properties.getBroadcast();
        return new LiveFeedWebSocketHandler(
            subscriberRegistry, broadcast.getSendTimeLimitMs(), broadcast.getBufferSizeLimit());
    }
    
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        CandleStreamProperties.Broadcast broadcast = properties.getBroadcast();
        registry.addHandler(liveFeedWebSocketHandler(), broadcast.getPath())
            .setAllowedOriginPatterns(broadcast.getAllowedOrigins());
    }
}
