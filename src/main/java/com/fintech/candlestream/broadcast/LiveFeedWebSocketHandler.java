package com.fintech.candlestream.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * WebSocket endpoint for live subscribers. Registers each session on connect
 * and removes it on close or transport error. The feed is one-way; inbound
 * frames are ignored.
 */
public class LiveFeedWebSocketHandler extends BinaryWebSocketHandler {
    
    private static final Logger log = LoggerFactory.getLogger(LiveFeedWebSocketHandler.class);
    
    private final SubscriberRegistry registry;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    
    public LiveFeedWebSocketHandler(SubscriberRegistry registry, int sendTimeLimitMs, int bufferSizeLimit) {
        this.registry = registry;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }
    
    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
            session,
            sendTimeLimitMs,
            bufferSizeLimit,
            ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP
        );
        registry.add(new WebSocketSubscriber(decorated));
    }
    
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        log.trace("Ignoring inbound frame: session={}, bytes={}", session.getId(), message.getPayloadLength());
    }
    
    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Live subscriber transport error: session={}, reason={}", session.getId(), exception.getMessage());
        registry.remove(session.getId());
    }
    
    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.remove(session.getId());
    }
}
