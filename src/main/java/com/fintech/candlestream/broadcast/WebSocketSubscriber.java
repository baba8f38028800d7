package com.fintech.candlestream.broadcast;

import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link LiveSubscriber} backed by a WebSocket session. The session is expected
 * to be wrapped in a {@code ConcurrentWebSocketSessionDecorator} so that
 * concurrent sends are buffered and bounded rather than blocking.
 */
public class WebSocketSubscriber implements LiveSubscriber {
    
    private final WebSocketSession session;
    
    public WebSocketSubscriber(WebSocketSession session) {
        this.session = session;
    }
    
    @Override
    public String id() {
        return session.getId();
    }
    
    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
    
    @Override
    public void send(byte[] payload) throws IOException {
        session.sendMessage(new BinaryMessage(payload));
    }
}
