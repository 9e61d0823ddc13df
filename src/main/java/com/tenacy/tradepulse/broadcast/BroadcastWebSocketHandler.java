package com.tenacy.tradepulse.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@RequiredArgsConstructor
@Slf4j
public class BroadcastWebSocketHandler extends TextWebSocketHandler {

    private final Broadcaster broadcaster;

    private final Map<String, WebSocketSubscriber> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSubscriber subscriber = new WebSocketSubscriber(session);
        sessions.put(session.getId(), subscriber);
        broadcaster.join(subscriber);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSubscriber subscriber = sessions.get(session.getId());
        if (subscriber != null) {
            broadcaster.handleInbound(subscriber, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        disconnect(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        disconnect(session);
    }

    private void disconnect(WebSocketSession session) {
        WebSocketSubscriber subscriber = sessions.remove(session.getId());
        if (subscriber != null) {
            broadcaster.leave(subscriber);
        }
    }
}
