package com.copyleft.LetterClash.infra.websocket;

import com.copyleft.LetterClash.config.ConnectionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 살아 있는 모든 연결과 연결별 처리율 제한/생존 상태를 관리한다. 방과는 독립적이다.
 */
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final ConnectionProperties connectionProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, ConnectionState> connections = new ConcurrentHashMap<>();

    public void registerSession(WebSocketSession session) {
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session, connectionProperties.sendTimeLimitMs(), connectionProperties.sendBufferSizeLimit());
        ConnectionRateLimiter rateLimiter = new ConnectionRateLimiter(
                connectionProperties.rateLimitCapacity(), connectionProperties.rateLimitRefillPerSecond(), clock);
        connections.put(session.getId(), new ConnectionState(concurrentSession, rateLimiter));
    }

    public void removeSession(WebSocketSession session) {
        removeSession(session.getId());
    }

    public void removeSession(String sessionId) {
        connections.remove(sessionId);
    }

    public WebSocketSession getSession(String sessionId) {
        ConnectionState state = connections.get(sessionId);
        return state != null ? state.getSession() : null;
    }

    /**
     * 등록되지 않은 세션의 메시지는 받지 않는다.
     */
    public boolean tryAcquire(String sessionId) {
        ConnectionState state = connections.get(sessionId);
        return state != null && state.getRateLimiter().tryAcquire();
    }

    public void markAlive(String sessionId) {
        ConnectionState state = connections.get(sessionId);
        if (state != null) {
            state.markAlive();
        }
    }

    public Collection<ConnectionState> getConnections() {
        return List.copyOf(connections.values());
    }

    public int count() {
        return connections.size();
    }
}
