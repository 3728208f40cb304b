package com.copyleft.LetterClash.infra.websocket;

import lombok.Getter;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.atomic.AtomicBoolean;

@Getter
public class ConnectionState {

    private final WebSocketSession session;        // 동시 전송용 데코레이터
    private final ConnectionRateLimiter rateLimiter;
    private final AtomicBoolean awaitingPong = new AtomicBoolean(false);

    public ConnectionState(WebSocketSession session, ConnectionRateLimiter rateLimiter) {
        this.session = session;
        this.rateLimiter = rateLimiter;
    }

    public String getSessionId() {
        return session.getId();
    }

    public boolean isAwaitingPong() {
        return awaitingPong.get();
    }

    public void markAwaitingPong() {
        awaitingPong.set(true);
    }

    public void markAlive() {
        awaitingPong.set(false);
    }
}
