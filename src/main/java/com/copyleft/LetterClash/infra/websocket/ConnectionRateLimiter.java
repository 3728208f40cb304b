package com.copyleft.LetterClash.infra.websocket;

import java.time.Clock;

/**
 * 연결 하나의 토큰 버킷. 마지막 확인 이후 경과 시간만큼 연속적으로 충전하고 메시지 하나에 토큰 하나를 쓴다.
 */
public class ConnectionRateLimiter {

    private final double capacity;
    private final double refillPerMilli;
    private final Clock clock;

    private double tokens;
    private long lastRefillAt;

    public ConnectionRateLimiter(int capacity, double refillPerSecond, Clock clock) {
        if (capacity <= 0 || refillPerSecond < 0) {
            throw new IllegalArgumentException("capacity must be positive and refill rate non-negative");
        }
        this.capacity = capacity;
        this.refillPerMilli = refillPerSecond / 1000.0;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillAt = clock.millis();
    }

    public synchronized boolean tryAcquire() {
        refill();
        if (tokens < 1) {
            return false;
        }
        tokens -= 1;
        return true;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = Math.max(0L, now - lastRefillAt);
        tokens = Math.min(capacity, tokens + elapsed * refillPerMilli);
        lastRefillAt = now;
    }
}
