package com.copyleft.LetterClash.infra.websocket;

import com.copyleft.LetterClash.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRateLimiterTest {

    private final MutableClock clock = new MutableClock(0L);
    private final ConnectionRateLimiter rateLimiter = new ConnectionRateLimiter(10, 5.0, clock);

    @Test
    @DisplayName("연속 10개까지 받고 11번째는 버리며 0.2초 뒤 하나를 더 받는다")
    void burstThenRefill() {
        for (int i = 0; i < 10; i++) {
            assertTrue(rateLimiter.tryAcquire(), "message " + (i + 1));
        }
        assertFalse(rateLimiter.tryAcquire());

        clock.advance(200);

        assertTrue(rateLimiter.tryAcquire());
        assertFalse(rateLimiter.tryAcquire());
    }

    @Test
    @DisplayName("소수 토큰은 유지되어 다음 충전에 더해진다")
    void fractionalTokensPersist() {
        for (int i = 0; i < 10; i++) {
            rateLimiter.tryAcquire();
        }

        clock.advance(100);
        assertFalse(rateLimiter.tryAcquire());

        clock.advance(100);
        assertTrue(rateLimiter.tryAcquire());
    }

    @Test
    @DisplayName("오래 쉬어도 용량 이상으로 쌓이지 않는다")
    void clampedAtCapacity() {
        clock.advance(60_000);

        assertEquals(10.0, rateLimiter.availableTokens(), 1e-9);
    }

    @Test
    @DisplayName("잘못된 설정값은 거부한다")
    void invalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionRateLimiter(0, 5.0, clock));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionRateLimiter(10, -1.0, clock));
    }
}
