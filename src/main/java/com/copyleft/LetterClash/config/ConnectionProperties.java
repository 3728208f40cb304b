package com.copyleft.LetterClash.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.connection")
public record ConnectionProperties(
        int rateLimitCapacity,           // 토큰 버킷 최대 용량
        double rateLimitRefillPerSecond, // 초당 충전 토큰 수
        long heartbeatIntervalMs,        // 생존 확인 주기
        int sendTimeLimitMs,             // 세션 전송 제한 시간
        int sendBufferSizeLimit          // 세션 전송 버퍼 제한
) {}
