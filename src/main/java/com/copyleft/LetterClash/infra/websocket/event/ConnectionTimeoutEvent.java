package com.copyleft.LetterClash.infra.websocket.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 생존 확인에 응답하지 않아 강제 종료된 연결
@Getter
@RequiredArgsConstructor
public class ConnectionTimeoutEvent {
    private final String sessionId;
}
