package com.copyleft.LetterClash.global.constant;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

/**
 * 서버 → 클라이언트 이벤트의 "t" 값.
 */
@AllArgsConstructor
public enum SocketEvent {
    JOINED("joined"),             // 입장 확인 (개인)
    ROOM_FULL("room-full"),       // 정원 초과 (개인, 이후 연결 종료)
    NEED_MORE("need-more"),       // 시작 인원 부족 (방장 개인)
    ROSTER("roster"),             // 명단
    PEER_COUNT("peer-count"),     // 인원 수
    HOST_CHANGED("host-changed"), // 방장 변경

    START("start"),               // 라운드 시작
    FINISH("finish"),             // 라운드 종료
    SCORES("scores"),             // 라운드 결과

    CHAT("chat"),
    LANG("lang"),
    RULES("rules");

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
