package com.copyleft.LetterClash.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 클라이언트 → 서버 메시지의 "t" 값. 상수마다 정확히 하나의 커맨드 핸들러가 있어야 한다.
 */
@Getter
@AllArgsConstructor
public enum ClientMessageType {
    JOIN("join"),
    ASK_ROSTER("askRoster"),
    CHAT("chat"),
    LANG("lang"),
    RULES("rules"),
    START("start"),
    FINISH("finish"),
    ANSWERS("answers"),
    SCORES("scores");

    private final String wireName;

    public static Optional<ClientMessageType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
