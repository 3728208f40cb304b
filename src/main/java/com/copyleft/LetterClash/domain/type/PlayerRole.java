package com.copyleft.LetterClash.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public enum PlayerRole {
    HOST("host"),
    GUEST("guest");

    private final String wireName;

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
