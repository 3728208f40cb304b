package com.copyleft.LetterClash.domain.type;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;

@AllArgsConstructor
public enum Language {
    AR("ar"),
    EN("en");

    private final String code;

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * "en" 만 영어로 인식하고 나머지는 모두 아랍어로 처리한다.
     */
    public static Language fromCode(String code) {
        return EN.code.equals(code) ? EN : AR;
    }
}
