package com.copyleft.LetterClash.feature.game.dto;

import com.copyleft.LetterClash.global.util.JsonFields;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class StartRoundRequest {

    private JsonNode round;
    private JsonNode total;  // 라운드 시간 (초)
    private JsonNode letter; // 방장 클라이언트가 고른 글자

    public Integer requestedRound() {
        return JsonFields.asInteger(round);
    }

    public Integer requestedSeconds() {
        return JsonFields.asInteger(total);
    }

    public String requestedLetter() {
        return JsonFields.asText(letter);
    }
}
