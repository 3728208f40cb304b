package com.copyleft.LetterClash.feature.lobby.dto;

import com.copyleft.LetterClash.global.util.JsonFields;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinRequest {

    private String code;
    private String name;
    private JsonNode maxPlayers; // 숫자 또는 숫자 문자열

    public Integer requestedMaxPlayers() {
        return JsonFields.asInteger(maxPlayers);
    }
}
