package com.copyleft.LetterClash.feature.game.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnswersRequest {

    private JsonNode answers; // 배열이 아니면 빈 답안으로 처리
}
