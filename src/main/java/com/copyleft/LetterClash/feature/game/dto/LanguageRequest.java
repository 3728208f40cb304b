package com.copyleft.LetterClash.feature.game.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class LanguageRequest {
    private String lang;
}
