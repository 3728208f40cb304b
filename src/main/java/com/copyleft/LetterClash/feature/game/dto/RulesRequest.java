package com.copyleft.LetterClash.feature.game.dto;

import com.copyleft.LetterClash.global.util.JsonFields;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class RulesRequest {

    private JsonNode rules; // {requireLetter?, dupZero?}

    public Boolean requireLetter() {
        return rules == null ? null : JsonFields.asBoolean(rules.get("requireLetter"));
    }

    public Boolean dupZero() {
        return rules == null ? null : JsonFields.asBoolean(rules.get("dupZero"));
    }
}
