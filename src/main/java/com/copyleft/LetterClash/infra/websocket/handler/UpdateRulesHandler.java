package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.feature.game.dto.RulesRequest;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateRulesHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.RULES;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            RulesRequest dto = objectMapper.treeToValue(payload, RulesRequest.class);
            if (dto != null) {
                gameService.updateRules(session.getId(), dto.requireLetter(), dto.dupZero());
            }
        } catch (JsonProcessingException e) {
            log.warn("[rules] 요청 형식 오류: session={}, msg={}", session.getId(), e.getOriginalMessage());
        }
    }
}
