package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.feature.game.dto.StartRoundRequest;
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
public class StartRoundHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.START;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            StartRoundRequest dto = objectMapper.treeToValue(payload, StartRoundRequest.class);
            if (dto != null) {
                gameService.startRound(session.getId(),
                        dto.requestedRound(), dto.requestedSeconds(), dto.requestedLetter());
            }
        } catch (JsonProcessingException e) {
            log.warn("[start] 요청 형식 오류: session={}, msg={}", session.getId(), e.getOriginalMessage());
        }
    }
}
