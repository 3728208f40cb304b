package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

// 방장 클라이언트가 계산한 점수판을 그대로 방 전체에 전달한다
@Component
@RequiredArgsConstructor
public class RelayScoresHandler implements WebSocketCommandHandler {

    private final GameService gameService;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.SCORES;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        gameService.relayScores(session.getId(), payload);
    }
}
