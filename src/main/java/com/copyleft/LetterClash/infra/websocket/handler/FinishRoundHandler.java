package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class FinishRoundHandler implements WebSocketCommandHandler {

    private final GameService gameService;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.FINISH;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        gameService.finishRound(session.getId());
    }
}
