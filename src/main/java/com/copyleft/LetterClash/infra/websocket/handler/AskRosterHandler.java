package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.lobby.LobbyService;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Component
@RequiredArgsConstructor
public class AskRosterHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.ASK_ROSTER;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        lobbyService.sendRoster(session.getId());
    }
}
