package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.lobby.LobbyService;
import com.copyleft.LetterClash.feature.lobby.dto.JoinRequest;
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
public class JoinRoomHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;
    private final ObjectMapper objectMapper;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.JOIN;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            JoinRequest dto = objectMapper.treeToValue(payload, JoinRequest.class);
            if (dto == null || dto.getCode() == null) {
                log.debug("[join] 방 코드 누락: session={}", session.getId());
                return;
            }
            lobbyService.joinRoom(session.getId(), dto.getCode(), dto.getName(), dto.requestedMaxPlayers());
        } catch (JsonProcessingException e) {
            log.warn("[join] 요청 형식 오류: session={}, msg={}", session.getId(), e.getOriginalMessage());
        }
    }
}
