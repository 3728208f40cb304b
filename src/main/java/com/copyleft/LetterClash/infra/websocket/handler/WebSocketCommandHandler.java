package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.socket.WebSocketSession;

public interface WebSocketCommandHandler {

    ClientMessageType getType();

    void handle(WebSocketSession session, JsonNode payload);
}
