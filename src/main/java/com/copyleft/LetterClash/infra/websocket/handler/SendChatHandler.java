package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.chat.ChatService;
import com.copyleft.LetterClash.feature.chat.dto.ChatRequest;
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
public class SendChatHandler implements WebSocketCommandHandler {

    private final ChatService chatService;
    private final ObjectMapper objectMapper;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.CHAT;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            ChatRequest dto = objectMapper.treeToValue(payload, ChatRequest.class);
            if (dto != null) {
                chatService.processChat(session.getId(), dto.getText());
            }
        } catch (JsonProcessingException e) {
            log.warn("[chat] 요청 형식 오류: session={}, msg={}", session.getId(), e.getOriginalMessage());
        }
    }
}
