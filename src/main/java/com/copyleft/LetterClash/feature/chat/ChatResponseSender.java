package com.copyleft.LetterClash.feature.chat;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.feature.chat.dto.ChatResponse;
import com.copyleft.LetterClash.infra.websocket.WebSocketSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChatResponseSender {

    private final WebSocketSender webSocketSender;

    public void broadcastChat(Room room, ChatResponse chatData) {
        webSocketSender.broadcast(room.getSessionIds(), chatData);
    }
}
