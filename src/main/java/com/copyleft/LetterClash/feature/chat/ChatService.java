package com.copyleft.LetterClash.feature.chat;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.feature.chat.dto.ChatResponse;
import com.copyleft.LetterClash.feature.room.LockResult;
import com.copyleft.LetterClash.feature.room.RoomLockFacade;
import com.copyleft.LetterClash.global.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final RoomLockFacade lockFacade;
    private final ChatResponseSender chatResponseSender;
    private final GameProperties gameProperties;

    public void processChat(String sessionId, String message) {
        String text = TextNormalizer.truncate(message, gameProperties.maxChatLength());

        LockResult<Void> result = lockFacade.executeForSession(sessionId, room ->
                room.findPlayer(sessionId).ifPresent(sender -> {
                    ChatResponse chatData = ChatResponse.builder()
                            .from(sender.getRole())
                            .name(sender.getName())
                            .text(text)
                            .build();
                    chatResponseSender.broadcastChat(room, chatData);
                    log.debug("채팅 전송: room={}, sender={}", room.getRoomCode(), sender.getName());
                }));

        if (result.isNotInRoom()) {
            log.debug("방에 없는 세션의 채팅 무시: {}", sessionId);
        }
    }
}
