package com.copyleft.LetterClash.feature.chat.dto;

import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.global.constant.SocketEvent;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ChatResponse {
    private final SocketEvent t = SocketEvent.CHAT;
    private PlayerRole from; // 보낸 사람 역할
    private String name;
    private String text;     // 최대 240자
}
