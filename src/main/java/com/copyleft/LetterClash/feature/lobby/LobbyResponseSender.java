package com.copyleft.LetterClash.feature.lobby;

import com.copyleft.LetterClash.domain.Player;
import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.feature.lobby.dto.LobbyPayloads;
import com.copyleft.LetterClash.infra.websocket.WebSocketSender;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

@Component
@RequiredArgsConstructor
public class LobbyResponseSender {

    private final WebSocketSender webSocketSender;

    public void sendJoined(String sessionId, Room room, Player player) {
        LobbyPayloads.Joined response = LobbyPayloads.Joined.builder()
                .code(room.getRoomCode())
                .role(player.getRole())
                .max(room.getMaxPlayers())
                .list(room.getRoster())
                .lang(room.getLanguage())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    /**
     * 정원 초과 알림 후 정상 종료 코드(1000)로 연결을 닫는다.
     */
    public void rejectRoomFull(String sessionId, Room room) {
        LobbyPayloads.RoomFull response = LobbyPayloads.RoomFull.builder()
                .max(room.getMaxPlayers())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
        webSocketSender.close(sessionId, CloseStatus.NORMAL);
    }

    public void sendRoster(String sessionId, Room room) {
        webSocketSender.sendEventToSession(sessionId, roster(room));
    }

    // 명단 + 인원 수
    public void broadcastRosterUpdate(Room room) {
        webSocketSender.broadcast(room.getSessionIds(), roster(room));

        LobbyPayloads.PeerCount peerCount = LobbyPayloads.PeerCount.builder()
                .n(room.size())
                .max(room.getMaxPlayers())
                .build();
        webSocketSender.broadcast(room.getSessionIds(), peerCount);
    }

    public void broadcastHostChanged(Room room) {
        webSocketSender.broadcast(room.getSessionIds(), new LobbyPayloads.HostChanged());
    }

    private LobbyPayloads.Roster roster(Room room) {
        return LobbyPayloads.Roster.builder()
                .list(room.getRoster())
                .build();
    }
}
