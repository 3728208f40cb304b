package com.copyleft.LetterClash.feature.lobby.dto;

import com.copyleft.LetterClash.domain.type.Language;
import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.vo.RosterEntry;
import com.copyleft.LetterClash.global.constant.SocketEvent;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class LobbyPayloads {

    // 입장 확인 (개인)
    @Getter
    @Builder
    public static class Joined {
        private final SocketEvent t = SocketEvent.JOINED;
        private String code;
        private PlayerRole role;
        private int max;
        private List<RosterEntry> list;
        private Language lang;
    }

    @Getter
    @Builder
    public static class RoomFull {
        private final SocketEvent t = SocketEvent.ROOM_FULL;
        private int max;
    }

    @Getter
    @Builder
    public static class Roster {
        private final SocketEvent t = SocketEvent.ROSTER;
        private List<RosterEntry> list;
    }

    @Getter
    @Builder
    public static class PeerCount {
        private final SocketEvent t = SocketEvent.PEER_COUNT;
        private int n;
        private int max;
    }

    @Getter
    public static class HostChanged {
        private final SocketEvent t = SocketEvent.HOST_CHANGED;
    }
}
