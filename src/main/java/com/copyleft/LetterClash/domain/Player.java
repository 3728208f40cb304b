package com.copyleft.LetterClash.domain;

import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.vo.RosterEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Player {

    private String sessionId; // 웹소켓 세션 ID
    private String name;      // 표시용 이름 (최대 32자)
    private PlayerRole role;  // HOST / GUEST

    public static Player of(String sessionId, String name) {
        return Player.builder()
                .sessionId(sessionId)
                .name(name)
                .role(PlayerRole.GUEST)
                .build();
    }

    public boolean isHost() {
        return role == PlayerRole.HOST;
    }

    public RosterEntry toRosterEntry() {
        return new RosterEntry(role, name);
    }
}
