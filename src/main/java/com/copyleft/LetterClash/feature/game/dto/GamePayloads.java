package com.copyleft.LetterClash.feature.game.dto;

import com.copyleft.LetterClash.domain.type.Language;
import com.copyleft.LetterClash.domain.vo.RoomRules;
import com.copyleft.LetterClash.domain.vo.ScorePair;
import com.copyleft.LetterClash.global.constant.SocketEvent;
import lombok.Builder;
import lombok.Getter;

public class GamePayloads {

    // 라운드 시작
    @Getter
    @Builder
    public static class RoundStart {
        private final SocketEvent t = SocketEvent.START;
        private int round;
        private String letter;
        private int total;     // 초
        private long deadline; // epoch ms
    }

    @Getter
    public static class RoundFinish {
        private final SocketEvent t = SocketEvent.FINISH;
    }

    // 라운드 결과
    @Getter
    @Builder
    public static class Scores {
        private final SocketEvent t = SocketEvent.SCORES;
        private ScorePair perRound;
        private ScorePair running;
        private LegacyScores scores; // 구버전 클라이언트 호환 (perRound 와 동일)
    }

    @Getter
    @Builder
    public static class LegacyScores {
        private ScorePair totals;
    }

    // 시작 인원 부족 (방장 개인)
    @Getter
    @Builder
    public static class NeedMore {
        private final SocketEvent t = SocketEvent.NEED_MORE;
        private int n;
    }

    @Getter
    @Builder
    public static class LanguageChanged {
        private final SocketEvent t = SocketEvent.LANG;
        private Language lang;
    }

    @Getter
    @Builder
    public static class RulesChanged {
        private final SocketEvent t = SocketEvent.RULES;
        private RoomRules rules;
    }
}
