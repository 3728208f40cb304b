package com.copyleft.LetterClash.feature.game;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.domain.vo.RoundScore;
import com.copyleft.LetterClash.feature.game.dto.GamePayloads;
import com.copyleft.LetterClash.infra.websocket.WebSocketSender;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GameResponseSender {

    private final WebSocketSender webSocketSender;

    public void broadcastRoundStart(Room room) {
        GamePayloads.RoundStart response = GamePayloads.RoundStart.builder()
                .round(room.getCurrentRound())
                .letter(room.getLetter())
                .total(room.getRoundSeconds())
                .deadline(room.getDeadline())
                .build();
        webSocketSender.broadcast(room.getSessionIds(), response);
    }

    public void broadcastRoundFinish(Room room) {
        webSocketSender.broadcast(room.getSessionIds(), new GamePayloads.RoundFinish());
    }

    public void broadcastScores(Room room, RoundScore score) {
        GamePayloads.Scores response = GamePayloads.Scores.builder()
                .perRound(score.delta())
                .running(room.getRunningScore())
                .scores(GamePayloads.LegacyScores.builder().totals(score.delta()).build())
                .build();
        webSocketSender.broadcast(room.getSessionIds(), response);
    }

    public void sendNeedMore(String sessionId, int required) {
        GamePayloads.NeedMore response = GamePayloads.NeedMore.builder()
                .n(required)
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void broadcastLanguage(Room room) {
        GamePayloads.LanguageChanged response = GamePayloads.LanguageChanged.builder()
                .lang(room.getLanguage())
                .build();
        webSocketSender.broadcast(room.getSessionIds(), response);
    }

    public void broadcastRules(Room room) {
        GamePayloads.RulesChanged response = GamePayloads.RulesChanged.builder()
                .rules(room.getRules())
                .build();
        webSocketSender.broadcast(room.getSessionIds(), response);
    }

    // 방장이 보낸 scores 메시지를 그대로 중계
    public void relayScores(Room room, JsonNode message) {
        webSocketSender.broadcast(room.getSessionIds(), message);
    }
}
