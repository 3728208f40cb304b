package com.copyleft.LetterClash.feature.game;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.domain.type.Language;
import com.copyleft.LetterClash.feature.room.LockResult;
import com.copyleft.LetterClash.feature.room.RoomLockFacade;
import com.copyleft.LetterClash.global.util.TextNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final RoomLockFacade lockFacade;
    private final RoundJudgeService roundJudgeService;
    private final GameResponseSender gameResponseSender;
    private final GameProperties gameProperties;
    private final Clock clock;

    public void startRound(String sessionId, Integer round, Integer seconds, String letter) {
        withHostRoom(sessionId, "start", room -> {
            if (room.size() < gameProperties.minPlayersToStart()) {
                log.info("시작 인원 부족: room={}, 현재={}, 필요={}",
                        room.getRoomCode(), room.size(), gameProperties.minPlayersToStart());
                gameResponseSender.sendNeedMore(sessionId, gameProperties.minPlayersToStart());
                return;
            }

            int nextRound = (round == null || round <= 0) ? 1 : round;
            int total = (seconds == null || seconds <= 0) ? gameProperties.defaultRoundSeconds() : seconds;
            String nextLetter = TextNormalizer.truncate(letter, gameProperties.maxLetterLength());

            room.startRound(nextRound, total, nextLetter, clock.millis());
            gameResponseSender.broadcastRoundStart(room);

            log.info("라운드 시작: room={}, round={}, letter={}, total={}s",
                    room.getRoomCode(), nextRound, nextLetter, total);
        });
    }

    public void submitAnswers(String sessionId, List<String> answers) {
        withMemberRoom(sessionId, "answers", room -> {
            room.findPlayer(sessionId).ifPresent(player -> {
                boolean complete = room.submitAnswers(player.getRole(), answers);
                log.debug("답안 제출: room={}, role={}, count={}", room.getRoomCode(), player.getRole(), answers.size());
                if (complete) {
                    roundJudgeService.scoreRound(room);
                }
            });
        });
    }

    /**
     * 시간 종료. 제출하지 않은 쪽은 빈 답안으로 채워 바로 채점한다.
     */
    public void finishRound(String sessionId) {
        withMemberRoom(sessionId, "finish", room -> {
            gameResponseSender.broadcastRoundFinish(room);
            room.fillMissingAnswers();
            roundJudgeService.scoreRound(room);
        });
    }

    public void updateRules(String sessionId, Boolean requireLetter, Boolean dupZero) {
        withHostRoom(sessionId, "rules", room -> {
            room.mergeRules(requireLetter, dupZero);
            gameResponseSender.broadcastRules(room);
            log.info("규칙 변경: room={}, rules={}", room.getRoomCode(), room.getRules());
        });
    }

    public void changeLanguage(String sessionId, String lang) {
        withHostRoom(sessionId, "lang", room -> {
            room.setLanguage(Language.fromCode(lang));
            gameResponseSender.broadcastLanguage(room);
            log.info("언어 변경: room={}, lang={}", room.getRoomCode(), room.getLanguage());
        });
    }

    public void relayScores(String sessionId, JsonNode message) {
        withHostRoom(sessionId, "scores", room -> gameResponseSender.relayScores(room, message));
    }

    private void withHostRoom(String sessionId, String action, Consumer<Room> body) {
        withMemberRoom(sessionId, action, room -> {
            if (!room.isHost(sessionId)) {
                log.debug("방장 전용 요청 무시: action={}, room={}, session={}", action, room.getRoomCode(), sessionId);
                return;
            }
            body.accept(room);
        });
    }

    private void withMemberRoom(String sessionId, String action, Consumer<Room> body) {
        LockResult<Void> result = lockFacade.executeForSession(sessionId, body);
        if (result.isNotInRoom()) {
            log.debug("방에 없는 세션의 요청 무시: action={}, session={}", action, sessionId);
        } else if (result.isLockFailed()) {
            log.error("락 획득 실패로 요청 처리 못함: action={}, session={}", action, sessionId);
        }
    }
}
