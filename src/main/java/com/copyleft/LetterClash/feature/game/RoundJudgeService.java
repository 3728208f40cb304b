package com.copyleft.LetterClash.feature.game;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.vo.RoundScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 현재 라운드를 한 번만 채점한다. 호출자는 방 락을 잡고 있어야 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundJudgeService {

    private final ScoringEngine scoringEngine;
    private final GameResponseSender gameResponseSender;

    /**
     * @return 이번 호출에서 채점했으면 true, 이미 채점된 라운드면 false
     */
    public boolean scoreRound(Room room) {
        if (room.isRoundScored()) {
            log.debug("이미 채점된 라운드, 무시: room={}, round={}", room.getRoomCode(), room.getCurrentRound());
            return false;
        }

        RoundScore score = scoringEngine.score(
                room.getPendingAnswers(PlayerRole.HOST).orElse(List.of()),
                room.getPendingAnswers(PlayerRole.GUEST).orElse(List.of()),
                room.getLetter(),
                room.getRules()
        );

        room.applyRoundScore(score.delta());
        gameResponseSender.broadcastScores(room, score);

        log.info("라운드 채점 완료: room={}, round={}, 라운드 점수={}, 누적={}",
                room.getRoomCode(), room.getCurrentRound(), score.delta(), room.getRunningScore());
        return true;
    }
}
