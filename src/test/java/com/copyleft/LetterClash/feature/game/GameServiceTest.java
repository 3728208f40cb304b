package com.copyleft.LetterClash.feature.game;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.domain.type.Language;
import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.vo.RoomRules;
import com.copyleft.LetterClash.feature.room.LockResult;
import com.copyleft.LetterClash.feature.room.RoomLockFacade;
import com.copyleft.LetterClash.support.MutableClock;
import com.copyleft.LetterClash.support.TestProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock private RoomLockFacade lockFacade;
    @Mock private RoundJudgeService roundJudgeService;
    @Mock private GameResponseSender gameResponseSender;

    private GameService gameService;
    private Room room;

    @BeforeEach
    void setUp() {
        gameService = new GameService(lockFacade, roundJudgeService, gameResponseSender,
                TestProperties.game(), new MutableClock(NOW));

        room = Room.create("AB12CD", 4);
        room.addPlayer("h", "Host");
        room.addPlayer("g", "Guest");

        // 락을 잡았다고 가정하고 세션이 명단에 있으면 바로 실행
        lenient().doAnswer(invocation -> {
            String sessionId = invocation.getArgument(0);
            Consumer<Room> action = invocation.getArgument(1);
            if (!room.contains(sessionId)) {
                return LockResult.notInRoom();
            }
            action.accept(room);
            return LockResult.success(null);
        }).when(lockFacade).executeForSession(anyString(), any());
    }

    @Test
    @DisplayName("방장이 라운드를 시작하면 상태가 바뀌고 start 가 방송된다")
    void startRound_Success() {
        // when
        gameService.startRound("h", 1, 60, "س");

        // then
        assertEquals(1, room.getCurrentRound());
        assertEquals("س", room.getLetter());
        assertEquals(60, room.getRoundSeconds());
        assertEquals(NOW + 60_000L, room.getDeadline());
        verify(gameResponseSender).broadcastRoundStart(room);
    }

    @Test
    @DisplayName("라운드 번호와 시간이 없으면 1라운드, 60초로 시작하고 글자는 2자로 자른다")
    void startRound_Defaults() {
        gameService.startRound("h", null, null, "abc");

        assertEquals(1, room.getCurrentRound());
        assertEquals(60, room.getRoundSeconds());
        assertEquals("ab", room.getLetter());
    }

    @Test
    @DisplayName("인원이 2명 미만이면 방장에게 need-more 를 보내고 상태는 그대로다")
    void startRound_NeedMore() {
        // given
        room.removePlayer("g");

        // when
        gameService.startRound("h", 2, 60, "a");

        // then
        verify(gameResponseSender).sendNeedMore("h", 2);
        verify(gameResponseSender, never()).broadcastRoundStart(any());
        assertEquals(1, room.getCurrentRound());
        assertNull(room.getLetter());
    }

    @Test
    @DisplayName("게스트의 방장 전용 요청은 무시된다")
    void hostOnly_IgnoredForGuest() {
        gameService.startRound("g", 1, 60, "a");
        gameService.updateRules("g", false, false);
        gameService.changeLanguage("g", "en");
        gameService.relayScores("g", new ObjectMapper().createObjectNode());

        verifyNoInteractions(gameResponseSender);
        assertEquals(RoomRules.defaults(), room.getRules());
        assertEquals(Language.AR, room.getLanguage());
    }

    @Test
    @DisplayName("방에 없는 세션의 요청은 아무 것도 하지 않는다")
    void notInRoom_Ignored() {
        gameService.startRound("stranger", 1, 60, "a");
        gameService.submitAnswers("stranger", List.of("x"));
        gameService.finishRound("stranger");

        verifyNoInteractions(gameResponseSender, roundJudgeService);
    }

    @Test
    @DisplayName("한쪽만 답안을 내면 채점하지 않는다")
    void submitAnswers_OneSide() {
        gameService.submitAnswers("g", List.of("سمك"));

        assertEquals(List.of("سمك"), room.getPendingAnswers(PlayerRole.GUEST).orElseThrow());
        verifyNoInteractions(roundJudgeService);
    }

    @Test
    @DisplayName("양쪽 답안이 모이면 채점한다")
    void submitAnswers_BothSides_Scores() {
        gameService.submitAnswers("h", List.of("سيارة"));
        gameService.submitAnswers("g", List.of("سياره"));

        verify(roundJudgeService).scoreRound(room);
    }

    @Test
    @DisplayName("finish 는 방송 후 빈 답안을 채워 채점한다")
    void finishRound_FillsAndScores() {
        // given
        gameService.submitAnswers("h", List.of("سمك"));

        // when
        gameService.finishRound("h");

        // then
        verify(gameResponseSender).broadcastRoundFinish(room);
        assertEquals(List.of(), room.getPendingAnswers(PlayerRole.GUEST).orElseThrow());
        verify(roundJudgeService).scoreRound(room);
    }

    @Test
    @DisplayName("규칙은 보낸 항목만 병합해서 방송한다")
    void updateRules_Merges() {
        gameService.updateRules("h", null, false);

        assertEquals(new RoomRules(true, false), room.getRules());
        verify(gameResponseSender).broadcastRules(room);
    }

    @Test
    @DisplayName("언어는 en 이면 영어, 그 외에는 아랍어")
    void changeLanguage() {
        gameService.changeLanguage("h", "en");
        assertEquals(Language.EN, room.getLanguage());

        gameService.changeLanguage("h", "fr");
        assertEquals(Language.AR, room.getLanguage());

        verify(gameResponseSender, times(2)).broadcastLanguage(room);
    }

    @Test
    @DisplayName("방장이 보낸 scores 메시지는 그대로 중계된다")
    void relayScores_Host() {
        JsonNode message = new ObjectMapper().createObjectNode().put("t", "scores");

        gameService.relayScores("h", message);

        verify(gameResponseSender).relayScores(eq(room), eq(message));
    }

    @Test
    @DisplayName("락 획득에 실패하면 아무 것도 방송하지 않는다")
    void lockFailed_NoBroadcast() {
        doReturn(LockResult.lockFailed()).when(lockFacade).executeForSession(eq("h"), any());

        gameService.startRound("h", 1, 60, "a");

        verifyNoInteractions(gameResponseSender);
    }
}
