package com.copyleft.LetterClash.domain;

import com.copyleft.LetterClash.domain.type.PlayerRole;
import com.copyleft.LetterClash.domain.type.RoomPhase;
import com.copyleft.LetterClash.domain.vo.RoomRules;
import com.copyleft.LetterClash.domain.vo.ScorePair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    @Test
    @DisplayName("첫 입장자는 방장, 이후 입장자는 게스트가 된다")
    void addPlayer_FirstIsHost() {
        // given
        Room room = Room.create("AB12CD", 4);

        // when
        Player host = room.addPlayer("h", "Hana");
        Player guest = room.addPlayer("g", "Gil");

        // then
        assertEquals(PlayerRole.HOST, host.getRole());
        assertEquals(PlayerRole.GUEST, guest.getRole());
        assertTrue(room.isHost("h"));
        assertFalse(room.isHost("g"));
        assertEquals(List.of("h", "g"), room.getSessionIds());
    }

    @Test
    @DisplayName("방장이 나가면 명단의 첫 번째 플레이어가 방장이 된다")
    void electHost_AfterHostLeaves() {
        // given
        Room room = Room.create("ROOM", 4);
        room.addPlayer("h", "H");
        room.addPlayer("g1", "G1");
        room.addPlayer("g2", "G2");

        // when
        room.removePlayer("h");
        boolean changed = room.electHost();

        // then
        assertTrue(changed);
        assertEquals("g1", room.getHostSessionId());
        assertEquals(PlayerRole.HOST, room.findPlayer("g1").orElseThrow().getRole());
        assertEquals(PlayerRole.GUEST, room.findPlayer("g2").orElseThrow().getRole());
        assertEquals(1, room.getRoster().stream().filter(e -> e.role() == PlayerRole.HOST).count());
    }

    @Test
    @DisplayName("게스트가 나가면 방장은 그대로다")
    void electHost_GuestLeaves_NoChange() {
        Room room = Room.create("ROOM", 4);
        room.addPlayer("h", "H");
        room.addPlayer("g", "G");

        room.removePlayer("g");

        assertFalse(room.electHost());
        assertEquals("h", room.getHostSessionId());
    }

    @Test
    @DisplayName("마지막 플레이어가 나가면 방장이 없어진다")
    void electHost_EmptyRoster() {
        Room room = Room.create("ROOM", 4);
        room.addPlayer("h", "H");

        room.removePlayer("h");

        assertTrue(room.electHost());
        assertNull(room.getHostSessionId());
        assertTrue(room.getHost().isEmpty());
        assertTrue(room.isEmpty());
    }

    @Test
    @DisplayName("정원만큼 차면 isFull 이 true 가 된다")
    void isFull() {
        Room room = Room.create("ROOM", 2);
        room.addPlayer("a", "A");
        assertFalse(room.isFull());

        room.addPlayer("b", "B");
        assertTrue(room.isFull());
    }

    @Test
    @DisplayName("라운드 시작 시 대기 답안이 지워지고 마감 시각이 계산된다")
    void startRound_ResetsPendingAnswers() {
        // given
        Room room = Room.create("ROOM", 4);
        room.submitAnswers(PlayerRole.HOST, List.of("old"));

        // when
        long deadline = room.startRound(3, 45, "س", 1_000L);

        // then
        assertEquals(1_000L + 45_000L, deadline);
        assertEquals(3, room.getCurrentRound());
        assertEquals("س", room.getLetter());
        assertEquals(RoomPhase.ROUND_ACTIVE, room.getPhase());
        assertTrue(room.getPendingAnswers(PlayerRole.HOST).isEmpty());
    }

    @Test
    @DisplayName("양쪽 답안이 모두 모이면 submitAnswers 가 true 를 반환한다")
    void submitAnswers_BothPresent() {
        Room room = Room.create("ROOM", 4);

        assertFalse(room.submitAnswers(PlayerRole.HOST, List.of("a")));
        assertTrue(room.submitAnswers(PlayerRole.GUEST, List.of()));
    }

    @Test
    @DisplayName("시간 종료 시 제출하지 않은 쪽만 빈 답안으로 채운다")
    void fillMissingAnswers() {
        Room room = Room.create("ROOM", 4);
        room.submitAnswers(PlayerRole.HOST, List.of("سمك"));

        room.fillMissingAnswers();

        assertEquals(List.of("سمك"), room.getPendingAnswers(PlayerRole.HOST).orElseThrow());
        assertEquals(List.of(), room.getPendingAnswers(PlayerRole.GUEST).orElseThrow());
    }

    @Test
    @DisplayName("채점 결과를 반영하면 누적 점수와 기록이 갱신되고 같은 라운드는 채점된 것으로 표시된다")
    void applyRoundScore() {
        // given
        Room room = Room.create("ROOM", 4);
        room.startRound(1, 60, "a", 0L);
        assertFalse(room.isRoundScored());

        // when
        room.applyRoundScore(new ScorePair(2, 1));

        // then
        assertTrue(room.isRoundScored());
        assertEquals(new ScorePair(2, 1), room.getRunningScore());
        assertEquals(List.of(new ScorePair(2, 1)), room.getRoundHistory());
        assertEquals(RoomPhase.SCORED, room.getPhase());
        assertFalse(room.hasBothAnswers());
    }

    @Test
    @DisplayName("규칙 병합 시 보내지 않은 항목은 유지된다")
    void mergeRules_KeepsAbsentFields() {
        Room room = Room.create("ROOM", 4);

        RoomRules merged = room.mergeRules(null, false);

        assertEquals(new RoomRules(true, false), merged);
        assertEquals(merged, room.getRules());
    }
}
