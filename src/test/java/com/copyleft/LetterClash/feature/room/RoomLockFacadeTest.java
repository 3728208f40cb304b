package com.copyleft.LetterClash.feature.room;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.infra.persistence.RoomDirectory;
import com.copyleft.LetterClash.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class RoomLockFacadeTest {

    private RoomDirectory roomDirectory;
    private RoomLockFacade lockFacade;

    @BeforeEach
    void setUp() {
        roomDirectory = new RoomDirectory(TestProperties.game());
        lockFacade = new RoomLockFacade(roomDirectory);
    }

    @Test
    @DisplayName("락 안에서 결과를 돌려준다")
    void execute_ReturnsResult() {
        Room room = roomDirectory.getOrCreate("ROOM");

        LockResult<Integer> result = lockFacade.execute(room, () -> room.getLock().getHoldCount());

        assertTrue(result.isSuccess());
        assertEquals(1, result.getData());
        assertFalse(room.getLock().isLocked());
    }

    @Test
    @DisplayName("삭제된 방은 action 을 실행하지 않고 ROOM_CLOSED 를 돌려준다")
    void execute_ClosedRoom() {
        Room room = roomDirectory.getOrCreate("ROOM");
        roomDirectory.deleteRoom(room);
        AtomicBoolean ran = new AtomicBoolean(false);

        LockResult<Void> result = lockFacade.execute(room, () -> ran.set(true));

        assertTrue(result.isRoomClosed());
        assertFalse(ran.get());
    }

    @Test
    @DisplayName("세션이 방에 없으면 NOT_IN_ROOM")
    void executeForSession_NotInRoom() {
        AtomicBoolean ran = new AtomicBoolean(false);

        LockResult<Void> result = lockFacade.executeForSession("nobody", room -> ran.set(true));

        assertTrue(result.isNotInRoom());
        assertFalse(ran.get());
    }

    @Test
    @DisplayName("매핑은 남아 있지만 명단에서 빠진 세션도 NOT_IN_ROOM")
    void executeForSession_StaleMapping() {
        roomDirectory.getOrCreate("ROOM");
        roomDirectory.saveSessionRoomMapping("s1", "ROOM");
        AtomicBoolean ran = new AtomicBoolean(false);

        LockResult<Void> result = lockFacade.executeForSession("s1", room -> ran.set(true));

        assertTrue(result.isNotInRoom());
        assertFalse(ran.get());
    }

    @Test
    @DisplayName("명단에 있는 세션이면 그 방으로 action 을 실행한다")
    void executeForSession_Success() {
        Room room = roomDirectory.getOrCreate("ROOM");
        room.addPlayer("s1", "A");
        roomDirectory.saveSessionRoomMapping("s1", "ROOM");

        LockResult<Void> result = lockFacade.executeForSession("s1", r -> r.mergeRules(false, null));

        assertTrue(result.isSuccess());
        assertFalse(room.getRules().requireLetter());
    }
}
