package com.copyleft.LetterClash.feature.room;

import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.infra.persistence.RoomDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 방 단위 직렬화 경계. 같은 방에 대한 입장/퇴장/방장 선출/채점은 이 락 안에서만 실행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomLockFacade {

    private final RoomDirectory roomDirectory;

    private static final long WAIT_TIME_MS = 2_000L; // 락 대기 최대 시간
    private static final int MAX_RETRY = 3;           // 최대 3번 재시도

    public LockResult<Void> execute(Room room, Runnable action) {
        return executeInternal(room, () -> {
            action.run();
            return null;
        });
    }

    public <T> LockResult<T> execute(Room room, Supplier<T> action) {
        return executeInternal(room, action);
    }

    /**
     * 세션이 속한 방의 락을 잡고, 세션이 여전히 명단에 있을 때만 action 을 실행한다.
     */
    public LockResult<Void> executeForSession(String sessionId, Consumer<Room> action) {
        Optional<Room> roomOpt = roomDirectory.findRoomBySessionId(sessionId);
        if (roomOpt.isEmpty()) {
            return LockResult.notInRoom();
        }
        Room room = roomOpt.get();

        LockResult<Boolean> result = executeInternal(room, () -> {
            if (!room.contains(sessionId)) {
                return false;
            }
            action.accept(room);
            return true;
        });

        if (result.isLockFailed()) {
            return LockResult.lockFailed();
        }
        if (result.isRoomClosed() || !Boolean.TRUE.equals(result.getData())) {
            return LockResult.notInRoom();
        }
        return LockResult.success(null);
    }

    private <T> LockResult<T> executeInternal(Room room, Supplier<T> action) {
        ReentrantLock lock = room.getLock();

        for (int i = 0; i < MAX_RETRY; i++) {
            try {
                if (lock.tryLock(WAIT_TIME_MS, TimeUnit.MILLISECONDS)) {
                    try {
                        if (room.isClosed()) {
                            return LockResult.roomClosed();
                        }
                        return LockResult.success(action.get());
                    } finally {
                        lock.unlock();
                    }
                }
                log.warn("락 획득 실패, 재시도 ({}/{}): room={}", i + 1, MAX_RETRY, room.getRoomCode());

            } catch (InterruptedException e) {
                log.error("락 대기 중 인터럽트 발생: room={}", room.getRoomCode(), e);
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            }
        }

        log.error("락 획득 최종 실패 (Timeout): room={}", room.getRoomCode());
        return LockResult.lockFailed();
    }
}
