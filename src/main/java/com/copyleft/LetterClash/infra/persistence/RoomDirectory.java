package com.copyleft.LetterClash.infra.persistence;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.domain.Room;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 코드 → 방, 세션 → 방 코드 매핑. 프로세스 메모리에만 존재한다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RoomDirectory {

    private final GameProperties gameProperties;

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> sessionRooms = new ConcurrentHashMap<>();

    public Room getOrCreate(String roomCode) {
        return rooms.computeIfAbsent(roomCode, code -> {
            log.info("방 생성: code={}, max={}", code, gameProperties.defaultMaxPlayers());
            return Room.create(code, gameProperties.defaultMaxPlayers());
        });
    }

    public Optional<Room> findRoomByCode(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(roomCode));
    }

    public Optional<Room> findRoomBySessionId(String sessionId) {
        return findRoomByCode(getRoomCodeBySessionId(sessionId));
    }

    /**
     * 같은 코드로 새로 만들어진 방은 지우지 않는다.
     */
    public boolean deleteRoom(Room room) {
        room.close();
        return rooms.remove(room.getRoomCode(), room);
    }

    public void saveSessionRoomMapping(String sessionId, String roomCode) {
        sessionRooms.put(sessionId, roomCode);
    }

    public String getRoomCodeBySessionId(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        return sessionRooms.get(sessionId);
    }

    public void deleteSessionRoomMapping(String sessionId) {
        sessionRooms.remove(sessionId);
    }

    public int countRooms() {
        return rooms.size();
    }
}
