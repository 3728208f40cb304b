package com.copyleft.LetterClash.feature.lobby;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.domain.Player;
import com.copyleft.LetterClash.domain.Room;
import com.copyleft.LetterClash.feature.room.LockResult;
import com.copyleft.LetterClash.feature.room.RoomLockFacade;
import com.copyleft.LetterClash.global.util.TextNormalizer;
import com.copyleft.LetterClash.infra.persistence.RoomDirectory;
import com.copyleft.LetterClash.infra.websocket.WebSocketSessionManager;
import com.copyleft.LetterClash.infra.websocket.event.ConnectionTimeoutEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class LobbyService {

    private static final int MAX_JOIN_ATTEMPTS = 3;

    private final RoomDirectory roomDirectory;
    private final RoomLockFacade lockFacade;
    private final GameProperties gameProperties;
    private final LobbyResponseSender responseSender;
    private final WebSocketSessionManager sessionManager;

    @EventListener
    public void handleConnectionTimeout(ConnectionTimeoutEvent event) {
        leaveRoom(event.getSessionId());
    }

    public void joinRoom(String sessionId, String rawCode, String rawName, Integer requestedMaxPlayers) {
        String roomCode = TextNormalizer.normalizeRoomCode(rawCode, gameProperties.roomCodeLength());
        if (roomCode.isEmpty()) {
            log.debug("빈 방 코드로 입장 요청 무시: session={}", sessionId);
            return;
        }
        String name = TextNormalizer.truncate(rawName, gameProperties.maxNameLength());

        String currentCode = roomDirectory.getRoomCodeBySessionId(sessionId);
        if (roomCode.equals(currentCode)) {
            resendJoined(sessionId);
            return;
        }
        if (currentCode != null) {
            log.info("다른 방으로 이동: session={}, {} -> {}", sessionId, currentCode, roomCode);
            leaveRoom(sessionId);
        }

        for (int attempt = 1; attempt <= MAX_JOIN_ATTEMPTS; attempt++) {
            Room room = roomDirectory.getOrCreate(roomCode);
            LockResult<Void> result = lockFacade.execute(room, () -> {
                joinLocked(room, sessionId, name, requestedMaxPlayers);
            });

            if (result.isRoomClosed()) {
                log.debug("입장 대기 중 방이 삭제되어 재시도 ({}/{}): room={}", attempt, MAX_JOIN_ATTEMPTS, roomCode);
                continue;
            }
            if (result.isLockFailed()) {
                log.error("방 입장 락 획득 실패: room={}, session={}", roomCode, sessionId);
            }
            return;
        }
        log.error("방 입장 실패 (재시도 초과): room={}, session={}", roomCode, sessionId);
    }

    private void joinLocked(Room room, String sessionId, String name, Integer requestedMaxPlayers) {
        if (room.isEmpty() && isAllowedCapacity(requestedMaxPlayers)) {
            room.setMaxPlayers(requestedMaxPlayers);
        }

        if (room.isFull()) {
            log.info("정원 초과로 입장 거절: room={}, session={}, max={}", room.getRoomCode(), sessionId, room.getMaxPlayers());
            responseSender.rejectRoomFull(sessionId, room);
            return;
        }

        // 매핑 저장 후 연결 등록 여부 확인 (연결 종료 처리는 등록 해제 후 매핑을 읽는다)
        roomDirectory.saveSessionRoomMapping(sessionId, room.getRoomCode());
        if (sessionManager.getSession(sessionId) == null) {
            log.info("이미 종료된 연결의 입장 요청 폐기: room={}, session={}", room.getRoomCode(), sessionId);
            roomDirectory.deleteSessionRoomMapping(sessionId);
            if (room.isEmpty()) {
                roomDirectory.deleteRoom(room);
            }
            return;
        }

        Player player = room.addPlayer(sessionId, name);

        responseSender.broadcastRosterUpdate(room);
        responseSender.sendJoined(sessionId, room, player);

        log.info("방 입장 완료: room={}, name={}, role={}, {}/{}",
                room.getRoomCode(), name, player.getRole(), room.size(), room.getMaxPlayers());
    }

    private void resendJoined(String sessionId) {
        lockFacade.executeForSession(sessionId, room ->
                room.findPlayer(sessionId).ifPresent(player -> responseSender.sendJoined(sessionId, room, player)));
    }

    private boolean isAllowedCapacity(Integer requested) {
        return requested != null
                && requested >= gameProperties.minMaxPlayers()
                && requested <= gameProperties.maxMaxPlayers();
    }

    public void sendRoster(String sessionId) {
        LockResult<Void> result = lockFacade.executeForSession(sessionId, room -> responseSender.sendRoster(sessionId, room));
        if (result.isNotInRoom()) {
            log.debug("방에 없는 세션의 명단 요청 무시: {}", sessionId);
        }
    }

    public void leaveRoom(String sessionId) {
        String roomCode = roomDirectory.getRoomCodeBySessionId(sessionId);
        if (roomCode == null) {
            log.debug("이미 방에 없는 세션의 퇴장 처리: {}", sessionId);
            return;
        }

        Optional<Room> roomOpt = roomDirectory.findRoomByCode(roomCode);
        if (roomOpt.isEmpty()) {
            roomDirectory.deleteSessionRoomMapping(sessionId);
            return;
        }
        Room room = roomOpt.get();

        LockResult<Void> result = lockFacade.execute(room, () -> {
            leaveLocked(room, sessionId);
        });

        if (result.isRoomClosed()) {
            roomDirectory.deleteSessionRoomMapping(sessionId);
        } else if (result.isLockFailed()) {
            log.error("방 퇴장 락 획득 실패: room={}, session={}", roomCode, sessionId);
        }
    }

    private void leaveLocked(Room room, String sessionId) {
        roomDirectory.deleteSessionRoomMapping(sessionId);
        Optional<Player> removed = room.removePlayer(sessionId);
        if (removed.isEmpty()) {
            return;
        }

        boolean hostChanged = room.electHost();

        if (room.isEmpty()) {
            roomDirectory.deleteRoom(room);
            log.info("방 삭제 완료: {}", room.getRoomCode());
            return;
        }

        responseSender.broadcastRosterUpdate(room);
        if (hostChanged) {
            responseSender.broadcastHostChanged(room);
            log.info("방장 위임: room={}, 구 방장={} -> 새 방장={}",
                    room.getRoomCode(), sessionId, room.getHostSessionId());
        }

        log.info("방 퇴장 처리 완료: room={}, name={}, 남은 인원={}",
                room.getRoomCode(), removed.get().getName(), room.size());
    }
}
