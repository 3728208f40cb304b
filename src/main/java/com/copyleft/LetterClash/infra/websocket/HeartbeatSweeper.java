package com.copyleft.LetterClash.infra.websocket;

import com.copyleft.LetterClash.infra.websocket.event.ConnectionTimeoutEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * 직전 주기에 보낸 ping 에 pong 이 없었던 연결은 끊고, 나머지는 다시 ping 을 보낸다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeartbeatSweeper {

    private final WebSocketSessionManager sessionManager;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(fixedRateString = "${game.connection.heartbeat-interval-ms:30000}",
            initialDelayString = "${game.connection.heartbeat-interval-ms:30000}")
    public void sweep() {
        int terminated = 0;
        for (ConnectionState state : sessionManager.getConnections()) {
            if (state.isAwaitingPong()) {
                terminate(state);
                terminated++;
            } else {
                ping(state);
            }
        }
        if (terminated > 0) {
            log.info("응답 없는 연결 종료: {}개, 남은 연결: {}개", terminated, sessionManager.count());
        }
    }

    private void terminate(ConnectionState state) {
        String sessionId = state.getSessionId();
        sessionManager.removeSession(sessionId);
        try {
            state.getSession().close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.warn("응답 없는 세션 종료 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
        }
        eventPublisher.publishEvent(new ConnectionTimeoutEvent(sessionId));
    }

    private void ping(ConnectionState state) {
        state.markAwaitingPong();
        WebSocketSession session = state.getSession();
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new PingMessage());
        } catch (IOException | RuntimeException e) {
            log.debug("ping 전송 실패: [세션 ID: {}], [오류: {}]", state.getSessionId(), e.getMessage());
        }
    }
}
