package com.copyleft.LetterClash.infra.websocket;

import com.copyleft.LetterClash.infra.websocket.dto.DeliveryReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public boolean sendEventToSession(String sessionId, Object event) {
        return !broadcast(List.of(sessionId), event).hasFailures();
    }

    /**
     * 한 번 직렬화한 뒤 수신자마다 따로 전송한다. 한 수신자의 실패는 나머지 전송이나 방 명단에 영향을 주지 않는다.
     */
    public DeliveryReport broadcast(Collection<String> sessionIds, Object event) {
        if (sessionIds.isEmpty()) {
            return DeliveryReport.EMPTY;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("이벤트 직렬화 실패: [이벤트: {}]", event.getClass().getSimpleName(), e);
            return new DeliveryReport(sessionIds.size(), List.copyOf(sessionIds));
        }

        TextMessage message = new TextMessage(payload);
        List<String> failed = new ArrayList<>();
        for (String sessionId : sessionIds) {
            if (!sendLocal(sessionId, message)) {
                failed.add(sessionId);
            }
        }

        DeliveryReport report = new DeliveryReport(sessionIds.size(), failed);
        if (report.hasFailures()) {
            log.warn("일부 수신자 전송 실패: [성공: {}/{}], [실패 세션: {}]",
                    report.delivered(), report.attempted(), report.failedSessionIds());
        } else {
            log.debug("이벤트 전송: [수신자: {}], [페이로드: {}]", report.attempted(), payload);
        }
        return report;
    }

    public void close(String sessionId, CloseStatus status) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("세션 종료 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
        }
    }

    private boolean sendLocal(String sessionId, TextMessage message) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) {
            log.debug("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
            return false;
        }
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | RuntimeException e) {
            log.debug("전송 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
            return false;
        }
    }
}
