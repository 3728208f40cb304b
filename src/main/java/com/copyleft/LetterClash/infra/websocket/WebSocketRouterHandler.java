package com.copyleft.LetterClash.infra.websocket;

import com.copyleft.LetterClash.feature.lobby.LobbyService;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.copyleft.LetterClash.infra.websocket.handler.WebSocketCommandHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class WebSocketRouterHandler extends TextWebSocketHandler {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final LobbyService lobbyService;
    private final Map<ClientMessageType, WebSocketCommandHandler> handlers = new EnumMap<>(ClientMessageType.class);

    public WebSocketRouterHandler(WebSocketSessionManager sessionManager,
                                  ObjectMapper objectMapper,
                                  LobbyService lobbyService,
                                  List<WebSocketCommandHandler> commandHandlers) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.lobbyService = lobbyService;

        for (WebSocketCommandHandler handler : commandHandlers) {
            WebSocketCommandHandler previous = handlers.put(handler.getType(), handler);
            if (previous != null) {
                throw new IllegalStateException("중복 커맨드 핸들러: " + handler.getType());
            }
        }
        List<ClientMessageType> missing = Arrays.stream(ClientMessageType.values())
                .filter(type -> !handlers.containsKey(type))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("핸들러가 없는 메시지 타입: " + missing);
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        log.info("새로운 세션 연결: {}", session.getId());
        sessionManager.registerSession(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String sessionId = session.getId();

        if (!sessionManager.tryAcquire(sessionId)) {
            log.debug("처리율 제한으로 메시지 폐기: {}", sessionId);
            return;
        }

        try {
            JsonNode root;
            try {
                root = objectMapper.readTree(message.getPayload());
            } catch (JsonProcessingException e) {
                log.debug("JSON 파싱 실패로 메시지 폐기: session={}, msg={}", sessionId, e.getOriginalMessage());
                return;
            }
            if (root == null || !root.isObject()) {
                log.debug("객체가 아닌 메시지 폐기: {}", sessionId);
                return;
            }

            JsonNode typeNode = root.get("t");
            Optional<ClientMessageType> type = ClientMessageType.fromWire(
                    typeNode != null && typeNode.isTextual() ? typeNode.textValue() : null);
            if (type.isEmpty()) {
                log.debug("알 수 없는 메시지 타입 폐기: session={}, t={}", sessionId, typeNode);
                return;
            }

            log.debug("메시지 수신: {}, Session: {}", type.get().getWireName(), sessionId);
            handlers.get(type.get()).handle(session, root);

        } catch (Exception e) {
            log.error("메시지 처리 중 오류: session={}, msg={}", sessionId, e.getMessage(), e);
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) throws Exception {
        sessionManager.markAlive(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        log.info("세션 연결 종료: {} (사유: {})", session.getId(), status);
        sessionManager.removeSession(session);
        lobbyService.leaveRoom(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("전송 오류 발생: [세션 ID: {}], [오류: {}]", session.getId(), exception.getMessage());
    }
}
