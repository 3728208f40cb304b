package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.config.GameProperties;
import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.feature.game.dto.AnswersRequest;
import com.copyleft.LetterClash.global.constant.ClientMessageType;
import com.copyleft.LetterClash.global.util.JsonFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class SubmitAnswersHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final GameProperties gameProperties;
    private final ObjectMapper objectMapper;

    @Override
    public ClientMessageType getType() {
        return ClientMessageType.ANSWERS;
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            AnswersRequest dto = objectMapper.treeToValue(payload, AnswersRequest.class);
            List<String> answers = dto == null
                    ? List.of()
                    : JsonFields.asStringList(dto.getAnswers(), gameProperties.maxAnswerLength());
            gameService.submitAnswers(session.getId(), answers);
        } catch (JsonProcessingException e) {
            log.warn("[answers] 요청 형식 오류: session={}, msg={}", session.getId(), e.getOriginalMessage());
        }
    }
}
