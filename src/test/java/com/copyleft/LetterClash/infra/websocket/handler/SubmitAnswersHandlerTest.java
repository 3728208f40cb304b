package com.copyleft.LetterClash.infra.websocket.handler;

import com.copyleft.LetterClash.feature.game.GameService;
import com.copyleft.LetterClash.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubmitAnswersHandlerTest {

    @Mock private GameService gameService;
    @Mock private WebSocketSession session;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SubmitAnswersHandler handler;

    @BeforeEach
    void setUp() {
        handler = new SubmitAnswersHandler(gameService, TestProperties.game(), objectMapper);
        lenient().when(session.getId()).thenReturn("s1");
    }

    @Test
    @DisplayName("답안은 문자열로 바꾸고 64자로 자른다")
    void handle_StringifiesAndTruncates() throws Exception {
        String longAnswer = "a".repeat(80);

        handler.handle(session, objectMapper.readTree(
                "{\"t\":\"answers\",\"answers\":[\"" + longAnswer + "\", 42, null]}"));

        verify(gameService).submitAnswers("s1", List.of("a".repeat(64), "42", ""));
    }

    @Test
    @DisplayName("answers 가 배열이 아니면 빈 답안으로 제출한다")
    void handle_NonArray() throws Exception {
        handler.handle(session, objectMapper.readTree("{\"t\":\"answers\",\"answers\":\"oops\"}"));

        verify(gameService).submitAnswers("s1", List.of());
    }
}
