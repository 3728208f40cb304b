package com.copyleft.LetterClash.web;

import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 배포 환경의 상태 확인용. 매핑되지 않은 경로는 오류 페이지 대신 안내 문구로 응답한다.
 */
@RestController
public class HealthController implements ErrorController {

    static final String INFO_BODY = "LetterClash WebSocket server is running. Connect via WebSocket.";

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return plainText("OK");
    }

    @RequestMapping({"/", "/error"})
    public ResponseEntity<String> info() {
        return plainText(INFO_BODY);
    }

    private static ResponseEntity<String> plainText(String body) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
