package com.copyleft.LetterClash.domain.type;

public enum RoomPhase {
    LOBBY,        // 입장 대기, 진행 중인 라운드 없음
    ROUND_ACTIVE, // 라운드 진행 중 (답안 수집)
    SCORED        // 현재 라운드 채점 완료, 다음 start 대기
}
