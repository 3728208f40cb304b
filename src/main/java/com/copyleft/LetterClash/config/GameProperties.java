package com.copyleft.LetterClash.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rule")
public record GameProperties(
        // 방 정원
        int defaultMaxPlayers,   // 기본 정원 (MAX_PLAYERS, 기본 4)
        int minMaxPlayers,       // 첫 입장자가 지정할 수 있는 최소 정원
        int maxMaxPlayers,       // 첫 입장자가 지정할 수 있는 최대 정원
        int minPlayersToStart,   // 라운드 시작 최소 인원

        // 라운드 설정
        int defaultCategoryCount, // 채점 시 최소로 평가하는 카테고리 수
        int defaultRoundSeconds,  // 라운드 시간이 없을 때 기본값 (초)
        int minAnswerLetters,     // 유효 답안의 최소 글자 수

        // 입력 길이 제한
        int roomCodeLength,
        int maxNameLength,
        int maxAnswerLength,
        int maxChatLength,
        int maxLetterLength
) {}
