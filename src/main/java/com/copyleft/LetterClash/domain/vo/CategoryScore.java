package com.copyleft.LetterClash.domain.vo;

public record CategoryScore(
        int index,
        String hostAnswer,
        String guestAnswer,
        boolean hostValid,
        boolean guestValid,
        boolean duplicate,
        int hostPoints,
        int guestPoints
) {}
