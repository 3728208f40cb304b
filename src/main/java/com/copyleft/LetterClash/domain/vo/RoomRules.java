package com.copyleft.LetterClash.domain.vo;

public record RoomRules(boolean requireLetter, boolean dupZero) {

    public static RoomRules defaults() {
        return new RoomRules(true, true);
    }

    /**
     * null 인 항목은 기존 값을 유지한다.
     */
    public RoomRules merge(Boolean requireLetter, Boolean dupZero) {
        return new RoomRules(
                requireLetter != null ? requireLetter : this.requireLetter,
                dupZero != null ? dupZero : this.dupZero
        );
    }
}
