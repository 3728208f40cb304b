package com.copyleft.LetterClash.domain.vo;

public record ScorePair(int host, int guest) {

    public static final ScorePair ZERO = new ScorePair(0, 0);

    public ScorePair plus(ScorePair other) {
        return new ScorePair(host + other.host, guest + other.guest);
    }
}
