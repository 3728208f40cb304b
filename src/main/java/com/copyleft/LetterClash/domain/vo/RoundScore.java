package com.copyleft.LetterClash.domain.vo;

import java.util.List;

public record RoundScore(ScorePair delta, List<CategoryScore> categories) {

    public RoundScore {
        categories = List.copyOf(categories);
    }

    public int hostDelta() {
        return delta.host();
    }

    public int guestDelta() {
        return delta.guest();
    }
}
