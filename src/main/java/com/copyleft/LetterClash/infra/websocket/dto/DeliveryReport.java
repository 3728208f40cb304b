package com.copyleft.LetterClash.infra.websocket.dto;

import java.util.List;

public record DeliveryReport(int attempted, List<String> failedSessionIds) {

    public static final DeliveryReport EMPTY = new DeliveryReport(0, List.of());

    public DeliveryReport {
        failedSessionIds = List.copyOf(failedSessionIds);
    }

    public int delivered() {
        return attempted - failedSessionIds.size();
    }

    public boolean hasFailures() {
        return !failedSessionIds.isEmpty();
    }
}
