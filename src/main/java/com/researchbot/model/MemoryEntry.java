package com.researchbot.model;

import java.time.Instant;

public record MemoryEntry(String sessionId, String ticker, Report report, Instant storedAt) {
}
