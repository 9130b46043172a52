package me.golemcore.gateway.domain.model;

import java.time.Instant;

public record MemoryStats(long archivalCount, long currentCount, long totalSize, Instant lastUpdated) {
}
