package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.model.LlmDelta;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CacheEntry(
        String key,
        List<LlmDelta> deltas,
        Instant createdAt,
        Duration ttl
) {

    public CacheEntry {
        deltas = deltas == null ? List.of() : List.copyOf(deltas);
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }
}
