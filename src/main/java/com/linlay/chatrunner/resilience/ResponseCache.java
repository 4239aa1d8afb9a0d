package com.linlay.chatrunner.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.linlay.chatrunner.config.ResilienceProperties;
import com.linlay.chatrunner.model.LlmDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Completed upstream responses keyed by request fingerprint.
 * <p>
 * Entries expire a fixed TTL after being written. Expired entries are never returned from
 * {@link #get(String)} and are physically removed by the periodic {@link #sweep()}.
 */
@Component
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final Cache<String, CacheEntry> entries;
    private final Duration ttl;

    @Autowired
    public ResponseCache(ResilienceProperties properties) {
        this(properties.cache().ttl(), properties.cache().maximumSize(), Ticker.systemTicker());
    }

    public ResponseCache(Duration ttl, long maximumSize, Ticker ticker) {
        this.ttl = ttl;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    public Optional<CacheEntry> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public void put(String key, List<LlmDelta> deltas) {
        if (key == null || deltas == null || deltas.isEmpty()) {
            return;
        }
        entries.put(key, new CacheEntry(key, deltas, Instant.now(), ttl));
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    @Scheduled(fixedDelayString = "${chat.resilience.cache.sweep-interval:PT1M}")
    public void sweep() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        long after = entries.estimatedSize();
        if (before != after) {
            log.debug("Response cache sweep evicted {} entries, {} remain", before - after, after);
        }
    }
}
