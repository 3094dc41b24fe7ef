package com.nevis.corpus.infra;

import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter, one greedy-refill bucket per key. Blocks the caller until a permit is free.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;

    public InMemoryRpmRateLimiter(int requestsPerMinute) {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be positive: " + requestsPerMinute);
        }
        this.requestsPerMinute = requestsPerMinute;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(limit -> limit.capacity(requestsPerMinute).refillGreedy(requestsPerMinute, Duration.ofMinutes(1)))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        int requested = Math.min(Math.max(permits, 1), requestsPerMinute);
        buckets.computeIfAbsent(key, k -> createBucket())
            .asBlocking()
            .consume(requested);
    }
}
