package com.example.annotate.support;

import com.example.annotate.aggregate.AggregateStore;
import com.example.annotate.aggregate.FlagReason;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Aggregate store held in maps. Like Redis, a decremented counter keeps its (possibly zero) entry.
 */
public class InMemoryAggregateStore implements AggregateStore {

    private final Map<String, Long> impressions = new HashMap<>();
    private final Map<String, Long> commentCounts = new HashMap<>();
    private final Map<String, Long> flagCounts = new HashMap<>();
    private final Map<String, Map<FlagReason, Long>> distributions = new HashMap<>();
    private final Map<String, Double> weights = new HashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    public synchronized void setImpressions(String urlHash, long count) {
        impressions.put(urlHash, count);
    }

    public int writes() {
        return writes.get();
    }

    @Override
    public Mono<Long> getImpressions(String urlHash) {
        return read(() -> impressions.getOrDefault(urlHash, 0L));
    }

    @Override
    public Mono<Boolean> hasImpressions(String urlHash) {
        return read(() -> impressions.containsKey(urlHash));
    }

    @Override
    public Mono<Long> getCommentCount(String urlHash) {
        return read(() -> commentCounts.getOrDefault(urlHash, 0L));
    }

    @Override
    public Mono<Long> getFlagCount(String urlHash) {
        return read(() -> flagCounts.getOrDefault(urlHash, 0L));
    }

    @Override
    public Mono<Map<FlagReason, Long>> getFlagDistribution(String urlHash) {
        return read(() -> {
            Map<FlagReason, Long> d = distributions.get(urlHash);
            return d == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(d));
        });
    }

    @Override
    public Mono<Long> getFlagDistributionForReason(String urlHash, FlagReason reason) {
        return read(() -> distributions.getOrDefault(urlHash, Map.of()).getOrDefault(reason, 0L));
    }

    @Override
    public Mono<Double> getCumulativeWeight(String urlHash) {
        return read(() -> weights.getOrDefault(urlHash, 0d));
    }

    @Override
    public Mono<Void> incrementCommentCount(String urlHash, long delta) {
        return write(() -> commentCounts.merge(urlHash, delta, Long::sum));
    }

    @Override
    public Mono<Void> incrementFlagCount(String urlHash, long delta) {
        return write(() -> flagCounts.merge(urlHash, delta, Long::sum));
    }

    @Override
    public Mono<Void> incrementDistribution(String urlHash, FlagReason reason, long delta) {
        return write(() -> distributions.computeIfAbsent(urlHash, k -> new EnumMap<>(FlagReason.class))
                .merge(reason, delta, Long::sum));
    }

    @Override
    public Mono<Void> incrementWeight(String urlHash, double delta) {
        return write(() -> weights.merge(urlHash, delta, Double::sum));
    }

    private <T> Mono<T> read(java.util.function.Supplier<T> value) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return value.get();
            }
        });
    }

    private Mono<Void> write(Runnable change) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                change.run();
                writes.incrementAndGet();
            }
        });
    }
}
