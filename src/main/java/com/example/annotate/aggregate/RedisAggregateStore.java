package com.example.annotate.aggregate;

import com.example.annotate.config.AnnotateProps;
import com.example.annotate.store.StoreCalls;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.example.annotate.aggregate.AggregateKeys.*;

@Component
public class RedisAggregateStore implements AggregateStore {

    private final ReactiveStringRedisTemplate redis;
    private final StoreCalls calls;

    public RedisAggregateStore(ReactiveStringRedisTemplate redis, AnnotateProps props) {
        this.redis = redis;
        this.calls = new StoreCalls("redis", props.store());
    }

    private ReactiveHashOperations<String, String, String> hash() {
        return redis.<String, String>opsForHash();
    }

    @Override
    public Mono<Long> getImpressions(String urlHash) {
        return readCount(website(urlHash), IMPRESSIONS);
    }

    @Override
    public Mono<Boolean> hasImpressions(String urlHash) {
        return calls.read(hash().hasKey(website(urlHash), IMPRESSIONS))
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Long> getCommentCount(String urlHash) {
        return readCount(website(urlHash), COMMENT_COUNT);
    }

    @Override
    public Mono<Long> getFlagCount(String urlHash) {
        return readCount(website(urlHash), FLAG_COUNT);
    }

    @Override
    public Mono<Map<FlagReason, Long>> getFlagDistribution(String urlHash) {
        return calls.read(hash().entries(flagDistribution(urlHash)))
                .collect(() -> new EnumMap<FlagReason, Long>(FlagReason.class),
                        (acc, e) -> FlagReason.parse(e.getKey())
                                .ifPresent(reason -> acc.put(reason, nonNegative(Long.parseLong(e.getValue())))))
                .map(Collections::unmodifiableMap);
    }

    @Override
    public Mono<Long> getFlagDistributionForReason(String urlHash, FlagReason reason) {
        return readCount(flagDistribution(urlHash), reason.name());
    }

    @Override
    public Mono<Double> getCumulativeWeight(String urlHash) {
        return calls.read(hash().get(website(urlHash), FLAGS_CUMULATIVE_WEIGHT))
                .map(Double::parseDouble)
                .map(w -> Math.max(0d, w))
                .defaultIfEmpty(0d);
    }

    @Override
    public Mono<Void> incrementCommentCount(String urlHash, long delta) {
        return calls.write(hash().increment(website(urlHash), COMMENT_COUNT, delta)).then();
    }

    @Override
    public Mono<Void> incrementFlagCount(String urlHash, long delta) {
        return calls.write(hash().increment(website(urlHash), FLAG_COUNT, delta)).then();
    }

    @Override
    public Mono<Void> incrementDistribution(String urlHash, FlagReason reason, long delta) {
        return calls.write(hash().increment(flagDistribution(urlHash), reason.name(), delta)).then();
    }

    @Override
    public Mono<Void> incrementWeight(String urlHash, double delta) {
        return calls.write(hash().increment(website(urlHash), FLAGS_CUMULATIVE_WEIGHT, delta)).then();
    }

    private Mono<Long> readCount(String key, String field) {
        return calls.read(hash().get(key, field))
                .map(Long::parseLong)
                .map(RedisAggregateStore::nonNegative)
                .defaultIfEmpty(0L);
    }

    // Counters are a derived view; drift below zero reads as zero.
    private static long nonNegative(long v) {
        return Math.max(0L, v);
    }
}
