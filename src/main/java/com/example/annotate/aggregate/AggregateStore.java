package com.example.annotate.aggregate;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Derived per-website counters kept in the fast store, keyed by the website's content hash.
 * <p>
 * Reads never fail for a missing key; they complete with the zero value. Increments are applied
 * atomically by the store; deltas may be negative.
 */
public interface AggregateStore {

    Mono<Long> getImpressions(String urlHash);

    /**
     * Whether an impressions entry exists at all; its absence marks a website as not indexed yet.
     */
    Mono<Boolean> hasImpressions(String urlHash);

    Mono<Long> getCommentCount(String urlHash);

    Mono<Long> getFlagCount(String urlHash);

    Mono<Map<FlagReason, Long>> getFlagDistribution(String urlHash);

    Mono<Long> getFlagDistributionForReason(String urlHash, FlagReason reason);

    Mono<Double> getCumulativeWeight(String urlHash);

    Mono<Void> incrementCommentCount(String urlHash, long delta);

    Mono<Void> incrementFlagCount(String urlHash, long delta);

    Mono<Void> incrementDistribution(String urlHash, FlagReason reason, long delta);

    Mono<Void> incrementWeight(String urlHash, double delta);
}
