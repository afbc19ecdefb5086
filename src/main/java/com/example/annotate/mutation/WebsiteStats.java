package com.example.annotate.mutation;

import com.example.annotate.aggregate.AggregateStore;
import com.example.annotate.aggregate.FlagReason;
import com.example.annotate.error.OperationBoundary;
import com.example.annotate.error.Outcome;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Read surface over the aggregate store. Missing keys read as zero values, never as failures.
 */
@Service
public class WebsiteStats {

    private final OperationBoundary boundary;
    private final AggregateStore aggregates;

    public WebsiteStats(OperationBoundary boundary, AggregateStore aggregates) {
        this.boundary = boundary;
        this.aggregates = aggregates;
    }

    public Mono<Outcome<Long>> impressions(String urlHash) {
        return boundary.run("getImpressions", urlHash, () -> aggregates.getImpressions(urlHash));
    }

    public Mono<Outcome<Long>> commentCount(String urlHash) {
        return boundary.run("getCommentCount", urlHash, () -> aggregates.getCommentCount(urlHash));
    }

    public Mono<Outcome<Long>> flagCount(String urlHash) {
        return boundary.run("getFlagCount", urlHash, () -> aggregates.getFlagCount(urlHash));
    }

    public Mono<Outcome<Map<FlagReason, Long>>> flagDistribution(String urlHash) {
        return boundary.run("getFlagDistribution", urlHash, () -> aggregates.getFlagDistribution(urlHash));
    }

    public Mono<Outcome<Long>> flagDistributionForReason(String urlHash, FlagReason reason) {
        return boundary.run("getFlagDistributionForReason", Map.of("urlHash", urlHash, "reason", reason),
                () -> aggregates.getFlagDistributionForReason(urlHash, reason));
    }

    public Mono<Outcome<Double>> cumulativeWeight(String urlHash) {
        return boundary.run("getCumulativeWeight", urlHash, () -> aggregates.getCumulativeWeight(urlHash));
    }
}
