package com.example.annotate.mutation;

import com.example.annotate.aggregate.AggregateStore;
import com.example.annotate.aggregate.FlagReason;
import com.example.annotate.aggregate.FlagWeights;
import com.example.annotate.error.OperationBoundary;
import com.example.annotate.error.Outcome;
import com.example.annotate.identity.Caller;
import com.example.annotate.identity.IdentityVerifier;
import com.example.annotate.mutation.dto.FlagWebsiteRequest;
import com.example.annotate.mutation.dto.IndexWebsiteRequest;
import com.example.annotate.mutation.dto.VoteWebsiteRequest;
import com.example.annotate.mutation.dto.WebsiteRef;
import com.example.annotate.persistence.entity.MarkerDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import com.example.annotate.persistence.entity.MarkerKind;
import com.example.annotate.util.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Website mutations: indexing, flagging, voting and bookmarking.
 */
@Service
public class WebsiteOperations {
    private static final Logger log = LoggerFactory.getLogger(WebsiteOperations.class);

    private final OperationBoundary boundary;
    private final IdentityVerifier identity;
    private final ContentHasher hasher;
    private final WebsiteIndexer indexer;
    private final MarkerToggles toggles;
    private final AggregateStore aggregates;
    private final FlagWeights weights;

    public WebsiteOperations(OperationBoundary boundary,
                             IdentityVerifier identity,
                             ContentHasher hasher,
                             WebsiteIndexer indexer,
                             MarkerToggles toggles,
                             AggregateStore aggregates,
                             FlagWeights weights) {
        this.boundary = boundary;
        this.identity = identity;
        this.hasher = hasher;
        this.indexer = indexer;
        this.toggles = toggles;
        this.aggregates = aggregates;
        this.weights = weights;
    }

    public Mono<Outcome<Void>> indexWebsite(Caller caller, IndexWebsiteRequest req) {
        return boundary.run("indexWebsite", req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    return indexer.index(id, urlHash, req.url(), req.website());
                })
                .then());
    }

    /**
     * Records the caller's flag on a website. A user counts once towards the flag count; flagging
     * again with another reason moves their contribution between reasons.
     */
    public Mono<Outcome<Void>> flagWebsite(Caller caller, FlagWebsiteRequest req) {
        return boundary.run("flagWebsite", req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    FlagReason reason = Payloads.requirePresent(req.reason(), "reason");
                    MarkerKey key = MarkerKey.website(MarkerKind.WEBSITE_FLAG, id.uid(), urlHash);

                    return toggles.current(key).flatMap(existing -> existing.isEmpty()
                            ? firstFlag(key, urlHash, reason)
                            : changeFlagReason(key, urlHash, existing.get(), reason));
                }));
    }

    private Mono<Void> firstFlag(MarkerKey key, String urlHash, FlagReason reason) {
        return toggles.create(key, reason.name())
                .then(aggregates.incrementFlagCount(urlHash, 1))
                .then(aggregates.incrementDistribution(urlHash, reason, 1))
                .then(aggregates.incrementWeight(urlHash, weights.weightOf(reason)));
    }

    private Mono<Void> changeFlagReason(MarkerKey key, String urlHash, MarkerDoc existing, FlagReason reason) {
        Optional<FlagReason> known = FlagReason.parse(existing.value());
        if (known.isEmpty()) {
            // Retired reason: it is no longer read back, so only the new reason is credited.
            log.info("flagWebsite: {} moves {} from retired reason {} to {}", key.owner(), urlHash, existing.value(), reason);
            return toggles.swap(key, existing.value(), reason.name())
                    .then(aggregates.incrementDistribution(urlHash, reason, 1))
                    .then(aggregates.incrementWeight(urlHash, weights.weightOf(reason)));
        }
        FlagReason previous = known.get();
        if (previous == reason) {
            log.debug("flagWebsite: {} already flagged {} as {}", key.owner(), urlHash, reason);
            return Mono.empty();
        }
        return toggles.swap(key, previous.name(), reason.name())
                .then(aggregates.incrementDistribution(urlHash, previous, -1))
                .then(aggregates.incrementDistribution(urlHash, reason, 1))
                .then(aggregates.incrementWeight(urlHash, weights.weightOf(reason) - weights.weightOf(previous)));
    }

    public Mono<Outcome<Void>> upvoteWebsite(Caller caller, VoteWebsiteRequest req) {
        return vote("upvoteWebsite", caller, req, VoteDirection.UP);
    }

    public Mono<Outcome<Void>> downvoteWebsite(Caller caller, VoteWebsiteRequest req) {
        return vote("downvoteWebsite", caller, req, VoteDirection.DOWN);
    }

    private Mono<Outcome<Void>> vote(String operation, Caller caller, VoteWebsiteRequest req, VoteDirection direction) {
        return boundary.run(operation, req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    MarkerKey key = MarkerKey.website(MarkerKind.WEBSITE_VOTE, id.uid(), urlHash);

                    return indexer.ensureIndexed(id, urlHash, req.url(), req.website())
                            .then(toggles.toggleVote(key, direction))
                            .doOnNext(t -> log.debug("{}: {} on {} -> {}", operation, id.uid(), urlHash, t));
                })
                .then());
    }

    public Mono<Outcome<Void>> bookmarkWebsite(Caller caller, WebsiteRef req) {
        return boundary.run("bookmarkWebsite", req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    return toggles.togglePresence(MarkerKey.website(MarkerKind.WEBSITE_BOOKMARK, id.uid(), urlHash));
                })
                .then());
    }
}
