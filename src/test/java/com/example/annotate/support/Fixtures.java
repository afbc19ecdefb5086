package com.example.annotate.support;

import com.example.annotate.aggregate.FlagWeights;
import com.example.annotate.config.AnnotateProperties;
import com.example.annotate.error.OperationBoundary;
import com.example.annotate.identity.Caller;
import com.example.annotate.identity.IdentityVerifier;
import com.example.annotate.mutation.CommentOperations;
import com.example.annotate.mutation.MarkerToggles;
import com.example.annotate.mutation.OwnershipGuard;
import com.example.annotate.mutation.WebsiteIndexer;
import com.example.annotate.mutation.WebsiteOperations;
import com.example.annotate.mutation.WebsiteStats;
import com.example.annotate.util.ContentHasher;
import com.fasterxml.jackson.databind.json.JsonMapper;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operations wired against in-memory stores.
 */
public final class Fixtures {
    public final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
    public final InMemoryDocumentStore documents = new InMemoryDocumentStore(clock);
    public final InMemoryAggregateStore aggregates = new InMemoryAggregateStore();
    public final Map<String, String> usernames = new ConcurrentHashMap<>();
    public final ContentHasher hasher = new ContentHasher();
    public final FlagWeights weights = new FlagWeights(new AnnotateProperties(null, null));
    public final OperationBoundary boundary = new OperationBoundary(JsonMapper.builder().findAndAddModules().build());
    public final IdentityVerifier identity = new IdentityVerifier(uid -> Mono.justOrEmpty(usernames.get(uid)));
    public final WebsiteIndexer indexer = new WebsiteIndexer(documents, aggregates, clock);
    public final MarkerToggles toggles = new MarkerToggles(documents, clock);
    public final OwnershipGuard ownership = new OwnershipGuard(documents);
    public final WebsiteOperations websites =
            new WebsiteOperations(boundary, identity, hasher, indexer, toggles, aggregates, weights);
    public final CommentOperations comments =
            new CommentOperations(boundary, identity, hasher, indexer, ownership, toggles, documents, aggregates, clock);
    public final WebsiteStats stats = new WebsiteStats(boundary, aggregates);

    public Caller register(String uid, String displayName, String username) {
        usernames.put(uid, username);
        return new Caller(uid, displayName);
    }
}
