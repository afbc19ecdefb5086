package com.example.annotate.mutation;

import com.example.annotate.aggregate.AggregateStore;
import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.identity.VerifiedIdentity;
import com.example.annotate.persistence.dao.DocumentStore;
import com.example.annotate.persistence.entity.WebsiteDoc;
import com.example.annotate.persistence.entity.WebsiteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * The single write path for website records, shared by explicit indexing and by the operations
 * that index a page on first contact.
 */
@Component
public class WebsiteIndexer {
    private static final Logger log = LoggerFactory.getLogger(WebsiteIndexer.class);

    private final DocumentStore documents;
    private final AggregateStore aggregates;
    private final Clock clock;

    public WebsiteIndexer(DocumentStore documents, AggregateStore aggregates, Clock clock) {
        this.documents = documents;
        this.aggregates = aggregates;
        this.clock = clock;
    }

    /**
     * Creates the website record, or refreshes its metadata when it already exists.
     * Emits {@code true} only when a record was created.
     */
    public Mono<Boolean> index(VerifiedIdentity identity, String urlHash, String url, WebsiteMetadata metadata) {
        return documents.getWebsite(urlHash)
                .flatMap(existing -> documents.refreshWebsiteMetadata(urlHash, metadata).thenReturn(false))
                .switchIfEmpty(Mono.defer(() -> create(identity, urlHash, url, metadata)));
    }

    /**
     * Indexes the website unless the aggregate store already has an impressions entry for it.
     */
    public Mono<Boolean> ensureIndexed(VerifiedIdentity identity, String urlHash, String url, WebsiteMetadata metadata) {
        return aggregates.hasImpressions(urlHash)
                .flatMap(indexed -> indexed ? Mono.just(false) : index(identity, urlHash, url, metadata));
    }

    private Mono<Boolean> create(VerifiedIdentity identity, String urlHash, String url, WebsiteMetadata metadata) {
        WebsiteDoc website = WebsiteDoc.indexed(urlHash, identity.uid(), url, metadata, Instant.now(clock));
        return documents.createWebsite(website)
                .doOnNext(doc -> log.info("indexWebsite: indexed {} by {}", urlHash, identity.uid()))
                .thenReturn(true)
                // Lost the creation race: the record exists now, so this becomes a refresh.
                .onErrorResume(e -> AnnotateException.is(e, ErrorKind.ALREADY_EXISTS),
                        e -> documents.refreshWebsiteMetadata(urlHash, metadata).thenReturn(false));
    }
}
