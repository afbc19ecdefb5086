package com.example.annotate.mutation;

import com.example.annotate.aggregate.AggregateStore;
import com.example.annotate.error.AnnotateException;
import com.example.annotate.error.ErrorKind;
import com.example.annotate.error.OperationBoundary;
import com.example.annotate.error.Outcome;
import com.example.annotate.identity.Caller;
import com.example.annotate.identity.IdentityVerifier;
import com.example.annotate.identity.VerifiedIdentity;
import com.example.annotate.mutation.dto.AddCommentRequest;
import com.example.annotate.mutation.dto.CommentRef;
import com.example.annotate.mutation.dto.EditCommentRequest;
import com.example.annotate.persistence.dao.DocumentStore;
import com.example.annotate.persistence.entity.CommentDoc;
import com.example.annotate.persistence.entity.FlatCommentDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import com.example.annotate.persistence.entity.MarkerKind;
import com.example.annotate.util.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.function.BiFunction;

/**
 * Comment lifecycle and per-comment signals.
 * <p>
 * Writes that span both stores go document first, counter second, and are not rolled back:
 * a failure in between leaves the counter behind the documents until it is reconciled.
 */
@Service
public class CommentOperations {
    private static final Logger log = LoggerFactory.getLogger(CommentOperations.class);

    private final OperationBoundary boundary;
    private final IdentityVerifier identity;
    private final ContentHasher hasher;
    private final WebsiteIndexer indexer;
    private final OwnershipGuard ownership;
    private final MarkerToggles toggles;
    private final DocumentStore documents;
    private final AggregateStore aggregates;
    private final Clock clock;

    public CommentOperations(OperationBoundary boundary,
                             IdentityVerifier identity,
                             ContentHasher hasher,
                             WebsiteIndexer indexer,
                             OwnershipGuard ownership,
                             MarkerToggles toggles,
                             DocumentStore documents,
                             AggregateStore aggregates,
                             Clock clock) {
        this.boundary = boundary;
        this.identity = identity;
        this.hasher = hasher;
        this.indexer = indexer;
        this.ownership = ownership;
        this.toggles = toggles;
        this.documents = documents;
        this.aggregates = aggregates;
        this.clock = clock;
    }

    public Mono<Outcome<Void>> addComment(Caller caller, AddCommentRequest req) {
        return boundary.run("addComment", req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    String commentId = Payloads.requireText(req.commentId(), "commentId");
                    String body = Payloads.requireText(req.body(), "body");
                    CommentDoc comment = CommentDoc.create(commentId, urlHash, req.domain(), req.url(), id.uid(), body,
                            Instant.now(clock));

                    // Flat comments are keyed by author and id only, so the id must be free across all pages.
                    return documents.getFlatComment(id.uid(), commentId)
                            .flatMap(taken -> Mono.<CommentDoc>error(new AnnotateException(ErrorKind.ALREADY_EXISTS,
                                    "comment id " + commentId + " already used by " + id.uid() + " on " + taken.urlHash())))
                            .then(documents.createComment(comment))
                            .then(indexer.ensureIndexed(id, urlHash, req.url(), req.website()))
                            .then(aggregates.incrementCommentCount(urlHash, 1))
                            .then(documents.createFlatComment(FlatCommentDoc.of(comment)))
                            .doOnNext(flat -> log.info("addComment: {} added {} on {}", id.uid(), commentId, urlHash));
                })
                .then());
    }

    public Mono<Outcome<Void>> deleteComment(Caller caller, CommentRef req) {
        return onComment("deleteComment", caller, req, (id, urlHash) ->
                ownership.requireAuthor(id, urlHash, req.commentId())
                        .flatMap(comment -> documents.deleteComment(urlHash, req.commentId())
                                .flatMap(deleted -> deleted
                                        ? aggregates.incrementCommentCount(urlHash, -1)
                                                .then(documents.deleteFlatComment(comment.author(), req.commentId(), urlHash))
                                        : Mono.<Void>error(new AnnotateException(ErrorKind.NOT_FOUND,
                                                "comment " + req.commentId() + " was already deleted")))));
    }

    public Mono<Outcome<Void>> editComment(Caller caller, EditCommentRequest req) {
        CommentRef ref = new CommentRef(req.url(), req.urlHash(), req.commentId());
        return boundary.run("editComment", req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(ref.url(), ref.urlHash());
                    Payloads.requireText(ref.commentId(), "commentId");
                    String body = Payloads.requireText(req.body(), "body");

                    return ownership.requireAuthor(id, urlHash, ref.commentId())
                            .then(documents.updateCommentBody(urlHash, ref.commentId(), body));
                }));
    }

    public Mono<Outcome<Void>> reportComment(Caller caller, CommentRef req) {
        return signal("reportComment", MarkerKind.COMMENT_REPORT, caller, req);
    }

    public Mono<Outcome<Void>> notInterestedInComment(Caller caller, CommentRef req) {
        return signal("notInterestedInComment", MarkerKind.COMMENT_NOT_INTERESTED, caller, req);
    }

    public Mono<Outcome<Void>> upvoteComment(Caller caller, CommentRef req) {
        return vote("upvoteComment", VoteDirection.UP, caller, req);
    }

    public Mono<Outcome<Void>> downvoteComment(Caller caller, CommentRef req) {
        return vote("downvoteComment", VoteDirection.DOWN, caller, req);
    }

    public Mono<Outcome<Void>> bookmarkComment(Caller caller, CommentRef req) {
        return onComment("bookmarkComment", caller, req, (id, urlHash) ->
                ownership.requireComment(urlHash, req.commentId())
                        .then(toggles.togglePresence(
                                MarkerKey.comment(MarkerKind.COMMENT_BOOKMARK, id.uid(), urlHash, req.commentId())))
                        .then());
    }

    private Mono<Outcome<Void>> vote(String operation, VoteDirection direction, Caller caller, CommentRef req) {
        return onComment(operation, caller, req, (id, urlHash) ->
                ownership.requireComment(urlHash, req.commentId())
                        .then(toggles.toggleVote(
                                MarkerKey.comment(MarkerKind.COMMENT_VOTE, id.uid(), urlHash, req.commentId()), direction))
                        .doOnNext(t -> log.debug("{}: {} on {} -> {}", operation, id.uid(), req.commentId(), t))
                        .then());
    }

    // Append-only: a repeated signal is accepted and changes nothing.
    private Mono<Outcome<Void>> signal(String operation, MarkerKind kind, Caller caller, CommentRef req) {
        return onComment(operation, caller, req, (id, urlHash) ->
                ownership.requireComment(urlHash, req.commentId())
                        .then(toggles.recordOnce(MarkerKey.comment(kind, id.uid(), urlHash, req.commentId())))
                        .doOnNext(recorded -> {
                            if (!recorded) log.debug("{}: {} already signalled {}", operation, id.uid(), req.commentId());
                        })
                        .then());
    }

    private Mono<Outcome<Void>> onComment(String operation, Caller caller, CommentRef req,
                                          BiFunction<VerifiedIdentity, String, Mono<Void>> work) {
        return boundary.run(operation, req, () -> identity.verify(caller)
                .flatMap(id -> {
                    String urlHash = hasher.requireMatch(req.url(), req.urlHash());
                    Payloads.requireText(req.commentId(), "commentId");
                    return work.apply(id, urlHash);
                }));
    }
}
