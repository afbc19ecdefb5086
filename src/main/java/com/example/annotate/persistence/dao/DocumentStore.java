package com.example.annotate.persistence.dao;

import com.example.annotate.persistence.entity.CommentDoc;
import com.example.annotate.persistence.entity.FlatCommentDoc;
import com.example.annotate.persistence.entity.MarkerDoc;
import com.example.annotate.persistence.entity.MarkerKey;
import com.example.annotate.persistence.entity.WebsiteDoc;
import com.example.annotate.persistence.entity.WebsiteMetadata;
import reactor.core.publisher.Mono;

/**
 * Authoritative content store. Every {@code create*} call fails with
 * {@code ALREADY_EXISTS} on an id collision and never upserts.
 */
public interface DocumentStore {

    Mono<WebsiteDoc> getWebsite(String urlHash);

    Mono<WebsiteDoc> createWebsite(WebsiteDoc website);

    /**
     * Sets the non-empty metadata fields of an existing website; empty fields are left untouched.
     */
    Mono<Void> refreshWebsiteMetadata(String urlHash, WebsiteMetadata metadata);

    Mono<CommentDoc> createComment(CommentDoc comment);

    Mono<CommentDoc> getComment(String urlHash, String commentId);

    /**
     * Fails with {@code NOT_FOUND} when the comment does not exist.
     */
    Mono<Void> updateCommentBody(String urlHash, String commentId, String body);

    /**
     * Completes with {@code false} when there was nothing to delete.
     */
    Mono<Boolean> deleteComment(String urlHash, String commentId);

    Mono<FlatCommentDoc> createFlatComment(FlatCommentDoc flatComment);

    Mono<FlatCommentDoc> getFlatComment(String owner, String commentId);

    /**
     * Deletes the flat comment only if it shadows the comment on {@code urlHash}.
     */
    Mono<Void> deleteFlatComment(String owner, String commentId, String urlHash);

    Mono<MarkerDoc> getMarker(MarkerKey key);

    Mono<MarkerDoc> createMarker(MarkerDoc marker);

    /**
     * Replaces the marker value only if it still equals {@code expected}.
     */
    Mono<Boolean> swapMarkerValue(MarkerKey key, String expected, String next);

    /**
     * Deletes the marker only if its value still equals {@code expected}.
     */
    Mono<Boolean> deleteMarker(MarkerKey key, String expected);
}
