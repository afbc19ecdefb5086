package com.example.annotate.persistence.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.TypeAlias;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-author shadow of a {@link CommentDoc}, id {@code {owner}/{commentId}}.
 */
@TypeAlias("FlatCommentDoc")
@Document("flatComments")
public record FlatCommentDoc(
        @Id
        String id,
        @Indexed
        String owner,
        String commentId,
        String urlHash,
        String url,
        String domain,
        Instant createdAt
) {
    public static String key(String owner, String commentId) {
        return owner + "/" + commentId;
    }

    public static FlatCommentDoc of(CommentDoc comment) {
        return new FlatCommentDoc(key(comment.author(), comment.commentId()), comment.author(),
                comment.commentId(), comment.urlHash(), comment.url(), comment.domain(), comment.createdAt());
    }
}
