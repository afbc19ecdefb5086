package com.example.annotate.persistence.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.TypeAlias;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Comment on a website. Stored under the composite id {@code {urlHash}/{commentId}} so that a
 * second create with the same id fails instead of overwriting.
 */
@TypeAlias("CommentDoc")
@Document("comments")
public record CommentDoc(
        @Id
        String id,
        String commentId,
        @Indexed
        String urlHash,
        String domain,
        String url,
        String author,
        String body,
        int replyCount,
        Instant createdAt,
        Instant editedAt
) {
    public static String key(String urlHash, String commentId) {
        return urlHash + "/" + commentId;
    }

    public static CommentDoc create(String commentId, String urlHash, String domain, String url,
                                    String author, String body, Instant createdAt) {
        return new CommentDoc(key(urlHash, commentId), commentId, urlHash,
                WebsiteMetadata.blankToNull(domain), url, author, body, 0, createdAt, null);
    }
}
