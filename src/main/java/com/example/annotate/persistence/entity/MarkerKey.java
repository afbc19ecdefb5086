package com.example.annotate.persistence.entity;

/**
 * One marker per (kind, owner, target). The target is a url hash, or {@code {urlHash}/{commentId}}
 * for comments.
 */
public record MarkerKey(MarkerKind kind, String owner, String target) {

    public static MarkerKey website(MarkerKind kind, String owner, String urlHash) {
        return new MarkerKey(kind, owner, urlHash);
    }

    public static MarkerKey comment(MarkerKind kind, String owner, String urlHash, String commentId) {
        return new MarkerKey(kind, owner, CommentDoc.key(urlHash, commentId));
    }

    public String id() {
        return kind.name() + ":" + owner + ":" + target;
    }
}
