package com.example.annotate.persistence.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.TypeAlias;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Presence record of a per-user action on a target (vote, flag, bookmark, report).
 * {@code value} holds the vote direction or flag reason where the kind needs one.
 */
@TypeAlias("MarkerDoc")
@Document("markers")
public record MarkerDoc(
        @Id
        String id,
        MarkerKind kind,
        @Indexed
        String owner,
        String target,
        String value,
        Instant createdAt
) {
    public static MarkerDoc of(MarkerKey key, String value, Instant now) {
        return new MarkerDoc(key.id(), key.kind(), key.owner(), key.target(), value, now);
    }
}
