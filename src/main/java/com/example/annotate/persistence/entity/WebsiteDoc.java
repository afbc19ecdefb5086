package com.example.annotate.persistence.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.TypeAlias;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Indexed website. The id is the content hash of the URL and is never rewritten;
 * later indexing calls only refresh the metadata fields.
 */
@TypeAlias("WebsiteDoc")
@Document("websites")
public record WebsiteDoc(
        @Id
        String id,
        String indexor,
        String url,
        String title,
        String description,
        List<String> keywords,
        String image,
        String favicon,
        Instant indexedOn
) {
    public static WebsiteDoc indexed(String urlHash, String indexor, String url, WebsiteMetadata metadata, Instant now) {
        WebsiteMetadata m = metadata == null ? WebsiteMetadata.EMPTY : metadata.compact();
        return new WebsiteDoc(urlHash, indexor, url,
                m.title(), m.description(), m.keywords(), m.image(), m.favicon(), now);
    }
}
