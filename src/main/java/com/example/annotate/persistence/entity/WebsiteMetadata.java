package com.example.annotate.persistence.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Page metadata scraped by the extension. Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebsiteMetadata(
        String title,
        String description,
        List<String> keywords,
        String image,
        String favicon
) {
    public static final WebsiteMetadata EMPTY = new WebsiteMetadata(null, null, null, null, null);

    /**
     * Same metadata with blank strings and empty lists turned into null, so they are left out of documents.
     */
    public WebsiteMetadata compact() {
        List<String> kw = keywords == null ? null : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();
        return new WebsiteMetadata(
                blankToNull(title),
                blankToNull(description),
                kw == null || kw.isEmpty() ? null : kw,
                blankToNull(image),
                blankToNull(favicon));
    }

    static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
